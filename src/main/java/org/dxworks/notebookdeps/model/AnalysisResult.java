package org.dxworks.notebookdeps.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.TreeSet;

/**
 * Per-block outcome consumed by the dependency graph.
 * All name lists are deduplicated and sorted so identical input serializes identically.
 */
@JsonPropertyOrder({"id", "definedVariables", "usedVariables", "importedModules", "error"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResult {
    public final String id;
    public final List<String> definedVariables;
    public final List<String> usedVariables;
    public final List<String> importedModules;
    public final BlockError error;

    private AnalysisResult(String id, Collection<String> definedVariables, Collection<String> usedVariables,
                           Collection<String> importedModules, BlockError error) {
        this.id = id;
        this.definedVariables = sortedDistinct(definedVariables);
        this.usedVariables = sortedDistinct(usedVariables);
        this.importedModules = sortedDistinct(importedModules);
        this.error = error;
    }

    public static AnalysisResult of(String id, Collection<String> definedVariables, Collection<String> usedVariables,
                                    Collection<String> importedModules) {
        return new AnalysisResult(id, definedVariables, usedVariables, importedModules, null);
    }

    public static AnalysisResult of(String id, Collection<String> definedVariables, Collection<String> usedVariables) {
        return of(id, definedVariables, usedVariables, List.of());
    }

    public static AnalysisResult empty(String id) {
        return of(id, List.of(), List.of(), List.of());
    }

    public static AnalysisResult failed(String id, BlockError error) {
        return new AnalysisResult(id, List.of(), List.of(), List.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }

    private static List<String> sortedDistinct(Collection<String> names) {
        if (names == null || names.isEmpty()) return Collections.emptyList();
        return Collections.unmodifiableList(new ArrayList<>(new TreeSet<>(names)));
    }
}
