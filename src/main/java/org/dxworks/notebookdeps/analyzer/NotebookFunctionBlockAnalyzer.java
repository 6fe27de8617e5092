package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * A notebook-function block calls another notebook. Inputs bound to a variable (and not overridden
 * by a literal) are read; enabled export mappings define variables.
 */
public class NotebookFunctionBlockAnalyzer implements BlockAnalyzer {

    private static final String VARIABLE_NAME = "variable_name";
    private static final String CUSTOM_VALUE = "custom_value";
    private static final String ENABLED = "enabled";

    @Override
    public AnalysisResult analyze(Block block) {
        List<String> inputs = new ArrayList<>();
        for (Object config : Metadata.section(block.getMetadata(), Metadata.FUNCTION_INPUTS).values()) {
            Map<?, ?> input = asMap(config);
            String variableName = Metadata.text(input, VARIABLE_NAME);
            if (input.get(CUSTOM_VALUE) == null && variableName != null) {
                inputs.add(VariableNameSanitizer.sanitize(variableName));
            }
        }

        List<String> outputs = new ArrayList<>();
        for (Object config : Metadata.section(block.getMetadata(), Metadata.FUNCTION_EXPORT_MAPPINGS).values()) {
            Map<?, ?> output = asMap(config);
            String variableName = Metadata.text(output, VARIABLE_NAME);
            if (Boolean.TRUE.equals(output.get(ENABLED)) && variableName != null) {
                outputs.add(VariableNameSanitizer.sanitize(variableName));
            }
        }

        return AnalysisResult.of(block.getId(), outputs, inputs);
    }

    private static Map<?, ?> asMap(Object config) {
        return config instanceof Map ? (Map<?, ?>) config : Map.of();
    }
}
