package org.dxworks.notebookdeps.analyzer.python;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Global name sets of one analyzed fragment: names bound at module scope, names read that resolve
 * to a global, and the local aliases introduced by imports.
 */
public class ScopeAnalysis {
    private final Set<String> globalVars = new TreeSet<>();
    private final Set<String> usedGlobalVars = new TreeSet<>();
    private final Set<String> importedModules = new TreeSet<>();

    void addGlobal(String name) {
        globalVars.add(name);
    }

    void addUsed(String name) {
        usedGlobalVars.add(name);
    }

    void addImport(String name) {
        importedModules.add(name);
    }

    boolean isGlobal(String name) {
        return globalVars.contains(name);
    }

    public Set<String> getGlobalVars() {
        return Collections.unmodifiableSet(globalVars);
    }

    public Set<String> getUsedGlobalVars() {
        return Collections.unmodifiableSet(usedGlobalVars);
    }

    public Set<String> getImportedModules() {
        return Collections.unmodifiableSet(importedModules);
    }
}
