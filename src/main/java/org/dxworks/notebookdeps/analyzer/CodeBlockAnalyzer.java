package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.analyzer.python.PythonScopeAnalyzer;
import org.dxworks.notebookdeps.analyzer.python.ScopeAnalysis;
import org.dxworks.notebookdeps.analyzer.python.ShellEscapes;
import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

public class CodeBlockAnalyzer implements BlockAnalyzer {

    private final PythonScopeAnalyzer scopeAnalyzer = new PythonScopeAnalyzer();

    @Override
    public AnalysisResult analyze(Block block) {
        String code = ShellEscapes.neutralize(block.getContent());
        ScopeAnalysis scopes = scopeAnalyzer.analyze(code);
        return AnalysisResult.of(block.getId(),
                scopes.getGlobalVars(),
                scopes.getUsedGlobalVars(),
                scopes.getImportedModules());
    }
}
