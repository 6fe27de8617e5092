package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

import java.util.List;

/**
 * Input widgets ({@code input-text}, {@code input-slider}, ...) define the variable they are bound to.
 * The configured label is sanitized the way the kernel-side code generator names it.
 */
public class InputBlockAnalyzer implements BlockAnalyzer {

    @Override
    public AnalysisResult analyze(Block block) {
        Object variableName = block.getMetadata().get(Metadata.VARIABLE_NAME);
        if (variableName == null) {
            return AnalysisResult.empty(block.getId());
        }
        return AnalysisResult.of(block.getId(),
                List.of(VariableNameSanitizer.sanitize(variableName.toString())),
                List.of());
    }
}
