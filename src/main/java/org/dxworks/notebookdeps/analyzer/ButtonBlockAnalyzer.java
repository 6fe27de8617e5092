package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

import java.util.List;

public class ButtonBlockAnalyzer implements BlockAnalyzer {

    @Override
    public AnalysisResult analyze(Block block) {
        String variableName = Metadata.text(block.getMetadata(), Metadata.VARIABLE_NAME);
        return AnalysisResult.of(block.getId(),
                variableName != null ? List.of(variableName) : List.of(),
                List.of());
    }
}
