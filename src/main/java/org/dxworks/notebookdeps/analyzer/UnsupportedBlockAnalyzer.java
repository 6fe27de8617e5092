package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

/**
 * Markdown, images, separators and block types added after this analyzer was written neither
 * define nor read variables.
 */
public class UnsupportedBlockAnalyzer implements BlockAnalyzer {

    @Override
    public AnalysisResult analyze(Block block) {
        return AnalysisResult.empty(block.getId());
    }
}
