package org.dxworks.notebookdeps.analyzer;

import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;

/**
 * Extraction strategy for one block type. Implementations may throw; {@link BlockDispatcher}
 * turns any failure into an error result.
 */
public interface BlockAnalyzer {
    AnalysisResult analyze(Block block);
}
