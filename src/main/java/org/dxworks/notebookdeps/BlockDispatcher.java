package org.dxworks.notebookdeps;

import org.dxworks.notebookdeps.analyzer.BlockAnalysisException;
import org.dxworks.notebookdeps.analyzer.BlockAnalyzer;
import org.dxworks.notebookdeps.model.AnalysisResult;
import org.dxworks.notebookdeps.model.Block;
import org.dxworks.notebookdeps.model.BlockError;

import java.util.Map;

/**
 * Routes each block to the analyzer for its type. This is the only place analysis failures are caught:
 * a block that cannot be analyzed yields an error result and never affects its neighbours.
 */
public class BlockDispatcher {

    private final Map<BlockType, BlockAnalyzer> analyzers;

    public BlockDispatcher() {
        this(BlockAnalyzerRegistry.buildAnalyzers());
    }

    BlockDispatcher(Map<BlockType, BlockAnalyzer> analyzers) {
        this.analyzers = analyzers;
    }

    public AnalysisResult dispatch(Block block) {
        String id = block != null ? block.getId() : null;
        try {
            if (block == null) {
                throw new IllegalArgumentException("block is null");
            }
            BlockAnalyzer analyzer = analyzers.get(BlockType.fromTag(block.getType()));
            return analyzer.analyze(block);
        } catch (RuntimeException | StackOverflowError e) {
            return AnalysisResult.failed(id, toError(e));
        }
    }

    static BlockError toError(Throwable e) {
        String kind = e instanceof BlockAnalysisException
                ? ((BlockAnalysisException) e).getKind()
                : e.getClass().getSimpleName();
        return new BlockError(kind, e.getMessage());
    }
}
