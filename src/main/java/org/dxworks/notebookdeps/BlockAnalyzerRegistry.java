package org.dxworks.notebookdeps;

import org.dxworks.notebookdeps.analyzer.*;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public class BlockAnalyzerRegistry {

    public static Map<BlockType, BlockAnalyzer> buildAnalyzers() {
        Map<BlockType, BlockAnalyzer> analyzers = new EnumMap<>(BlockType.class);
        for (BlockType type : BlockType.values()) {
            analyzers.put(type, createAnalyzer(type));
        }
        return Collections.unmodifiableMap(analyzers);
    }

    private static BlockAnalyzer createAnalyzer(BlockType type) {
        return switch (type) {
            case CODE -> new CodeBlockAnalyzer();
            case SQL -> new SqlBlockAnalyzer();
            case BUTTON -> new ButtonBlockAnalyzer();
            case BIG_NUMBER -> new BigNumberBlockAnalyzer();
            case INPUT -> new InputBlockAnalyzer();
            case NOTEBOOK_FUNCTION -> new NotebookFunctionBlockAnalyzer();
            case OTHER -> new UnsupportedBlockAnalyzer();
        };
    }
}
