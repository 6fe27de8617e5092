package org.dxworks.notebookdeps.analyzer;

/**
 * Failure confined to a single block. The kind is what gets reported in the block's {@code error.type};
 * it defaults to the simple class name.
 */
public class BlockAnalysisException extends RuntimeException {

    public BlockAnalysisException(String message) {
        super(message);
    }

    public String getKind() {
        return getClass().getSimpleName();
    }
}
