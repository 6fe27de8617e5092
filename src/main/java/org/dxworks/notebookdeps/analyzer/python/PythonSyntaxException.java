package org.dxworks.notebookdeps.analyzer.python;

import org.dxworks.notebookdeps.analyzer.BlockAnalysisException;

/**
 * Code fragment that does not parse as Python. Reported with the kind consumers already expect
 * from a Python front end.
 */
public class PythonSyntaxException extends BlockAnalysisException {
    public static final String KIND = "SyntaxError";

    private final int line;
    private final int column;

    public PythonSyntaxException(String reason, int line, int column) {
        super(reason + " (line " + line + ", column " + column + ")");
        this.line = line;
        this.column = column;
    }

    /** 1-based line of the first offending token. */
    public int getLine() {
        return line;
    }

    /** 0-based column of the first offending token. */
    public int getColumn() {
        return column;
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
