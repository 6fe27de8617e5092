package org.dxworks.notebookdeps.analyzer.python;

public class PythonIndentationException extends PythonSyntaxException {
    public static final String KIND = "IndentationError";

    public PythonIndentationException(String reason, int line, int column) {
        super(reason, line, column);
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
