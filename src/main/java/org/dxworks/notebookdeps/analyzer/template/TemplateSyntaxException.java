package org.dxworks.notebookdeps.analyzer.template;

import org.dxworks.notebookdeps.analyzer.BlockAnalysisException;

public class TemplateSyntaxException extends BlockAnalysisException {
    public static final String KIND = "TemplateSyntaxError";

    public TemplateSyntaxException(String message) {
        super(message);
    }

    @Override
    public String getKind() {
        return KIND;
    }
}
