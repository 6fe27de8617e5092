package org.dxworks.notebookdeps.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"type", "message"})
public class BlockError {
    public final String type;
    public final String message;

    public BlockError(String type, String message) {
        this.type = type;
        this.message = message != null ? message : "";
    }
}
