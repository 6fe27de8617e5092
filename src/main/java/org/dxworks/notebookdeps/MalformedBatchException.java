package org.dxworks.notebookdeps;

import java.io.IOException;

/**
 * The batch container parsed as JSON but does not carry a usable block list.
 */
public class MalformedBatchException extends IOException {
    public MalformedBatchException(String message) {
        super(message);
    }
}
