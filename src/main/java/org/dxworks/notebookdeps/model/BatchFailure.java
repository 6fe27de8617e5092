package org.dxworks.notebookdeps.model;

/**
 * Single top-level error object written in place of the result array when the batch container is unusable.
 */
public class BatchFailure {
    public final String errorMessage;

    public BatchFailure(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public static BatchFailure of(Exception e) {
        return new BatchFailure(e.getClass().getSimpleName() + ": " + e.getMessage());
    }
}
