package org.dxworks.notebookdeps.model;

import java.util.Collections;
import java.util.List;

/**
 * Either the ordered per-block results of a batch or the one failure that replaced them.
 */
public final class BatchOutcome {
    private final List<AnalysisResult> results;
    private final BatchFailure failure;

    private BatchOutcome(List<AnalysisResult> results, BatchFailure failure) {
        this.results = results;
        this.failure = failure;
    }

    public static BatchOutcome success(List<AnalysisResult> results) {
        return new BatchOutcome(Collections.unmodifiableList(results), null);
    }

    public static BatchOutcome failure(BatchFailure failure) {
        return new BatchOutcome(null, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public List<AnalysisResult> getResults() {
        if (!isSuccess()) {
            throw new IllegalStateException("Batch failed: " + failure.errorMessage);
        }
        return results;
    }

    public BatchFailure getFailure() {
        return failure;
    }

    /**
     * The value written to the transport: the result list on success, the failure object otherwise.
     */
    public Object toWireValue() {
        return isSuccess() ? results : failure;
    }
}
