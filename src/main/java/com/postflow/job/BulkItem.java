package com.postflow.job;

/**
 * Per-job outcome of a bulk operation.
 */
public record BulkItem(String jobId, boolean ok, String error) {

    public static BulkItem success(String jobId) {
        return new BulkItem(jobId, true, null);
    }

    public static BulkItem failure(String jobId, String error) {
        return new BulkItem(jobId, false, error);
    }
}
