package com.postflow.job;

import java.util.List;

/**
 * Outcome of a best-effort bulk operation, one item per requested id in request order.
 */
public record BulkResult(String operation, List<BulkItem> items) {

    public BulkResult {
        items = List.copyOf(items);
    }

    public long succeeded() {
        return items.stream().filter(BulkItem::ok).count();
    }

    public long failed() {
        return items.size() - succeeded();
    }

    public boolean allSucceeded() {
        return failed() == 0;
    }
}
