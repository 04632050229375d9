package com.postflow.job;

import java.time.Instant;
import java.util.Comparator;

/**
 * Sort orders for job listings. Ties fall back to job id.
 */
public enum JobSort {
    CREATED_DESC(Comparator.comparing(JobSnapshot::createdAt).reversed()),
    CREATED_ASC(Comparator.comparing(JobSnapshot::createdAt)),
    PRIORITY_DESC(Comparator.comparingInt(JobSnapshot::priority).reversed()
            .thenComparing(JobSnapshot::createdAt)),
    NEXT_RUN_ASC(Comparator.comparing(JobSnapshot::nextRunAt,
            Comparator.nullsLast(Comparator.<Instant>naturalOrder()))
            .thenComparing(JobSnapshot::createdAt));

    private final Comparator<JobSnapshot> comparator;

    JobSort(Comparator<JobSnapshot> comparator) {
        this.comparator = comparator.thenComparing(JobSnapshot::id);
    }

    public Comparator<JobSnapshot> comparator() {
        return comparator;
    }
}
