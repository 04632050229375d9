package com.postflow.job;

import java.util.EnumSet;
import java.util.Set;

/**
 * Job list filter; null or empty fields match everything.
 *
 * @param states    Accepted states
 * @param ruleId    Only jobs of this rule
 * @param subjectId Only jobs on this asset
 */
public record JobFilter(Set<JobState> states, String ruleId, String subjectId) {

    public JobFilter {
        states = states == null || states.isEmpty() ? Set.of() : Set.copyOf(states);
    }

    public static JobFilter all() {
        return new JobFilter(Set.of(), null, null);
    }

    public static JobFilter byState(JobState first, JobState... rest) {
        return new JobFilter(EnumSet.of(first, rest), null, null);
    }

    public static JobFilter byRule(String ruleId) {
        return new JobFilter(Set.of(), ruleId, null);
    }

    public boolean matches(JobSnapshot job) {
        if (!states.isEmpty() && !states.contains(job.state())) {
            return false;
        }
        if (ruleId != null && !ruleId.equals(job.ruleId())) {
            return false;
        }
        return subjectId == null || subjectId.equals(job.subjectId());
    }
}
