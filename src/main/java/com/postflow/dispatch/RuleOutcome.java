package com.postflow.dispatch;

/**
 * Dispatch result for one rule.
 *
 * @param ruleId  Rule id
 * @param outcome What happened
 * @param jobId   Created job, if any
 * @param detail  Failed condition, block reason or debounce deadline, if any
 */
public record RuleOutcome(String ruleId, DispatchOutcome outcome, String jobId, String detail) {

    public static RuleOutcome skipped(String ruleId, DispatchOutcome outcome, String detail) {
        return new RuleOutcome(ruleId, outcome, null, detail);
    }

    public boolean createdJob() {
        return jobId != null;
    }
}
