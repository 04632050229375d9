package com.postflow.dispatch;

import com.postflow.rule.ActionSpec;
import com.postflow.rule.ConditionSpec;

import java.util.List;

/**
 * Result of a dry run: what would happen if the event arrived at the given instant.
 * Nothing is created or scheduled.
 *
 * @param ruleId            Rule evaluated
 * @param conditionsMatched Whether all conditions held
 * @param failedCondition   First condition that failed, null if all held
 * @param quietPeriodActive Whether the rule would wait for a quiet period before firing
 * @param quietPeriodSec    Configured quiet period
 * @param activeHoursMatch  Whether the instant falls in the active hours
 * @param wouldBlock        Whether guardrails would block right now
 * @param blockReason       Block reason, null if not blocked
 * @param shouldExecute     Conditions match, inside active hours and not blocked
 * @param actions           Actions that would be queued
 */
public record EvaluationTrace(
        String ruleId,
        boolean conditionsMatched,
        ConditionSpec failedCondition,
        boolean quietPeriodActive,
        int quietPeriodSec,
        boolean activeHoursMatch,
        boolean wouldBlock,
        String blockReason,
        boolean shouldExecute,
        List<ActionSpec> actions
) {
    public EvaluationTrace {
        actions = List.copyOf(actions);
    }
}
