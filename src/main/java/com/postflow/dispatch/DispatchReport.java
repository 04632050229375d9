package com.postflow.dispatch;

import com.postflow.rule.TriggerType;

import java.util.List;
import java.util.Optional;

/**
 * Per-rule outcomes for one event, in dispatch order.
 */
public record DispatchReport(TriggerType trigger, String subjectId, List<RuleOutcome> outcomes) {

    public DispatchReport {
        outcomes = List.copyOf(outcomes);
    }

    public List<String> jobIds() {
        return outcomes.stream()
                .filter(RuleOutcome::createdJob)
                .map(RuleOutcome::jobId)
                .toList();
    }

    public Optional<RuleOutcome> outcomeFor(String ruleId) {
        return outcomes.stream().filter(outcome -> outcome.ruleId().equals(ruleId)).findFirst();
    }

    public boolean matchedNothing() {
        return outcomes.isEmpty();
    }
}
