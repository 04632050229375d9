package com.postflow.job;

import com.postflow.rule.ActionSpec;
import com.postflow.rule.GuardrailSpec;
import com.postflow.rule.Rule;

import java.util.List;
import java.util.Map;

/**
 * Everything a job inherits from the rule and event that created it.
 */
public record JobSpec(
        String id,
        String ruleId,
        String ruleName,
        String subjectId,
        List<ActionSpec> actions,
        int priority,
        List<GuardrailSpec> guardrails,
        Map<String, Object> eventPayload
) {
    public static JobSpec of(String id, Rule rule, String subjectId, Map<String, Object> eventPayload) {
        return new JobSpec(id, rule.id(), rule.name(), subjectId, rule.actions(), rule.priority(),
                rule.guardrails(), eventPayload);
    }
}
