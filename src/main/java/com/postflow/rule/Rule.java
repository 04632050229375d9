package com.postflow.rule;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * A compiled, immutable rule. Edits produce a new compiled version with a new hash.
 *
 * @param id              Rule id (from the document, or derived from the hash)
 * @param name            Display name
 * @param description     Optional description, empty if absent
 * @param enabled         Whether the dispatcher considers the rule
 * @param priority        1..100, higher runs first
 * @param trigger         Event category the rule reacts to
 * @param conditions      Conditions, all of which must hold
 * @param actions         Actions handed to the executor in order
 * @param guardrails      Guardrails evaluated in order before execution
 * @param quietPeriodSec  Settle time after the last qualifying event, 0 fires immediately
 * @param activeHours     Time window, or null if the rule may fire at any time
 * @param tags            Free-form labels
 * @param canonicalSource Canonical JSON form of the source document
 * @param hash            SHA-256 of the canonical form
 * @param compiledAt      Compilation time, used to break priority ties
 */
public record Rule(
        String id,
        String name,
        String description,
        boolean enabled,
        int priority,
        TriggerType trigger,
        List<ConditionSpec> conditions,
        List<ActionSpec> actions,
        List<GuardrailSpec> guardrails,
        int quietPeriodSec,
        ActiveHours activeHours,
        List<String> tags,
        String canonicalSource,
        String hash,
        Instant compiledAt
) {
    /**
     * Dispatch order: priority descending, then earliest compiled, then id.
     */
    public static final Comparator<Rule> DISPATCH_ORDER = Comparator
            .<Rule>comparingInt(Rule::priority).reversed()
            .thenComparing(Rule::compiledAt)
            .thenComparing(Rule::id);

    public Rule {
        conditions = List.copyOf(conditions);
        actions = List.copyOf(actions);
        guardrails = List.copyOf(guardrails);
        tags = List.copyOf(tags);
    }

    public Optional<ActiveHours> activeHoursWindow() {
        return Optional.ofNullable(activeHours).filter(ActiveHours::enabled);
    }

    public boolean hasQuietPeriod() {
        return quietPeriodSec > 0;
    }
}
