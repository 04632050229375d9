package com.postflow.debounce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Holds back a rule until its subject has been quiet for the rule's quiet period.
 * <p>
 * Each registration bumps a generation counter and moves the deadline; a fire is honoured
 * only for the ticket holding the latest generation. The latest value registered for a
 * key is what the fire hands back. Not thread-safe: the engine thread owns it.
 *
 * @param <T> value retained per key (the latest event)
 */
public class QuietPeriodDebouncer<T> {

    private static final Logger log = LoggerFactory.getLogger(QuietPeriodDebouncer.class);

    private final Map<DebounceKey, Pending<T>> pending = new HashMap<>();
    private long generationCounter;

    /**
     * Start or reset the quiet period for a key.
     *
     * @return ticket to present when the deadline is reached
     */
    public DebounceTicket register(String ruleId, String subjectId, Duration quietPeriod, T latest, Instant now) {
        DebounceKey key = new DebounceKey(ruleId, subjectId);
        long generation = ++generationCounter;
        Instant deadline = now.plus(quietPeriod);
        Pending<T> previous = pending.put(key, new Pending<>(generation, deadline, latest));
        if (previous != null) {
            log.debug("Quiet period reset for {} (deadline {})", key, deadline);
        } else {
            log.debug("Quiet period started for {} (deadline {})", key, deadline);
        }
        return new DebounceTicket(key, generation, deadline);
    }

    /**
     * Fire a ticket.
     *
     * @return the latest value for the key if the ticket is current, empty if stale
     */
    public Optional<T> fire(DebounceTicket ticket) {
        Pending<T> current = pending.get(ticket.key());
        if (current == null || current.generation() != ticket.generation()) {
            return Optional.empty();
        }
        pending.remove(ticket.key());
        log.debug("Quiet period elapsed for {}", ticket.key());
        return Optional.of(current.latest());
    }

    public void cancel(String ruleId, String subjectId) {
        pending.remove(new DebounceKey(ruleId, subjectId));
    }

    /**
     * Drop every pending fire of a rule.
     *
     * @return number of keys dropped
     */
    public int cancelRule(String ruleId) {
        int before = pending.size();
        pending.keySet().removeIf(key -> key.ruleId().equals(ruleId));
        return before - pending.size();
    }

    public DebounceState state(String ruleId, String subjectId) {
        return pending.containsKey(new DebounceKey(ruleId, subjectId)) ? DebounceState.WAITING : DebounceState.IDLE;
    }

    public int pendingCount() {
        return pending.size();
    }

    public void clear() {
        pending.clear();
    }

    private record Pending<T>(long generation, Instant deadline, T latest) {
    }
}
