package com.postflow.store;

import com.postflow.rule.Rule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe in-memory rule store.
 */
public class InMemoryRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRuleStore.class);

    private final Map<String, Rule> rules = new ConcurrentHashMap<>();
    private final List<RuleChangeListener> listeners = new CopyOnWriteArrayList<>();

    public InMemoryRuleStore() {
    }

    public InMemoryRuleStore(List<Rule> initial) {
        initial.forEach(rule -> rules.put(rule.id(), rule));
    }

    /**
     * Insert or replace a rule by id.
     */
    public void save(Rule rule) {
        Rule previous = rules.put(rule.id(), rule);
        log.info("Rule {} {} (hash {})", rule.id(), previous == null ? "added" : "updated", rule.hash());
        listeners.forEach(listener -> listener.onRuleSaved(rule));
    }

    public boolean delete(String ruleId) {
        boolean removed = rules.remove(ruleId) != null;
        if (removed) {
            log.info("Rule {} deleted", ruleId);
            listeners.forEach(listener -> listener.onRuleDeleted(ruleId));
        }
        return removed;
    }

    @Override
    public List<Rule> listEnabledRules() {
        List<Rule> enabled = new ArrayList<>();
        for (Rule rule : rules.values()) {
            if (rule.enabled()) {
                enabled.add(rule);
            }
        }
        return enabled;
    }

    public List<Rule> listRules() {
        return List.copyOf(rules.values());
    }

    @Override
    public Optional<Rule> getRule(String ruleId) {
        return Optional.ofNullable(rules.get(ruleId));
    }

    @Override
    public void addChangeListener(RuleChangeListener listener) {
        listeners.add(listener);
    }
}
