package com.postflow.store;

import com.postflow.rule.Rule;

import java.util.List;
import java.util.Optional;

/**
 * Source of compiled rules. Persistence is up to the implementation.
 */
public interface RuleStore {

    /**
     * @return every enabled rule, in no particular order
     */
    List<Rule> listEnabledRules();

    Optional<Rule> getRule(String ruleId);

    /**
     * Subscribe to rule changes. Stores that cannot report changes ignore this.
     */
    default void addChangeListener(RuleChangeListener listener) {
    }
}
