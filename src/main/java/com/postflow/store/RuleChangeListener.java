package com.postflow.store;

import com.postflow.rule.Rule;

/**
 * Told when a rule is saved or deleted.
 */
public interface RuleChangeListener {

    void onRuleSaved(Rule rule);

    void onRuleDeleted(String ruleId);
}
