package com.postflow.config;

import com.postflow.compiler.CompilationResult;
import com.postflow.compiler.RuleCompiler;
import com.postflow.exception.ConfigurationException;
import com.postflow.rule.Rule;
import com.postflow.rule.ValidationError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Compiles the rule documents listed in the configuration.
 * Every invalid document is logged with all its errors before startup fails.
 */
public class SeedRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(SeedRuleLoader.class);

    private final RuleCompiler compiler;

    public SeedRuleLoader(RuleCompiler compiler) {
        this.compiler = compiler;
    }

    public List<Rule> compile(EngineConfig config) {
        List<Rule> rules = new ArrayList<>();
        int invalid = 0;
        List<Map<String, Object>> documents = config.seedRules();
        for (int i = 0; i < documents.size(); i++) {
            CompilationResult result = compiler.compile(documents.get(i));
            if (result.isSuccess()) {
                rules.add(result.orElseThrow());
                continue;
            }
            invalid++;
            for (ValidationError error : result.getErrors()) {
                log.error("Seed rule {} invalid: {}", i, error);
            }
        }
        if (invalid > 0) {
            throw new ConfigurationException(invalid + " of " + documents.size() + " seed rule(s) failed to compile");
        }
        log.info("Compiled {} seed rule(s)", rules.size());
        return rules;
    }
}
