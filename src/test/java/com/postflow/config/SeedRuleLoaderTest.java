package com.postflow.config;

import com.postflow.compiler.RuleCompiler;
import com.postflow.exception.ConfigurationException;
import com.postflow.rule.ActionType;
import com.postflow.rule.Rule;
import com.postflow.rule.TriggerType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SeedRuleLoader.
 */
class SeedRuleLoaderTest {

    private SeedRuleLoader loader;

    @BeforeEach
    void setUp() {
        loader = new SeedRuleLoader(new RuleCompiler());
    }

    @Test
    @DisplayName("Seed rules from configuration compile")
    void compileSeedRules() {
        List<Rule> rules = loader.compile(ConfigLoader.load("classpath:postflow-test.yaml"));

        assertEquals(List.of("remux-mkv", "archive-approved"), rules.stream().map(Rule::id).toList());
        Rule archive = rules.get(1);
        assertEquals(TriggerType.MANUAL, archive.trigger());
        assertEquals(ActionType.ARCHIVE, archive.actions().get(0).type());
        assertEquals(20, archive.priority());
    }

    @Test
    @DisplayName("Bundled seed rules compile")
    void bundledRulesCompile() {
        List<Rule> rules = loader.compile(ConfigLoader.load("classpath:postflow.yaml"));

        assertEquals(2, rules.size());
        assertTrue(rules.stream().anyMatch(rule -> rule.activeHoursWindow().isPresent()));
    }

    @Test
    @DisplayName("Any invalid seed rule fails startup")
    void invalidRuleFails() {
        EngineConfig config = new EngineConfig("test", "1.0", EngineSettings.defaults(), List.of(
                Map.of("name", "ok", "trigger", "manual", "actions", List.of(Map.of("type", "index_asset"))),
                Map.of("name", "bad", "trigger", "teleport", "actions", List.of()),
                Map.of("trigger", "manual", "actions", List.of(Map.of("type", "index_asset")))));

        ConfigurationException ex = assertThrows(ConfigurationException.class, () -> loader.compile(config));
        assertEquals("2 of 3 seed rule(s) failed to compile", ex.getMessage());
    }

    @Test
    @DisplayName("No seed rules is fine")
    void noSeedRules() {
        assertTrue(loader.compile(EngineConfig.minimal()).isEmpty());
    }
}
