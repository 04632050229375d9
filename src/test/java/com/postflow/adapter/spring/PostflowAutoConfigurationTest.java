package com.postflow.adapter.spring;

import com.postflow.core.PostflowEngine;
import com.postflow.guardrail.LiveStateProvider;
import com.postflow.queue.JobExecutor;
import com.postflow.store.InMemoryRuleStore;
import com.postflow.store.RuleStore;
import com.postflow.support.StubLiveStateProvider;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for PostflowAutoConfiguration.
 */
class PostflowAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PostflowAutoConfiguration.class))
            .withBean(LiveStateProvider.class, StubLiveStateProvider::idle)
            .withPropertyValues("postflow.config-path=classpath:postflow-test.yaml");

    @Test
    @DisplayName("Engine is created with seed rules and defaults")
    void createsEngine() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(PostflowEngine.class);
            assertThat(context).hasSingleBean(JobExecutor.class);
            assertThat(context.getBean(InMemoryRuleStore.class).listRules()).hasSize(2);
            assertThat(context.getBean(PostflowEngine.class).getStats().maxConcurrency()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("Engine is shut down with the context")
    void shutsDownWithContext() {
        PostflowEngine[] engine = new PostflowEngine[1];
        contextRunner.run(context -> engine[0] = context.getBean(PostflowEngine.class));

        assertThat(engine[0].isShutdown()).isTrue();
    }

    @Test
    @DisplayName("A user rule store replaces the seeded one")
    void userRuleStore() {
        contextRunner
                .withBean(RuleStore.class, InMemoryRuleStore::new)
                .run(context -> {
                    assertThat(context).hasSingleBean(RuleStore.class);
                    assertThat(context.getBean(RuleStore.class).listEnabledRules()).isEmpty();
                });
    }

    @Test
    @DisplayName("Disabled by property")
    void disabled() {
        contextRunner
                .withPropertyValues("postflow.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(PostflowEngine.class));
    }

    @Test
    @DisplayName("Invalid configuration fails startup")
    void invalidConfigPath() {
        contextRunner
                .withPropertyValues("postflow.config-path=classpath:missing.yaml")
                .run(context -> assertThat(context).hasFailed());
    }
}
