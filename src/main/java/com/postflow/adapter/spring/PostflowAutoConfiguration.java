package com.postflow.adapter.spring;

import com.postflow.adapter.executor.LoggingJobExecutor;
import com.postflow.adapter.livestate.SystemLiveStateProvider;
import com.postflow.compiler.RuleCompiler;
import com.postflow.config.ConfigLoader;
import com.postflow.config.EngineConfig;
import com.postflow.config.SeedRuleLoader;
import com.postflow.core.DefaultPostflowEngine;
import com.postflow.core.PostflowEngine;
import com.postflow.guardrail.LiveStateProvider;
import com.postflow.queue.JobExecutor;
import com.postflow.store.InMemoryRuleStore;
import com.postflow.store.RuleStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Postflow.
 */
@Configuration
@ConditionalOnProperty(prefix = "postflow", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PostflowProperties.class)
public class PostflowAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PostflowAutoConfiguration.class);

    private PostflowEngine engine;

    @Bean
    @ConditionalOnMissingBean
    public EngineConfig postflowEngineConfig(PostflowProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public RuleCompiler ruleCompiler() {
        return new RuleCompiler();
    }

    @Bean
    @ConditionalOnMissingBean(RuleStore.class)
    public InMemoryRuleStore ruleStore(EngineConfig config, RuleCompiler compiler) {
        return new InMemoryRuleStore(new SeedRuleLoader(compiler).compile(config));
    }

    @Bean
    @ConditionalOnMissingBean
    public LiveStateProvider liveStateProvider(PostflowProperties properties) {
        log.info("Using host live state (media root: {})", properties.getMediaRoot());
        return new SystemLiveStateProvider(properties.getMediaRoot(), properties.getVolumes());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor() {
        log.warn("No JobExecutor bean found, actions will only be logged");
        return new LoggingJobExecutor();
    }

    @Bean
    @ConditionalOnMissingBean
    public PostflowEngine postflowEngine(EngineConfig config, RuleStore ruleStore,
                                         LiveStateProvider liveStateProvider, JobExecutor jobExecutor,
                                         PostflowProperties properties,
                                         ApplicationEventPublisher eventPublisher) {
        log.info("Creating Postflow engine: {}", config.name());
        DefaultPostflowEngine created = new DefaultPostflowEngine(config.engine(), ruleStore,
                liveStateProvider, jobExecutor);
        if (properties.isPublishEvents()) {
            created.addListener(eventPublisher::publishEvent);
        }
        created.start();
        this.engine = created;
        return created;
    }

    @PreDestroy
    public void shutdown() {
        if (engine != null && !engine.isShutdown()) {
            log.info("Shutting down Postflow engine");
            engine.shutdown();
        }
    }
}
