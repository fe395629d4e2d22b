package com.dmn.adapter.spring;

import com.dmn.engine.DecisionEngine;
import com.dmn.engine.EvaluationOptions;
import com.dmn.model.DecisionModel;
import com.dmn.model.ModelLoader;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring Boot auto-configuration for the DMN engine.
 */
@Configuration
@ConditionalOnProperty(prefix = "dmn", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(DmnProperties.class)
public class DmnAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DmnAutoConfiguration.class);

    private DecisionEngine decisionEngine;

    @Bean
    @ConditionalOnMissingBean
    public DecisionModel decisionModel(DmnProperties properties) {
        log.info("Loading decision model from: {}", properties.getModelPath());
        return ModelLoader.load(properties.getModelPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public EvaluationOptions evaluationOptions(DmnProperties properties) {
        return EvaluationOptions.defaults()
                .withStrictMode(properties.isStrictMode())
                .withMaxBkmDepth(properties.getMaxBkmDepth());
    }

    @Bean
    @ConditionalOnMissingBean
    public DecisionEngine decisionEngine(DecisionModel model, EvaluationOptions options) {
        log.info("Creating DecisionEngine for model: {}", model.name());
        this.decisionEngine = new DecisionEngine(model, options);
        List<String> problems = decisionEngine.validate();
        for (String problem : problems) {
            log.warn("Decision model '{}': {}", model.name(), problem);
        }
        return this.decisionEngine;
    }

    @PreDestroy
    public void shutdown() {
        if (decisionEngine != null) {
            log.info("Releasing DecisionEngine");
            decisionEngine.clear();
        }
    }
}
