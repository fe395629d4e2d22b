package com.dmn.adapter.spring;

import com.dmn.feel.evaluator.AstEvaluator;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Spring Boot configuration properties for the DMN engine.
 */
@ConfigurationProperties(prefix = "dmn")
public class DmnProperties {

    /**
     * Whether the engine is enabled.
     */
    private boolean enabled = true;

    /**
     * Path to the YAML decision model.
     * Supports classpath: prefix for classpath resources.
     */
    private String modelPath = "classpath:dmn-model.yaml";

    /**
     * Rethrow literal decision errors instead of returning null.
     */
    private boolean strictMode = false;

    /**
     * Maximum nesting of BKM calls.
     */
    private int maxBkmDepth = AstEvaluator.DEFAULT_MAX_BKM_DEPTH;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getModelPath() {
        return modelPath;
    }

    public void setModelPath(String modelPath) {
        this.modelPath = modelPath;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public void setStrictMode(boolean strictMode) {
        this.strictMode = strictMode;
    }

    public int getMaxBkmDepth() {
        return maxBkmDepth;
    }

    public void setMaxBkmDepth(int maxBkmDepth) {
        this.maxBkmDepth = maxBkmDepth;
    }
}
