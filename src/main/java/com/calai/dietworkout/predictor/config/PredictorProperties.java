package com.calai.dietworkout.predictor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app.predictor")
public class PredictorProperties {

    /** false：直接用 heuristic，不嘗試載模型 */
    private boolean enabled = true;

    /** Spring resource location，e.g. file:./diet_workout_model.json / classpath:model/x.json */
    private String modelPath = "file:./diet_workout_model.json";

    // ===== getters/setters =====
    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }

    public String getModelPath() { return modelPath; }
    public void setModelPath(String modelPath) { this.modelPath = modelPath; }
}
