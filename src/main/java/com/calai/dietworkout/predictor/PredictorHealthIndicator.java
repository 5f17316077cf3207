package com.calai.dietworkout.predictor;

import com.calai.dietworkout.predictor.config.PredictorConfig.PredictorSelection;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * 回報目前用哪個 predictor。
 * fallback 也是 UP：heuristic 照樣能服務，只在 detail 標記。
 */
@Component
public class PredictorHealthIndicator implements HealthIndicator {

    private final PredictorSelection selection;

    public PredictorHealthIndicator(PredictorSelection selection) {
        this.selection = selection;
    }

    @Override
    public Health health() {
        Health.Builder b = Health.up()
                .withDetail("predictor", selection.predictor().code())
                .withDetail("fallback", selection.fallback());
        if (selection.reason() != null) b.withDetail("reason", selection.reason());
        return b.build();
    }
}
