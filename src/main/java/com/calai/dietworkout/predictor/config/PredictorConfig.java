package com.calai.dietworkout.predictor.config;

import com.calai.dietworkout.predictor.HeuristicPredictor;
import com.calai.dietworkout.predictor.LinearModelLoader;
import com.calai.dietworkout.predictor.Predictor;
import com.calai.dietworkout.predictor.PredictorUnavailableException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

/**
 * 啟動時決定用哪個 Predictor：
 * - enabled=false -> heuristic
 * - 模型載入成功 -> linear model
 * - 載入失敗 -> log WARN + heuristic（不讓啟動失敗）
 */
@Slf4j
@Configuration
public class PredictorConfig {

    @Bean
    public LinearModelLoader linearModelLoader(ResourceLoader resourceLoader, ObjectMapper om) {
        return new LinearModelLoader(resourceLoader, om);
    }

    @Bean
    public PredictorSelection predictorSelection(PredictorProperties props, LinearModelLoader loader) {
        return select(props, loader);
    }

    @Bean
    public Predictor predictor(PredictorSelection selection) {
        return selection.predictor();
    }

    static PredictorSelection select(PredictorProperties props, LinearModelLoader loader) {
        if (!props.isEnabled()) {
            log.info("[Predictor] model disabled by config, using {}", HeuristicPredictor.CODE);
            return new PredictorSelection(new HeuristicPredictor(), false, "DISABLED");
        }
        try {
            var p = loader.load(props.getModelPath());
            log.info("[Predictor] loaded model name={} from {}", p.modelName(), props.getModelPath());
            return new PredictorSelection(p, false, null);
        } catch (PredictorUnavailableException e) {
            log.warn("[Predictor] model unavailable, falling back to {}: {}",
                    HeuristicPredictor.CODE, e.getMessage());
            return new PredictorSelection(new HeuristicPredictor(), true, e.getMessage());
        }
    }

    /**
     * @param fallback true = 模型載入失敗才用 heuristic
     * @param reason   沒用模型的原因（有用模型時為 null）
     */
    public record PredictorSelection(Predictor predictor, boolean fallback, String reason) {}
}
