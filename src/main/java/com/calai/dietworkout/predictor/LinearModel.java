package com.calai.dietworkout.predictor;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * 模型檔（JSON）結構：每個輸出一個線性 head。
 * <pre>
 * {
 *   "name": "diet_workout_linear",
 *   "features": ["age", ..., "activity_level"],
 *   "diet":    {"intercept": 0.0, "weights": [...13]},
 *   "workout": {"intercept": 0.0, "weights": [...13]}
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LinearModel(
        String name,
        List<String> features,
        Head diet,
        Head workout
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Head(Double intercept, List<Double> weights) {}
}
