package com.calai.dietworkout.predictor;

import com.calai.dietworkout.prediction.model.FeatureVector;
import com.calai.dietworkout.prediction.model.PredictionResult;

/**
 * 外部模型的接縫：吃 13 維特徵，吐 (kcal/day, days/week)。
 * 實作必須無狀態，可同時被多個請求呼叫。
 */
public interface Predictor {

    PredictionResult predict(FeatureVector features);

    /** e.g. "LINEAR_MODEL" / "HEURISTIC" */
    String code();
}
