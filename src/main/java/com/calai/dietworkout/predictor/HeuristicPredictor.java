package com.calai.dietworkout.predictor;

import com.calai.dietworkout.prediction.model.FeatureVector;
import com.calai.dietworkout.prediction.model.PredictionResult;
import com.calai.dietworkout.prediction.model.ProfileField;

/**
 * 沒有模型時的替代品：
 * - diet = floor(bmr_kcal * 1.2)
 * - workout = floor(activity_level + 3)
 */
public class HeuristicPredictor implements Predictor {

    public static final String CODE = "HEURISTIC";

    static final double BMR_FACTOR = 1.2;
    static final double WORKOUT_BASE_DAYS = 3;

    @Override
    public PredictionResult predict(FeatureVector features) {
        double bmr = features.get(ProfileField.BMR_KCAL);
        double activity = features.get(ProfileField.ACTIVITY_LEVEL);

        int diet = PredictionValues.floor(bmr * BMR_FACTOR, "diet");
        int workout = PredictionValues.floor(activity + WORKOUT_BASE_DAYS, "workout");
        return new PredictionResult(diet, workout);
    }

    @Override
    public String code() {
        return CODE;
    }
}
