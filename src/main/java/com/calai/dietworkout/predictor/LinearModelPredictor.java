package com.calai.dietworkout.predictor;

import com.calai.dietworkout.prediction.model.FeatureVector;
import com.calai.dietworkout.prediction.model.PredictionResult;

/**
 * 已訓練好的線性模型。輸出截斷成 int（往 0 取整），超出 int 範圍丟 PREDICTION_OUT_OF_RANGE。
 * 權重在建構時複製成 array，之後唯讀，可並行使用。
 */
public class LinearModelPredictor implements Predictor {

    public static final String CODE = "LINEAR_MODEL";

    private final String name;
    private final double dietIntercept;
    private final double[] dietWeights;
    private final double workoutIntercept;
    private final double[] workoutWeights;

    /** model 需先經過 {@link LinearModelLoader} 檢查 */
    public LinearModelPredictor(LinearModel model) {
        this.name = model.name();
        this.dietIntercept = model.diet().intercept();
        this.dietWeights = toArray(model.diet());
        this.workoutIntercept = model.workout().intercept();
        this.workoutWeights = toArray(model.workout());
    }

    @Override
    public PredictionResult predict(FeatureVector features) {
        double diet = dot(dietWeights, features) + dietIntercept;
        double workout = dot(workoutWeights, features) + workoutIntercept;
        return new PredictionResult(
                PredictionValues.truncate(diet, "diet"),
                PredictionValues.truncate(workout, "workout"));
    }

    @Override
    public String code() {
        return CODE;
    }

    public String modelName() {
        return name;
    }

    private static double dot(double[] w, FeatureVector x) {
        double s = 0;
        for (int i = 0; i < w.length; i++) s += w[i] * x.get(i);
        return s;
    }

    private static double[] toArray(LinearModel.Head head) {
        return head.weights().stream().mapToDouble(Double::doubleValue).toArray();
    }
}
