package com.calai.dietworkout.predictor;

/**
 * 預測值 double -> int。
 * NaN / Infinity / 超出 int 範圍直接丟 PREDICTION_OUT_OF_RANGE（500），不讓 (int) 默默飽和成 MAX_VALUE。
 */
final class PredictionValues {

    static final String OUT_OF_RANGE = "PREDICTION_OUT_OF_RANGE";

    private PredictionValues() {}

    /** 往 0 截斷 */
    static int truncate(double v, String output) {
        return toInt(v, output);
    }

    /** 往下取整 */
    static int floor(double v, String output) {
        return toInt(Math.floor(v), output);
    }

    private static int toInt(double v, String output) {
        if (!Double.isFinite(v) || v < Integer.MIN_VALUE || v >= (double) Integer.MAX_VALUE + 1) {
            throw new IllegalStateException(OUT_OF_RANGE + ": " + output + "=" + v);
        }
        return (int) v;
    }
}
