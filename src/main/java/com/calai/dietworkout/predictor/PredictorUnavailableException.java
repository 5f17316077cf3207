package com.calai.dietworkout.predictor;

/** 模型載入 / 初始化失敗。只在啟動時出現，不會回給 client。 */
public class PredictorUnavailableException extends Exception {

    public PredictorUnavailableException(String message) {
        super(message);
    }

    public PredictorUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
