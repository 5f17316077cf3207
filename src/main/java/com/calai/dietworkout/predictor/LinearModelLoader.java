package com.calai.dietworkout.predictor;

import com.calai.dietworkout.prediction.model.FeatureVector;
import com.calai.dietworkout.prediction.model.ProfileField;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;

/**
 * 讀模型檔並檢查：特徵順序要跟 {@link ProfileField} 完全一致、每個 head 13 個權重。
 * 任何不合格都丟 {@link PredictorUnavailableException}。
 */
public class LinearModelLoader {

    static final List<String> EXPECTED_FEATURES = Arrays.stream(ProfileField.values())
            .map(ProfileField::key)
            .toList();

    private final ResourceLoader resourceLoader;
    private final ObjectMapper om;

    public LinearModelLoader(ResourceLoader resourceLoader, ObjectMapper om) {
        this.resourceLoader = resourceLoader;
        this.om = om;
    }

    public LinearModelPredictor load(String location) throws PredictorUnavailableException {
        if (location == null || location.isBlank()) {
            throw new PredictorUnavailableException("MODEL_PATH_MISSING");
        }

        Resource res = resourceLoader.getResource(location);
        if (!res.exists()) {
            throw new PredictorUnavailableException("MODEL_NOT_FOUND: " + location);
        }

        LinearModel model;
        try (InputStream in = res.getInputStream()) {
            model = om.readValue(in, LinearModel.class);
        } catch (IOException e) {
            throw new PredictorUnavailableException("MODEL_UNREADABLE: " + location, e);
        }

        validate(model);
        return new LinearModelPredictor(model);
    }

    static void validate(LinearModel model) throws PredictorUnavailableException {
        if (model == null) throw new PredictorUnavailableException("MODEL_EMPTY");
        if (!EXPECTED_FEATURES.equals(model.features())) {
            throw new PredictorUnavailableException("MODEL_FEATURE_ORDER_MISMATCH: " + model.features());
        }
        validateHead("diet", model.diet());
        validateHead("workout", model.workout());
    }

    private static void validateHead(String name, LinearModel.Head head) throws PredictorUnavailableException {
        if (head == null) throw new PredictorUnavailableException("MODEL_HEAD_MISSING: " + name);
        if (head.intercept() == null) throw new PredictorUnavailableException("MODEL_INTERCEPT_MISSING: " + name);

        List<Double> w = head.weights();
        if (w == null || w.size() != FeatureVector.SIZE) {
            throw new PredictorUnavailableException("MODEL_WEIGHTS_SIZE_INVALID: " + name);
        }
        if (w.stream().anyMatch(x -> x == null || !Double.isFinite(x))) {
            throw new PredictorUnavailableException("MODEL_WEIGHTS_INVALID: " + name);
        }
    }
}
