package com.calai.dietworkout.prediction.service;

import com.calai.dietworkout.prediction.dto.MealPlanItem;
import com.calai.dietworkout.prediction.dto.PredictionResponse;
import com.calai.dietworkout.prediction.dto.WorkoutPlanItem;
import com.calai.dietworkout.prediction.model.FeatureVector;
import com.calai.dietworkout.prediction.model.PredictionResult;
import com.calai.dietworkout.prediction.model.UserProfile;
import com.calai.dietworkout.predictor.Predictor;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * validate -> feature vector -> predictor -> plans -> response。
 * 不保留任何跨請求狀態。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionService {

    private final RequestValidator validator;
    private final FeatureVectorBuilder featureVectorBuilder;
    private final Predictor predictor;
    private final PlanGenerator planGenerator;

    public PredictionResponse predict(JsonNode body) {
        UserProfile profile = validator.validate(body);
        FeatureVector features = featureVectorBuilder.build(profile);

        PredictionResult result = predictor.predict(features);

        List<MealPlanItem> mealPlan = planGenerator.mealPlan(profile.userAllergy());
        List<WorkoutPlanItem> workoutPlan = planGenerator.workoutPlan(profile.userGoal());

        log.debug("predict predictor={} diet={} workout={} goal={} allergy={} workouts={}",
                predictor.code(), result.predictedDiet(), result.predictedWorkout(),
                profile.userGoal(), !profile.userAllergy().isEmpty(), workoutPlan.size());

        return new PredictionResponse(
                formatDiet(result.predictedDiet()),
                formatWorkout(result.predictedWorkout()),
                mealPlan,
                workoutPlan
        );
    }

    static String formatDiet(int kcal) {
        return kcal + " kcal per day";
    }

    static String formatWorkout(int days) {
        return days + " workout days per week";
    }
}
