package com.calai.dietworkout.prediction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

@JsonPropertyOrder({"PredictedDiet", "PredictedWorkout", "MealPlan", "WorkoutPlan"})
public record PredictionResponse(
        @JsonProperty("PredictedDiet") String predictedDiet,        // "<int> kcal per day"
        @JsonProperty("PredictedWorkout") String predictedWorkout,  // "<int> workout days per week"
        @JsonProperty("MealPlan") List<MealPlanItem> mealPlan,
        @JsonProperty("WorkoutPlan") List<WorkoutPlanItem> workoutPlan
) {}
