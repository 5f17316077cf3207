package com.calai.dietworkout.prediction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"Exercise", "Type", "Reps/Sets", "CaloriesBurned"})
public record WorkoutPlanItem(
        @JsonProperty("Exercise") String exercise,
        @JsonProperty("Type") String type,
        @JsonProperty("Reps/Sets") String repsSets,
        @JsonProperty("CaloriesBurned") String caloriesBurned
) {}
