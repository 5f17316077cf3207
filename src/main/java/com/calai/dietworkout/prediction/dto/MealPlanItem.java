package com.calai.dietworkout.prediction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

@JsonPropertyOrder({"Meal", "Food", "Calories", "AllergySafe"})
public record MealPlanItem(
        @JsonProperty("Meal") String meal,
        @JsonProperty("Food") String food,
        @JsonProperty("Calories") String calories,
        @JsonProperty("AllergySafe") boolean allergySafe
) {}
