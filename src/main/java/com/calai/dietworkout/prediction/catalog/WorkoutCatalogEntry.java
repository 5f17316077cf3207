package com.calai.dietworkout.prediction.catalog;

public record WorkoutCatalogEntry(
        String exercise,
        String type,            // "Strength" / "Cardio"
        String repsSets,        // 組數或時間
        String caloriesBurned
) {}
