package com.calai.dietworkout.prediction.catalog;

public record MealCatalogEntry(
        String meal,         // Breakfast / Lunch / Dinner
        String food,
        String calories,     // e.g. "350 kcal"
        String alternative,  // 過敏時的替代餐
        String allergen
) {}
