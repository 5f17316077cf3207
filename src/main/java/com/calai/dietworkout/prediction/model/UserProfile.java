package com.calai.dietworkout.prediction.model;

/**
 * 單次請求的使用者資料，不落地。
 * 數值欄位保留 JSON 原值（不轉 int、不檢查範圍）。
 */
public record UserProfile(
        // body metrics
        double age,
        double gender,
        double heightCm,
        double weightKg,
        double bmi,
        double bodyFatPercent,
        double muscleMassKg,
        double boneMassKg,
        double waterPercent,
        double bmrKcal,
        double visceralFat,
        double metabolicAge,
        double activityLevel,

        // personalization
        String userAllergy,        // lower-cased
        String userPreference,     // lower-cased, unused
        String dietType,           // verbatim, unused
        String workoutPreference,  // verbatim, unused
        String userGoal            // lower-cased
) {}
