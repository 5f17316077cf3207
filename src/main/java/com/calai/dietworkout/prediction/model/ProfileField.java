package com.calai.dietworkout.prediction.model;

/**
 * 13 個必要欄位，宣告順序 = 檢查順序 = 特徵向量順序。
 * 模型吃的是位置，順序不能動。
 */
public enum ProfileField {
    AGE("age"),
    GENDER("gender"),                     // 0: male, 1: female
    HEIGHT_CM("height_cm"),
    WEIGHT_KG("weight_kg"),
    BMI("bmi"),
    BODY_FAT_PERCENT("body_fat_percent"),
    MUSCLE_MASS_KG("muscle_mass_kg"),
    BONE_MASS_KG("bone_mass_kg"),
    WATER_PERCENT("water_percent"),
    BMR_KCAL("bmr_kcal"),
    VISCERAL_FAT("visceral_fat"),
    METABOLIC_AGE("metabolic_age"),
    ACTIVITY_LEVEL("activity_level");     // 0: sedentary, 1: moderate, 2: active

    private final String key;

    ProfileField(String key) {
        this.key = key;
    }

    /** request JSON 裡的 key */
    public String key() {
        return key;
    }
}
