package com.calai.dietworkout.prediction.service;

import com.calai.dietworkout.prediction.exception.MissingParameterException;
import com.calai.dietworkout.prediction.model.ProfileField;
import com.calai.dietworkout.prediction.model.UserProfile;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * 把 request body 轉成 {@link UserProfile}。
 * <p>
 * 只檢查「必要欄位有沒有出現」，依 {@link ProfileField} 順序，遇到第一個缺的就丟
 * {@link MissingParameterException}（400）。型別不對不算驗證錯誤，
 * 一律丟 IllegalStateException，由全站 advice 回 500。
 */
@Component
public class RequestValidator {

    public static final String USER_ALLERGY = "user_allergy";
    public static final String USER_PREFERENCE = "user_preference";
    public static final String DIET_TYPE = "diet_type";
    public static final String WORKOUT_PREFERENCE = "workout_preference";
    public static final String USER_GOAL = "user_goal";

    public static final String DEFAULT_DIET_TYPE = "Regular";
    public static final String DEFAULT_WORKOUT_PREFERENCE = "Gym";
    public static final String DEFAULT_USER_GOAL = "general-fitness";

    public UserProfile validate(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new IllegalStateException("REQUEST_BODY_NOT_OBJECT");
        }

        // 1) presence：first-failure
        for (ProfileField f : ProfileField.values()) {
            if (!body.has(f.key())) throw new MissingParameterException(f.key());
        }

        // 2) 取值（不做範圍檢查）
        Map<ProfileField, Double> v = new EnumMap<>(ProfileField.class);
        for (ProfileField f : ProfileField.values()) {
            v.put(f, number(body.get(f.key()), f.key()));
        }

        // 3) personalization：只有三個轉小寫，diet_type / workout_preference 保留原樣
        String allergy = lower(text(body, USER_ALLERGY, ""));
        String preference = lower(text(body, USER_PREFERENCE, ""));
        String dietType = text(body, DIET_TYPE, DEFAULT_DIET_TYPE);
        String workoutPreference = text(body, WORKOUT_PREFERENCE, DEFAULT_WORKOUT_PREFERENCE);
        String goal = lower(text(body, USER_GOAL, DEFAULT_USER_GOAL));

        return new UserProfile(
                v.get(ProfileField.AGE),
                v.get(ProfileField.GENDER),
                v.get(ProfileField.HEIGHT_CM),
                v.get(ProfileField.WEIGHT_KG),
                v.get(ProfileField.BMI),
                v.get(ProfileField.BODY_FAT_PERCENT),
                v.get(ProfileField.MUSCLE_MASS_KG),
                v.get(ProfileField.BONE_MASS_KG),
                v.get(ProfileField.WATER_PERCENT),
                v.get(ProfileField.BMR_KCAL),
                v.get(ProfileField.VISCERAL_FAT),
                v.get(ProfileField.METABOLIC_AGE),
                v.get(ProfileField.ACTIVITY_LEVEL),
                allergy,
                preference,
                dietType,
                workoutPreference,
                goal
        );
    }

    private static double number(JsonNode n, String key) {
        if (n == null || !n.isNumber()) {
            throw new IllegalStateException("NON_NUMERIC_PARAMETER: " + key);
        }
        return n.doubleValue();
    }

    private static String text(JsonNode body, String key, String dft) {
        if (!body.has(key)) return dft;
        JsonNode n = body.get(key);
        if (!n.isTextual()) {
            throw new IllegalStateException("NON_STRING_PARAMETER: " + key);
        }
        return n.textValue();
    }

    private static String lower(String s) {
        return s.toLowerCase(Locale.ROOT);
    }
}
