package com.calai.dietworkout.prediction.service;

import com.calai.dietworkout.prediction.catalog.MealCatalog;
import com.calai.dietworkout.prediction.catalog.MealCatalogEntry;
import com.calai.dietworkout.prediction.catalog.WorkoutCatalog;
import com.calai.dietworkout.prediction.catalog.WorkoutCatalogEntry;
import com.calai.dietworkout.prediction.dto.MealPlanItem;
import com.calai.dietworkout.prediction.dto.WorkoutPlanItem;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 依固定範本產生菜單與運動清單（輸出順序 = 範本順序）。
 */
@Service
public class PlanGenerator {

    public static final String GOAL_MUSCLE_GAIN = "muscle-gain";
    public static final String GOAL_WEIGHT_LOSS = "weight-loss";
    public static final String GOAL_GENERAL_FITNESS = "general-fitness";

    private final MealCatalog meals;
    private final WorkoutCatalog workouts;

    public PlanGenerator(MealCatalog meals, WorkoutCatalog workouts) {
        this.meals = meals;
        this.workouts = workouts;
    }

    /**
     * allergy 非空且是 allergen 的子字串（"nut" 也會命中 "nuts"）就換替代餐。
     * AllergySafe 固定 true，兩個分支都一樣。
     */
    public List<MealPlanItem> mealPlan(String userAllergy) {
        String allergy = userAllergy == null ? "" : userAllergy;
        List<MealPlanItem> out = new ArrayList<>(meals.entries().size());
        for (MealCatalogEntry m : meals.entries()) {
            boolean substitute = !allergy.isEmpty()
                    && m.allergen().toLowerCase(Locale.ROOT).contains(allergy);
            String food = substitute ? m.alternative() : m.food();
            out.add(new MealPlanItem(m.meal(), food, m.calories(), true));
        }
        return out;
    }

    /**
     * - muscle-gain：只留 Strength
     * - weight-loss：只留 Cardio
     * - general-fitness：全部
     * - 其他 goal：空清單
     */
    public List<WorkoutPlanItem> workoutPlan(String userGoal) {
        List<WorkoutPlanItem> out = new ArrayList<>();
        for (WorkoutCatalogEntry w : workouts.entries()) {
            String type = w.type().toLowerCase(Locale.ROOT);
            if (GOAL_MUSCLE_GAIN.equals(userGoal) && "strength".equals(type)) {
                out.add(toItem(w));
            } else if (GOAL_WEIGHT_LOSS.equals(userGoal) && "cardio".equals(type)) {
                out.add(toItem(w));
            } else if (GOAL_GENERAL_FITNESS.equals(userGoal)) {
                out.add(toItem(w));
            }
        }
        return out;
    }

    private static WorkoutPlanItem toItem(WorkoutCatalogEntry w) {
        return new WorkoutPlanItem(w.exercise(), w.type(), w.repsSets(), w.caloriesBurned());
    }
}
