package com.calai.dietworkout.prediction;

import com.calai.dietworkout.prediction.catalog.MealCatalog;
import com.calai.dietworkout.prediction.catalog.MealCatalogEntry;
import com.calai.dietworkout.prediction.catalog.WorkoutCatalog;
import com.calai.dietworkout.prediction.dto.MealPlanItem;
import com.calai.dietworkout.prediction.dto.WorkoutPlanItem;
import com.calai.dietworkout.prediction.service.PlanGenerator;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class PlanGeneratorTest {

    private final PlanGenerator gen = new PlanGenerator(new MealCatalog(), new WorkoutCatalog());

    @Test
    void no_allergy_uses_primary_foods() {
        List<MealPlanItem> plan = gen.mealPlan("");

        assertThat(plan).extracting(MealPlanItem::meal)
                .containsExactly("Breakfast", "Lunch", "Dinner");
        assertThat(plan).extracting(MealPlanItem::food)
                .containsExactly("Oatmeal + Nuts", "Grilled Chicken + Peanut Sauce", "Fish + Almond Quinoa");
        assertThat(plan).extracting(MealPlanItem::calories)
                .containsExactly("350 kcal", "600 kcal", "500 kcal");
        assertThat(plan).allMatch(MealPlanItem::allergySafe);
    }

    @Test
    void nuts_allergy_uses_alternatives_and_stays_allergy_safe() {
        List<MealPlanItem> plan = gen.mealPlan("nuts");

        assertThat(plan).extracting(MealPlanItem::food)
                .containsExactly("Whole Wheat Toast", "Tofu + Salad", "Lentil Soup + Rice");
        assertThat(plan).allMatch(MealPlanItem::allergySafe);
    }

    @Test
    void allergy_matches_by_substring() {
        assertThat(gen.mealPlan("nut")).extracting(MealPlanItem::food)
                .containsExactly("Whole Wheat Toast", "Tofu + Salad", "Lentil Soup + Rice");
    }

    @Test
    void unrelated_allergy_keeps_primary_foods_and_flag_is_still_true() {
        List<MealPlanItem> plan = gen.mealPlan("dairy");

        assertThat(plan).extracting(MealPlanItem::food)
                .containsExactly("Oatmeal + Nuts", "Grilled Chicken + Peanut Sauce", "Fish + Almond Quinoa");
        assertThat(plan).allMatch(MealPlanItem::allergySafe);
    }

    @Test
    void allergen_tag_is_compared_lower_cased() {
        PlanGenerator custom = new PlanGenerator(
                new MealCatalog(List.of(new MealCatalogEntry("Snack", "Peanuts", "200 kcal", "Apple", "NUTS"))),
                new WorkoutCatalog());

        assertThat(custom.mealPlan("nuts")).extracting(MealPlanItem::food).containsExactly("Apple");
    }

    @Test
    void muscle_gain_keeps_strength_only() {
        assertThat(gen.workoutPlan("muscle-gain")).extracting(WorkoutPlanItem::exercise)
                .containsExactly("Bench Press", "Deadlifts");
    }

    @Test
    void weight_loss_keeps_cardio_only() {
        List<WorkoutPlanItem> plan = gen.workoutPlan("weight-loss");

        assertThat(plan).extracting(WorkoutPlanItem::exercise).containsExactly("Cycling", "Jump Rope");
        assertThat(plan).extracting(WorkoutPlanItem::repsSets).containsExactly("30 mins", "15 mins");
    }

    @Test
    void general_fitness_keeps_everything_in_table_order() {
        List<WorkoutPlanItem> plan = gen.workoutPlan("general-fitness");

        assertThat(plan).extracting(WorkoutPlanItem::exercise)
                .containsExactly("Bench Press", "Deadlifts", "Cycling", "Jump Rope");
        assertThat(plan.get(0)).isEqualTo(new WorkoutPlanItem("Bench Press", "Strength", "4 sets x 8 reps", "250 kcal"));
    }

    @Test
    void unknown_goal_gives_empty_plan() {
        assertThat(gen.workoutPlan("flexibility")).isEmpty();
        assertThat(gen.workoutPlan("")).isEmpty();
    }

    @Test
    void catalogs_are_read_only() {
        MealCatalog meals = new MealCatalog();
        assertThatThrownBy(() -> meals.entries().clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
