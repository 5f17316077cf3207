package com.calai.dietworkout.prediction.catalog;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 固定三餐範本（啟動時建立，唯讀）。
 */
@Component
public class MealCatalog {

    public static final List<MealCatalogEntry> DEFAULT_ENTRIES = List.of(
            new MealCatalogEntry("Breakfast", "Oatmeal + Nuts", "350 kcal",
                    "Whole Wheat Toast", "nuts"),
            new MealCatalogEntry("Lunch", "Grilled Chicken + Peanut Sauce", "600 kcal",
                    "Tofu + Salad", "nuts"),
            new MealCatalogEntry("Dinner", "Fish + Almond Quinoa", "500 kcal",
                    "Lentil Soup + Rice", "nuts")
    );

    private final List<MealCatalogEntry> entries;

    public MealCatalog() {
        this(DEFAULT_ENTRIES);
    }

    public MealCatalog(List<MealCatalogEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<MealCatalogEntry> entries() {
        return entries;
    }
}
