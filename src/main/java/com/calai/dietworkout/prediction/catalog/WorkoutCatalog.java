package com.calai.dietworkout.prediction.catalog;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 固定運動範本（啟動時建立，唯讀）。
 */
@Component
public class WorkoutCatalog {

    public static final List<WorkoutCatalogEntry> DEFAULT_ENTRIES = List.of(
            new WorkoutCatalogEntry("Bench Press", "Strength", "4 sets x 8 reps", "250 kcal"),
            new WorkoutCatalogEntry("Deadlifts", "Strength", "4 sets x 6 reps", "300 kcal"),
            new WorkoutCatalogEntry("Cycling", "Cardio", "30 mins", "400 kcal"),
            new WorkoutCatalogEntry("Jump Rope", "Cardio", "15 mins", "150 kcal")
    );

    private final List<WorkoutCatalogEntry> entries;

    public WorkoutCatalog() {
        this(DEFAULT_ENTRIES);
    }

    public WorkoutCatalog(List<WorkoutCatalogEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public List<WorkoutCatalogEntry> entries() {
        return entries;
    }
}
