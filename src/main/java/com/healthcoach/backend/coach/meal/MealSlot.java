package com.healthcoach.backend.coach.meal;

public enum MealSlot {
    BREAKFAST("breakfast"),
    LUNCH("lunch"),
    DINNER("dinner");

    private final String key;

    MealSlot(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
