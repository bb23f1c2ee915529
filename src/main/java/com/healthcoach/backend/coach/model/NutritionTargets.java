package com.healthcoach.backend.coach.model;

public record NutritionTargets(int dailyCalories, Macros macros) {

    /** grams */
    public record Macros(int protein, int carbs, int fats) {}
}
