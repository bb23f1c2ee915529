package com.healthcoach.backend.coach.model;

import java.util.List;

public record MealDefinition(
        String name,
        int calories,
        int protein,
        int carbs,
        int fats,
        List<String> ingredients,
        int prepTime,       // minutes
        boolean vegan,
        boolean glutenFree
) {
    public MealDefinition {
        ingredients = List.copyOf(ingredients);
    }
}
