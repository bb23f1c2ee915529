package com.healthcoach.backend.coach.model;

import java.util.Map;

/** slot key -> meal; a slot with no allowed meal is absent. Totals are the sum of the meals. */
public record DietDay(
        int day,
        Map<String, MealDefinition> meals,
        int calories,
        int protein,
        int carbs,
        int fats
) {}
