package com.healthcoach.backend.coach.dto;

import com.healthcoach.backend.coach.model.MealDefinition;
import com.healthcoach.backend.coach.model.NutritionTargets;
import com.healthcoach.backend.coach.model.Recommendations;

import java.util.List;
import java.util.Map;

public record PersonalizedPlanResponse(
        NutritionTargets nutritionTargets,
        Recommendations recommendations,
        Map<String, List<MealDefinition>> mealPlan
) {}
