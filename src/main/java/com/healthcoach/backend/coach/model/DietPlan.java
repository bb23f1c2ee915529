package com.healthcoach.backend.coach.model;

import java.util.List;

public record DietPlan(
        String planName,
        NutritionTargets nutritionTargets,
        List<DietDay> days,
        List<Recommendation> guidance
) {
    public DietPlan {
        days = List.copyOf(days);
        guidance = List.copyOf(guidance);
    }
}
