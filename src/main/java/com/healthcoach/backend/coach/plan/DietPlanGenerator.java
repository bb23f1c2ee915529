package com.healthcoach.backend.coach.plan;

import com.healthcoach.backend.coach.meal.MealPlanFilter;
import com.healthcoach.backend.coach.model.DietDay;
import com.healthcoach.backend.coach.model.DietPlan;
import com.healthcoach.backend.coach.model.MealDefinition;
import com.healthcoach.backend.coach.model.MealPreferences;
import com.healthcoach.backend.coach.model.NutritionTargets;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.nutrition.NutritionCalculator;
import com.healthcoach.backend.coach.recommendation.RecommendationEngine;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Multi-day meal plan: the filtered catalog rotated day by day (day d takes meal
 * {@code d % n} of each slot), with the daily targets and the nutrition tips attached.
 * Meals are not scaled to the targets.
 */
public class DietPlanGenerator {

    public static final int DEFAULT_DAYS = 7;
    public static final int MAX_DAYS = 14;

    private final MealPlanFilter mealPlanFilter;
    private final RecommendationEngine engine;

    public DietPlanGenerator(MealPlanFilter mealPlanFilter, RecommendationEngine engine) {
        this.mealPlanFilter = mealPlanFilter;
        this.engine = engine;
    }

    /**
     * @param days  null -> {@value #DEFAULT_DAYS}; clamped to 1..{@value #MAX_DAYS}
     * @param prefs null -> no restrictions
     */
    public DietPlan generate(Profile profile, List<ProgressEntry> recentProgress,
                             MealPreferences prefs, Integer days) {
        int n = (days == null) ? DEFAULT_DAYS : Math.max(1, Math.min(MAX_DAYS, days));

        NutritionTargets targets = NutritionCalculator.computeTargets(profile);
        Map<String, List<MealDefinition>> allowed = mealPlanFilter.buildPlan(profile, prefs);

        List<DietDay> schedule = new ArrayList<>(n);
        for (int d = 0; d < n; d++) {
            schedule.add(day(d, allowed));
        }

        return new DietPlan(
                "Personalized " + n + "-Day Meal Plan",
                targets,
                schedule,
                engine.generate(profile, recentProgress).nutrition());
    }

    private static DietDay day(int index, Map<String, List<MealDefinition>> allowed) {
        Map<String, MealDefinition> meals = new LinkedHashMap<>();
        int kcal = 0, protein = 0, carbs = 0, fats = 0;

        for (Map.Entry<String, List<MealDefinition>> slot : allowed.entrySet()) {
            List<MealDefinition> options = slot.getValue();
            if (options.isEmpty()) continue;
            MealDefinition m = options.get(index % options.size());
            meals.put(slot.getKey(), m);
            kcal += m.calories();
            protein += m.protein();
            carbs += m.carbs();
            fats += m.fats();
        }
        return new DietDay(index + 1, meals, kcal, protein, carbs, fats);
    }
}
