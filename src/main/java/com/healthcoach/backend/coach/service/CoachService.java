package com.healthcoach.backend.coach.service;

import com.healthcoach.backend.coach.dto.PersonalizedPlanResponse;
import com.healthcoach.backend.coach.exception.RecommendationGenerationException;
import com.healthcoach.backend.coach.meal.MealPlanFilter;
import com.healthcoach.backend.coach.model.DietPlan;
import com.healthcoach.backend.coach.model.MealDefinition;
import com.healthcoach.backend.coach.model.MealPreferences;
import com.healthcoach.backend.coach.model.NutritionTargets;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.model.Recommendations;
import com.healthcoach.backend.coach.model.WorkoutPlan;
import com.healthcoach.backend.coach.nutrition.NutritionCalculator;
import com.healthcoach.backend.coach.plan.DietPlanGenerator;
import com.healthcoach.backend.coach.plan.WorkoutPlanGenerator;
import com.healthcoach.backend.coach.recommendation.RecommendationEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Entry point to the coaching core. Stateless; every call either returns a full
 * result or throws {@link RecommendationGenerationException}.
 */
@Slf4j
@Service
public class CoachService {

    static final String FAILED_MESSAGE = "Failed to generate recommendations";

    private final RecommendationEngine engine;
    private final MealPlanFilter mealPlanFilter;
    private final WorkoutPlanGenerator workoutPlans;
    private final DietPlanGenerator dietPlans;

    public CoachService(RecommendationEngine engine, MealPlanFilter mealPlanFilter) {
        this.engine = engine;
        this.mealPlanFilter = mealPlanFilter;
        this.workoutPlans = new WorkoutPlanGenerator(engine);
        this.dietPlans = new DietPlanGenerator(mealPlanFilter, engine);
    }

    public NutritionTargets nutritionTargets(Profile profile) {
        return guarded("nutritionTargets", () -> NutritionCalculator.computeTargets(profile));
    }

    public Recommendations recommendations(Profile profile, List<ProgressEntry> recentProgress) {
        return guarded("recommendations", () -> engine.generate(profile, nz(recentProgress)));
    }

    public Map<String, List<MealDefinition>> mealPlan(Profile profile, MealPreferences prefs) {
        return guarded("mealPlan", () -> mealPlanFilter.buildPlan(profile, prefs));
    }

    public PersonalizedPlanResponse personalize(Profile profile,
                                                List<ProgressEntry> recentProgress,
                                                MealPreferences prefs) {
        return guarded("personalize", () -> {
            NutritionTargets targets = NutritionCalculator.computeTargets(profile);
            Recommendations recs = engine.generate(profile, nz(recentProgress));
            Map<String, List<MealDefinition>> plan = mealPlanFilter.buildPlan(profile, prefs);

            log.debug("[Coach] personalize kcal={} workout={} nutrition={} slots={}",
                    targets.dailyCalories(), recs.workout().size(), recs.nutrition().size(), plan.size());
            return new PersonalizedPlanResponse(targets, recs, plan);
        });
    }

    public WorkoutPlan workoutPlan(Profile profile, List<ProgressEntry> recentProgress) {
        return guarded("workoutPlan", () -> workoutPlans.generate(profile, nz(recentProgress)));
    }

    /** @param days null -> one week */
    public DietPlan dietPlan(Profile profile, List<ProgressEntry> recentProgress,
                             MealPreferences prefs, Integer days) {
        return guarded("dietPlan", () -> dietPlans.generate(profile, nz(recentProgress), prefs, days));
    }

    private static <T> T guarded(String op, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.error("[Coach] {} failed", op, e);
            throw new RecommendationGenerationException(FAILED_MESSAGE, e);
        }
    }

    private static List<ProgressEntry> nz(List<ProgressEntry> v) {
        return (v == null) ? List.of() : v;
    }
}
