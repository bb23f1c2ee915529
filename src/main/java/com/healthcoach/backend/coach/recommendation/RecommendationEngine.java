package com.healthcoach.backend.coach.recommendation;

import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.model.Recommendation;
import com.healthcoach.backend.coach.model.RecommendationType;
import com.healthcoach.backend.coach.model.Recommendations;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.healthcoach.backend.coach.nutrition.NutritionCalculator.GOAL_MUSCLE_GAIN;
import static com.healthcoach.backend.coach.nutrition.NutritionCalculator.GOAL_WEIGHT_LOSS;

/**
 * Rule-based coaching tips. Three independent generators; list order is rule order.
 * Absent goals / restrictions / progress simply fire nothing.
 */
@Component
public class RecommendationEngine {

    /** caloriesConsumed above target * this ratio counts as an overshoot */
    static final double CALORIE_OVERSHOOT_RATIO = 1.2;

    static final String RESTRICTION_VEGETARIAN = "vegetarian";

    static final Recommendation MISSED_WORKOUT = new Recommendation(
            RecommendationType.MOTIVATION,
            "You missed yesterday's workout. Let's get back on track with a lighter session today!",
            "Start with a 20-minute beginner workout");

    static final Recommendation HIIT = new Recommendation(
            RecommendationType.CARDIO,
            "Add 15 minutes of HIIT training to boost fat burning",
            "Try interval running or cycling");

    static final Recommendation PROGRESSIVE_OVERLOAD = new Recommendation(
            RecommendationType.STRENGTH,
            "Focus on progressive overload this week",
            "Increase weights by 5% or add 2 more reps");

    static final Recommendation PORTION_CONTROL = new Recommendation(
            RecommendationType.CALORIE_CONTROL,
            "You exceeded your calorie target yesterday. Let's focus on portion control today.",
            "Try using smaller plates and eating slowly");

    static final Recommendation PLANT_PROTEIN = new Recommendation(
            RecommendationType.PROTEIN,
            "Ensure adequate protein intake with plant-based sources",
            "Include lentils, quinoa, or Greek yogurt in your meals");

    static final Recommendation SLEEP = new Recommendation(
            RecommendationType.SLEEP,
            "Quality sleep is crucial for recovery and weight management",
            "Aim for 7-9 hours of sleep tonight");

    static final Recommendation HYDRATION = new Recommendation(
            RecommendationType.HYDRATION,
            "Stay hydrated to support your metabolism and workout performance",
            "Drink at least 8 glasses of water today");

    /**
     * @param recentProgress most recent first; only index 0 is read. null = none.
     */
    public Recommendations generate(Profile profile, List<ProgressEntry> recentProgress) {
        ProgressEntry latest = latest(recentProgress);
        return new Recommendations(
                workout(profile, latest),
                nutrition(profile, latest),
                lifestyle()
        );
    }

    List<Recommendation> workout(Profile profile, ProgressEntry latest) {
        List<Recommendation> out = new ArrayList<>();

        if (latest != null && latest.missedWorkout()) {
            out.add(MISSED_WORKOUT);
        }
        if (profile.hasGoal(GOAL_WEIGHT_LOSS)) {
            out.add(HIIT);
        }
        if (profile.hasGoal(GOAL_MUSCLE_GAIN)) {
            out.add(PROGRESSIVE_OVERLOAD);
        }
        return out;
    }

    List<Recommendation> nutrition(Profile profile, ProgressEntry latest) {
        List<Recommendation> out = new ArrayList<>();

        if (latest != null && exceededTarget(latest)) {
            out.add(PORTION_CONTROL);
        }
        if (profile.dietaryRestrictions().contains(RESTRICTION_VEGETARIAN)) {
            out.add(PLANT_PROTEIN);
        }
        return out;
    }

    List<Recommendation> lifestyle() {
        return List.of(SLEEP, HYDRATION);
    }

    static boolean exceededTarget(ProgressEntry e) {
        Double consumed = e.caloriesConsumed();
        Double target = e.targetCalories();
        if (consumed == null || target == null) return false;
        return consumed > target * CALORIE_OVERSHOOT_RATIO;
    }

    private static ProgressEntry latest(List<ProgressEntry> recentProgress) {
        if (recentProgress == null || recentProgress.isEmpty()) return null;
        return recentProgress.get(0);
    }
}
