package com.healthcoach.backend.coach.plan;

import com.healthcoach.backend.coach.model.Exercise;
import com.healthcoach.backend.coach.model.Preferences;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.model.WorkoutDay;
import com.healthcoach.backend.coach.model.WorkoutPlan;
import com.healthcoach.backend.coach.recommendation.RecommendationEngine;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.healthcoach.backend.coach.nutrition.NutritionCalculator.GOAL_MUSCLE_GAIN;
import static com.healthcoach.backend.coach.nutrition.NutritionCalculator.GOAL_WEIGHT_LOSS;
import static java.time.DayOfWeek.*;

/**
 * Deterministic weekly workout schedule from goals and schedule preferences.
 *
 * <ul>
 *   <li>training days: {@code daysPerWeek} (default 3, clamped to 0..7), spread over the week</li>
 *   <li>session focus rotates over the preferred workout types that the library knows;
 *       without any, the goals pick it: weight_loss / endurance give cardio, muscle_gain /
 *       strength give strength, both kinds alternate, no goal means strength</li>
 *   <li>exercises per session: one per 15 minutes, 2..5</li>
 *   <li>muscle_gain adds one set to strength exercises</li>
 * </ul>
 */
public class WorkoutPlanGenerator {

    static final int DURATION_WEEKS = 8;
    static final int DEFAULT_DAYS_PER_WEEK = 3;
    static final int DEFAULT_SESSION_MINUTES = 45;
    static final int MINUTES_PER_EXERCISE = 15;
    static final int MIN_EXERCISES = 2;
    static final int MAX_EXERCISES = 5;

    static final String DESCRIPTION = "Workout plan based on your goals, schedule and recent progress";

    /** goal order used in the plan name; other goals follow alphabetically */
    private static final List<String> GOAL_ORDER = List.of(GOAL_WEIGHT_LOSS, GOAL_MUSCLE_GAIN, "endurance", "strength");

    private static final Map<Integer, List<DayOfWeek>> SCHEDULES = Map.of(
            1, List.of(MONDAY),
            2, List.of(MONDAY, THURSDAY),
            3, List.of(MONDAY, WEDNESDAY, FRIDAY),
            4, List.of(MONDAY, TUESDAY, THURSDAY, FRIDAY),
            5, List.of(MONDAY, TUESDAY, WEDNESDAY, FRIDAY, SATURDAY),
            6, List.of(MONDAY, TUESDAY, WEDNESDAY, THURSDAY, FRIDAY, SATURDAY),
            7, List.of(DayOfWeek.values())
    );

    private final RecommendationEngine engine;

    public WorkoutPlanGenerator(RecommendationEngine engine) {
        this.engine = engine;
    }

    public WorkoutPlan generate(Profile profile, List<ProgressEntry> recentProgress) {
        Preferences prefs = profile.preferences();
        int days = clamp(prefs == null ? null : prefs.daysPerWeek(), DEFAULT_DAYS_PER_WEEK, 0, 7);
        int minutes = (prefs == null || prefs.duration() == null || prefs.duration() < 1)
                ? DEFAULT_SESSION_MINUTES
                : prefs.duration();
        int perSession = Math.max(MIN_EXERCISES, Math.min(MAX_EXERCISES, minutes / MINUTES_PER_EXERCISE));

        List<String> focuses = focusRotation(profile);
        Map<String, Integer> sessionsSoFar = new HashMap<>();
        List<WorkoutDay> workouts = new ArrayList<>();

        List<DayOfWeek> schedule = SCHEDULES.getOrDefault(days, List.of());
        for (int i = 0; i < schedule.size(); i++) {
            String focus = focuses.get(i % focuses.size());
            int nth = sessionsSoFar.merge(focus, 1, Integer::sum) - 1;
            workouts.add(new WorkoutDay(
                    schedule.get(i).getDisplayName(TextStyle.FULL, Locale.ENGLISH),
                    focus,
                    session(profile, focus, nth, perSession)));
        }

        return new WorkoutPlan(
                planName(profile),
                DESCRIPTION,
                DURATION_WEEKS,
                minutes,
                workouts,
                engine.generate(profile, recentProgress).workout());
    }

    /** the nth session of a focus starts where the previous one stopped */
    private static List<Exercise> session(Profile profile, String focus, int nth, int count) {
        List<Exercise> pool = ExerciseLibrary.forFocus(focus);
        int start = (nth * count) % pool.size();
        boolean extraSet = ExerciseLibrary.STRENGTH.equals(focus) && profile.hasGoal(GOAL_MUSCLE_GAIN);

        List<Exercise> out = new ArrayList<>(count);
        for (int j = 0; j < Math.min(count, pool.size()); j++) {
            Exercise e = pool.get((start + j) % pool.size());
            out.add(extraSet ? e.withSets(e.sets() + 1) : e);
        }
        return out;
    }

    static List<String> focusRotation(Profile profile) {
        Preferences prefs = profile.preferences();
        if (prefs != null && prefs.workoutTypes() != null) {
            List<String> preferred = ExerciseLibrary.focuses().stream()
                    .filter(prefs.workoutTypes()::contains)
                    .toList();
            if (!preferred.isEmpty()) return preferred;
        }
        boolean cardio = profile.hasGoal(GOAL_WEIGHT_LOSS) || profile.hasGoal("endurance");
        boolean strength = profile.hasGoal(GOAL_MUSCLE_GAIN) || profile.hasGoal("strength");
        if (cardio && strength) return List.of(ExerciseLibrary.STRENGTH, ExerciseLibrary.CARDIO);
        if (cardio) return List.of(ExerciseLibrary.CARDIO);
        return List.of(ExerciseLibrary.STRENGTH);
    }

    static String planName(Profile profile) {
        if (profile.goals().isEmpty()) return "Personalized General Fitness Plan";
        List<String> ordered = profile.goals().stream()
                .sorted((a, b) -> {
                    int ia = GOAL_ORDER.indexOf(a), ib = GOAL_ORDER.indexOf(b);
                    if (ia < 0 && ib < 0) return a.compareTo(b);
                    if (ia < 0) return 1;
                    if (ib < 0) return -1;
                    return Integer.compare(ia, ib);
                })
                .toList();
        return "Personalized " + String.join(" & ", ordered) + " Plan";
    }

    private static int clamp(Integer v, int dflt, int min, int max) {
        if (v == null) return dflt;
        return Math.max(min, Math.min(max, v));
    }
}
