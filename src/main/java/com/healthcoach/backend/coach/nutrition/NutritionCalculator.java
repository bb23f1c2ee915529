package com.healthcoach.backend.coach.nutrition;

import com.healthcoach.backend.coach.model.ActivityLevel;
import com.healthcoach.backend.coach.model.Gender;
import com.healthcoach.backend.coach.model.NutritionTargets;
import com.healthcoach.backend.coach.model.Profile;

/**
 * Daily energy need and macro targets (Harris-Benedict BMR x activity factor,
 * then a goal adjustment). Pure and stateless.
 */
public final class NutritionCalculator {

    public static final String GOAL_WEIGHT_LOSS = "weight_loss";
    public static final String GOAL_MUSCLE_GAIN = "muscle_gain";

    static final double WEIGHT_LOSS_DELTA_KCAL = -500.0;
    static final double MUSCLE_GAIN_DELTA_KCAL = 300.0;

    // share of calories / kcal per gram
    private static final double PROTEIN_PCT = 0.25;
    private static final double CARBS_PCT = 0.45;
    private static final double FATS_PCT = 0.30;
    private static final double KCAL_PER_G_PROTEIN = 4.0;
    private static final double KCAL_PER_G_CARBS = 4.0;
    private static final double KCAL_PER_G_FAT = 9.0;

    private NutritionCalculator() {}

    /** male formula for MALE only; female, other and missing gender share the second one */
    public static double bmr(Profile p) {
        double w = p.weight();
        double h = p.height();
        int age = p.age();
        if (p.gender() == Gender.MALE) {
            return 88.362 + 13.397 * w + 4.799 * h - 5.677 * age;
        }
        return 447.593 + 9.247 * w + 3.098 * h - 4.330 * age;
    }

    public static double tdee(Profile p) {
        return bmr(p) * ActivityLevel.factorOf(p.activityLevel());
    }

    /** first match wins: weight_loss before muscle_gain */
    public static double goalAdjustedCalories(Profile p) {
        double tdee = tdee(p);
        if (p.hasGoal(GOAL_WEIGHT_LOSS)) return tdee + WEIGHT_LOSS_DELTA_KCAL;
        if (p.hasGoal(GOAL_MUSCLE_GAIN)) return tdee + MUSCLE_GAIN_DELTA_KCAL;
        return tdee;
    }

    public static NutritionTargets computeTargets(Profile p) {
        double target = goalAdjustedCalories(p);

        // macros come from the unrounded target; each rounded on its own
        return new NutritionTargets(
                (int) Math.round(target),
                new NutritionTargets.Macros(
                        (int) Math.round(target * PROTEIN_PCT / KCAL_PER_G_PROTEIN),
                        (int) Math.round(target * CARBS_PCT / KCAL_PER_G_CARBS),
                        (int) Math.round(target * FATS_PCT / KCAL_PER_G_FAT)
                )
        );
    }
}
