package com.healthcoach.backend.coach.model;

/**
 * One logged day. Nullable on purpose: an absent value never fires a rule.
 */
public record ProgressEntry(
        Boolean workoutCompleted,
        Double caloriesConsumed,
        Double targetCalories
) {
    public boolean missedWorkout() {
        return Boolean.FALSE.equals(workoutCompleted);
    }
}
