package com.healthcoach.backend.coach.model;

import java.util.List;

/**
 * Weekly schedule repeated for {@code duration} weeks. {@code adjustments} are the
 * workout recommendations that applied when the plan was generated.
 */
public record WorkoutPlan(
        String planName,
        String description,
        int duration,           // weeks
        int sessionMinutes,
        List<WorkoutDay> workouts,
        List<Recommendation> adjustments
) {
    public WorkoutPlan {
        workouts = List.copyOf(workouts);
        adjustments = List.copyOf(adjustments);
    }
}
