package com.healthcoach.backend.coach.model;

import java.util.List;

public record WorkoutDay(
        String day,         // Monday .. Sunday
        String focus,       // strength | cardio | flexibility
        List<Exercise> exercises
) {
    public WorkoutDay {
        exercises = List.copyOf(exercises);
    }
}
