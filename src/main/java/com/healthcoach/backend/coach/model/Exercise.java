package com.healthcoach.backend.coach.model;

import java.util.List;

/** One exercise of a session; reps is free text ("10-15", "30 sec"). */
public record Exercise(
        String name,
        String type,
        int sets,
        String reps,
        List<String> targetMuscles
) {
    public Exercise {
        targetMuscles = List.copyOf(targetMuscles);
    }

    public Exercise withSets(int newSets) {
        return new Exercise(name, type, newSets, reps, targetMuscles);
    }
}
