package com.healthcoach.backend.coach.model;

import java.util.Set;

public record Preferences(
        Set<String> workoutTypes,
        Integer duration,          // minutes per session
        Integer daysPerWeek,
        Set<String> dietaryRestrictions
) {
    public Set<String> restrictions() {
        return (dietaryRestrictions == null) ? Set.of() : dietaryRestrictions;
    }
}
