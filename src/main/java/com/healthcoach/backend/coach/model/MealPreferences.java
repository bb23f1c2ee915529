package com.healthcoach.backend.coach.model;

import java.util.List;
import java.util.Set;

/**
 * cuisinePreferences is accepted for API compatibility but not applied by the filter.
 */
public record MealPreferences(
        Set<String> dietaryRestrictions,
        List<String> cuisinePreferences
) {
    public Set<String> restrictions() {
        return (dietaryRestrictions == null) ? Set.of() : dietaryRestrictions;
    }
}
