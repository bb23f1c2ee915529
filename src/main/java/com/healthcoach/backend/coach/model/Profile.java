package com.healthcoach.backend.coach.model;

import java.util.Set;

/**
 * Biometric profile as the coaching core sees it. Range checks happen upstream
 * (profile upsert validation); here every field may still be null.
 */
public record Profile(
        Integer age,
        Double weight,      // kg
        Double height,      // cm
        Gender gender,
        ActivityLevel activityLevel,
        Set<String> fitnessGoals,
        Preferences preferences
) {
    /** enough data for the energy calculation */
    public boolean hasBiometrics() {
        return age != null && weight != null && height != null;
    }

    public Set<String> goals() {
        return (fitnessGoals == null) ? Set.of() : fitnessGoals;
    }

    public boolean hasGoal(String goal) {
        return goals().contains(goal);
    }

    public Set<String> dietaryRestrictions() {
        return (preferences == null) ? Set.of() : preferences.restrictions();
    }
}
