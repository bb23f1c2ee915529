package com.healthcoach.backend.users.profile.dto;

import com.healthcoach.backend.coach.model.Preferences;

import java.time.Instant;
import java.util.Set;

public record UserProfileDto(
        Long userId,
        Integer age,
        Double weight,
        Double height,
        String gender,
        String activityLevel,
        Set<String> fitnessGoals,
        Preferences preferences,
        Instant updatedAt
) {}
