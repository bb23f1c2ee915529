package com.healthcoach.backend.coach.dto;

import com.healthcoach.backend.coach.model.MealPreferences;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CoachRequest(
        @NotNull Profile profile,
        List<ProgressEntry> recentProgress,   // most recent first, optional
        MealPreferences preferences           // optional; null means no restrictions
) {}
