package com.healthcoach.backend.users.progress.dto;

import java.time.LocalDate;

public record ProgressDto(
        Long id,
        LocalDate date,
        Boolean workoutCompleted,
        Double caloriesConsumed,
        Double targetCalories,
        Double weight,
        String notes
) {}
