package com.healthcoach.backend.users.progress.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/** Null fields leave the stored value of that day untouched. */
public record RecordProgressRequest(
        LocalDate date,                         // null -> today (server zone)
        Boolean workoutCompleted,
        @PositiveOrZero Double caloriesConsumed,
        @PositiveOrZero Double targetCalories,  // null -> kept, or derived from the stored profile when unset
        @DecimalMin("30") @DecimalMax("300") Double weight,
        @Size(max = 500) String notes
) {}
