package com.healthcoach.backend.users.profile.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;

import java.util.List;

/** Partial update: null fields keep the stored value. */
public record UpsertProfileRequest(
        @Min(value = 13, message = "Age must be between 13 and 120")
        @Max(value = 120, message = "Age must be between 13 and 120")
        Integer age,

        @DecimalMin(value = "30", message = "Weight must be between 30 and 300 kg")
        @DecimalMax(value = "300", message = "Weight must be between 30 and 300 kg")
        Double weight,

        @DecimalMin(value = "100", message = "Height must be between 100 and 250 cm")
        @DecimalMax(value = "250", message = "Height must be between 100 and 250 cm")
        Double height,

        @Pattern(regexp = "male|female|other", message = "Gender must be male, female, or other")
        String gender,

        @Pattern(regexp = "sedentary|lightly_active|moderately_active|very_active",
                message = "Invalid activity level")
        String activityLevel,

        List<@Pattern(regexp = TAG, message = TAG_MESSAGE) String> fitnessGoals,

        @Valid PreferencesBody preferences
) {
    /** tags are stored comma joined, so a tag may not contain one */
    public static final String TAG = "[^,]*";
    public static final String TAG_MESSAGE = "Tags must not contain commas";

    public record PreferencesBody(
            List<@Pattern(regexp = TAG, message = TAG_MESSAGE) String> workoutTypes,
            @Min(value = 1, message = "Duration must be at least 1 minute") Integer duration,
            @Min(value = 0, message = "Days per week must be between 0 and 7")
            @Max(value = 7, message = "Days per week must be between 0 and 7")
            Integer daysPerWeek,
            List<@Pattern(regexp = TAG, message = TAG_MESSAGE) String> dietaryRestrictions
    ) {}
}
