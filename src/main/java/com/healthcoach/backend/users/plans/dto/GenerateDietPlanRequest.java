package com.healthcoach.backend.users.plans.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.util.List;

/**
 * Optional body of the diet plan generation. Null restrictions fall back to the
 * stored profile's dietary restrictions.
 */
public record GenerateDietPlanRequest(
        @Min(value = 1, message = "Days must be between 1 and 14")
        @Max(value = 14, message = "Days must be between 1 and 14")
        Integer days,
        List<String> dietaryRestrictions,
        List<String> cuisinePreferences
) {}
