package com.healthcoach.backend.coach.model;

public record Recommendation(
        RecommendationType type,
        String message,
        String action
) {}
