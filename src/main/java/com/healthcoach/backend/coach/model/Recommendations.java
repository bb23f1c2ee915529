package com.healthcoach.backend.coach.model;

import java.util.List;

public record Recommendations(
        List<Recommendation> workout,
        List<Recommendation> nutrition,
        List<Recommendation> lifestyle
) {}
