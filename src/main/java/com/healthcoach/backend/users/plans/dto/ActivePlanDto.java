package com.healthcoach.backend.users.plans.dto;

import java.time.Instant;

public record ActivePlanDto<T>(
        Long id,
        Instant generatedAt,
        T plan
) {}
