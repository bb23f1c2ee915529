package com.healthcoach.backend.users.plans.entity;

public enum PlanKind {
    WORKOUT,
    DIET
}
