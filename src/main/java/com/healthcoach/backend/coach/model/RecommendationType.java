package com.healthcoach.backend.coach.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecommendationType {
    MOTIVATION("motivation"),
    CARDIO("cardio"),
    STRENGTH("strength"),
    CALORIE_CONTROL("calorie_control"),
    PROTEIN("protein"),
    SLEEP("sleep"),
    HYDRATION("hydration");

    private final String key;

    RecommendationType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
