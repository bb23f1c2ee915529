package com.healthcoach.backend.coach.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActivityLevel {
    SEDENTARY("sedentary", 1.2),
    LIGHTLY_ACTIVE("lightly_active", 1.375),
    MODERATELY_ACTIVE("moderately_active", 1.55),
    VERY_ACTIVE("very_active", 1.725);

    private final String key;
    private final double factor;

    ActivityLevel(String key, double factor) {
        this.key = key;
        this.factor = factor;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public double factor() {
        return factor;
    }

    /** null / unknown -> sedentary */
    public static double factorOf(ActivityLevel level) {
        return (level == null) ? SEDENTARY.factor : level.factor;
    }

    /** exact key only; "Very_Active" is unknown and gets the sedentary factor */
    @JsonCreator
    public static ActivityLevel fromKey(String raw) {
        if (raw == null) return null;
        for (ActivityLevel a : values()) {
            if (a.key.equals(raw)) return a;
        }
        return null;
    }
}
