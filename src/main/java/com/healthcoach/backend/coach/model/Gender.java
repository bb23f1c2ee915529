package com.healthcoach.backend.coach.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Gender {
    MALE("male"),
    FEMALE("female"),
    OTHER("other");

    private final String key;

    Gender(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    /**
     * Exact, case-sensitive key match. Anything else ("Male", " male") maps to null,
     * which the calculator treats like female/other.
     */
    @JsonCreator
    public static Gender fromKey(String raw) {
        if (raw == null) return null;
        for (Gender g : values()) {
            if (g.key.equals(raw)) return g;
        }
        return null;
    }
}
