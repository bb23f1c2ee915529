package com.healthcoach.backend.coach.exception;

/**
 * The only failure the coaching core surfaces: an unexpected fault while computing
 * (e.g. a profile that skipped upstream validation). Mapped to HTTP 500.
 */
public class RecommendationGenerationException extends RuntimeException {

    public static final String CODE = "RECOMMENDATION_FAILED";

    public RecommendationGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
