package com.healthcoach.backend.users.plans.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * A generated workout or diet plan, stored as JSON. At most one row per user and kind
 * is active; generating a new plan retires the previous one.
 */
@Getter
@Setter
@Entity
@Table(name = "user_plans",
        indexes = @Index(name = "idx_user_plans_active", columnList = "user_id, kind, active"))
public class GeneratedPlan {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", length = 16, nullable = false)
    private PlanKind kind;

    @Column(name = "active", nullable = false)
    private boolean active;

    @Column(name = "payload_json", columnDefinition = "TEXT", nullable = false)
    private String payloadJson;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @PrePersist
    void prePersist() {
        if (createdAt == null) createdAt = Instant.now();
    }

    public static GeneratedPlan active(Long userId, PlanKind kind, String payloadJson) {
        GeneratedPlan p = new GeneratedPlan();
        p.userId = userId;
        p.kind = kind;
        p.active = true;
        p.payloadJson = payloadJson;
        return p;
    }
}
