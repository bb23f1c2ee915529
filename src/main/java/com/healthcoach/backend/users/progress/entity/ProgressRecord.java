package com.healthcoach.backend.users.progress.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.time.LocalDate;

/** One logged day per user. */
@Data
@Entity
@Table(name = "user_progress",
        uniqueConstraints = @UniqueConstraint(name = "uq_progress_user_day", columnNames = {"user_id", "entry_date"}),
        indexes = @Index(name = "idx_progress_user_date", columnList = "user_id, entry_date"))
public class ProgressRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "entry_date", nullable = false)
    private LocalDate entryDate;

    @Column(name = "workout_completed")
    private Boolean workoutCompleted;

    @Column(name = "calories_consumed")
    private Double caloriesConsumed;

    @Column(name = "target_calories")
    private Double targetCalories;

    @Column(name = "weight_kg")
    private Double weightKg;

    @Column(name = "notes", length = 500)
    private String notes;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @PrePersist
    @PreUpdate
    void touch() { this.updatedAt = Instant.now(); }
}
