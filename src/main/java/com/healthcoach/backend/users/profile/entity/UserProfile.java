package com.healthcoach.backend.users.profile.entity;

import com.healthcoach.backend.common.persistence.StringSetConverter;
import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;

@Data
@Entity
@Table(name = "user_profiles")
public class UserProfile {

    /** owned by the external account service; not generated here */
    @Id
    @Column(name = "user_id")
    private Long userId;

    @Column(name = "age") private Integer age;
    @Column(name = "weight_kg") private Double weightKg;
    @Column(name = "height_cm") private Double heightCm;

    @Column(name = "gender", length = 16) private String gender;
    @Column(name = "activity_level", length = 32) private String activityLevel;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "fitness_goals", nullable = false, length = 512)
    private Set<String> fitnessGoals = new LinkedHashSet<>();

    // preferences
    @Convert(converter = StringSetConverter.class)
    @Column(name = "workout_types", nullable = false, length = 512)
    private Set<String> workoutTypes = new LinkedHashSet<>();

    @Column(name = "session_minutes") private Integer sessionMinutes;
    @Column(name = "days_per_week") private Integer daysPerWeek;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "dietary_restrictions", nullable = false, length = 512)
    private Set<String> dietaryRestrictions = new LinkedHashSet<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        Instant now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
    }

    @PreUpdate
    void onUpdate() { this.updatedAt = Instant.now(); }
}
