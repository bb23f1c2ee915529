package com.healthcoach.backend.seed;

import com.healthcoach.backend.users.profile.entity.UserProfile;
import com.healthcoach.backend.users.profile.repo.UserProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;

/**
 * Inserts the two demo profiles (user 1 and 2) when they are absent.
 * Existing rows are never touched.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.seed", name = "enabled", havingValue = "true")
public class SampleDataSeeder {

    private final UserProfileRepository repo;

    @EventListener(ApplicationReadyEvent.class)
    public void seed() {
        try {
            int inserted = 0;
            for (UserProfile p : samples()) {
                if (repo.existsById(p.getUserId())) continue;
                repo.save(p);
                inserted++;
            }
            log.info("[Seed] sample profiles inserted={}", inserted);
        } catch (Exception e) {
            // startup must not fail because of demo data
            log.warn("[Seed] failed to insert sample profiles: {}", e.toString());
        }
    }

    static List<UserProfile> samples() {
        return List.of(
                profile(1L, 28, "male", 175.0, 75.0, "moderately_active",
                        List.of("weight_loss", "muscle_gain"),
                        List.of("strength", "cardio"), 45, 4, List.of()),
                profile(2L, 32, "female", 165.0, 60.0, "lightly_active",
                        List.of("endurance", "strength"),
                        List.of("cardio", "flexibility"), 30, 3, List.of("vegetarian"))
        );
    }

    private static UserProfile profile(Long userId, int age, String gender, double heightCm, double weightKg,
                                       String activityLevel, List<String> goals, List<String> workoutTypes,
                                       int minutes, int daysPerWeek, List<String> restrictions) {
        UserProfile p = new UserProfile();
        p.setUserId(userId);
        p.setAge(age);
        p.setGender(gender);
        p.setHeightCm(heightCm);
        p.setWeightKg(weightKg);
        p.setActivityLevel(activityLevel);
        p.setFitnessGoals(new LinkedHashSet<>(goals));
        p.setWorkoutTypes(new LinkedHashSet<>(workoutTypes));
        p.setSessionMinutes(minutes);
        p.setDaysPerWeek(daysPerWeek);
        p.setDietaryRestrictions(new LinkedHashSet<>(restrictions));
        return p;
    }
}
