package com.healthcoach.backend.users.plans.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.healthcoach.backend.coach.model.DietPlan;
import com.healthcoach.backend.coach.model.MealPreferences;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.model.WorkoutPlan;
import com.healthcoach.backend.coach.service.CoachService;
import com.healthcoach.backend.common.web.ApiExceptionHandler;
import com.healthcoach.backend.config.CoachProperties;
import com.healthcoach.backend.users.plans.dto.ActivePlanDto;
import com.healthcoach.backend.users.plans.dto.GenerateDietPlanRequest;
import com.healthcoach.backend.users.plans.entity.GeneratedPlan;
import com.healthcoach.backend.users.plans.entity.PlanKind;
import com.healthcoach.backend.users.plans.repo.GeneratedPlanRepository;
import com.healthcoach.backend.users.profile.service.UserProfileService;
import com.healthcoach.backend.users.progress.service.ProgressService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Generates workout and diet plans from the stored profile and recent progress, and
 * keeps the latest one of each kind as the user's active plan.
 */
@Slf4j
@Service
public class PlanService {

    private final GeneratedPlanRepository repo;
    private final UserProfileService profiles;
    private final ProgressService progress;
    private final CoachService coach;
    private final CoachProperties props;
    private final ObjectMapper om;

    public PlanService(GeneratedPlanRepository repo, UserProfileService profiles, ProgressService progress,
                       CoachService coach, CoachProperties props, ObjectMapper om) {
        this.repo = repo;
        this.profiles = profiles;
        this.progress = progress;
        this.coach = coach;
        this.props = props;
        this.om = om;
    }

    // ===== workout =====

    @Transactional
    public ActivePlanDto<WorkoutPlan> generateWorkout(Long userId) {
        Profile profile = UserProfileService.toCoachProfile(profiles.require(userId));

        WorkoutPlan plan = coach.workoutPlan(profile, recent(userId));
        GeneratedPlan saved = store(userId, PlanKind.WORKOUT, plan);

        log.info("[Plan] workout userId={} planId={} days={} adjustments={}",
                userId, saved.getId(), plan.workouts().size(), plan.adjustments().size());
        return new ActivePlanDto<>(saved.getId(), saved.getCreatedAt(), plan);
    }

    @Transactional(readOnly = true)
    public ActivePlanDto<WorkoutPlan> activeWorkout(Long userId) {
        return active(userId, PlanKind.WORKOUT, WorkoutPlan.class);
    }

    // ===== diet =====

    /**
     * @param req may be null; without explicit restrictions the profile's own apply
     * @throws IllegalStateException PROFILE_NOT_FOUND, or PROFILE_INCOMPLETE when age,
     *         weight or height is missing
     */
    @Transactional
    public ActivePlanDto<DietPlan> generateDiet(Long userId, GenerateDietPlanRequest req) {
        Profile profile = UserProfileService.toCoachProfile(profiles.require(userId));
        if (!profile.hasBiometrics()) {
            throw new IllegalStateException(ApiExceptionHandler.PROFILE_INCOMPLETE);
        }

        MealPreferences prefs = (req == null || req.dietaryRestrictions() == null)
                ? new MealPreferences(profile.dietaryRestrictions(), List.of())
                : new MealPreferences(UserProfileService.tags(req.dietaryRestrictions()), req.cuisinePreferences());
        Integer days = (req == null) ? null : req.days();

        DietPlan plan = coach.dietPlan(profile, recent(userId), prefs, days);
        GeneratedPlan saved = store(userId, PlanKind.DIET, plan);

        log.info("[Plan] diet userId={} planId={} days={} kcal={} restrictions={}",
                userId, saved.getId(), plan.days().size(),
                plan.nutritionTargets().dailyCalories(), prefs.restrictions());
        return new ActivePlanDto<>(saved.getId(), saved.getCreatedAt(), plan);
    }

    @Transactional(readOnly = true)
    public ActivePlanDto<DietPlan> activeDiet(Long userId) {
        return active(userId, PlanKind.DIET, DietPlan.class);
    }

    // ===== helpers =====

    private List<ProgressEntry> recent(Long userId) {
        return progress.list(userId, props.getRecentProgressLimit()).stream()
                .map(ProgressService::toEntry)
                .toList();
    }

    private GeneratedPlan store(Long userId, PlanKind kind, Object plan) {
        int retired = repo.retireActive(userId, kind);
        if (retired > 0) log.debug("[Plan] retired {} active {} plan(s) userId={}", retired, kind, userId);
        return repo.save(GeneratedPlan.active(userId, kind, write(plan)));
    }

    private <T> ActivePlanDto<T> active(Long userId, PlanKind kind, Class<T> type) {
        GeneratedPlan p = repo.findFirstByUserIdAndKindAndActiveTrueOrderByIdDesc(userId, kind)
                .orElseThrow(() -> new IllegalStateException(ApiExceptionHandler.PLAN_NOT_FOUND));
        return new ActivePlanDto<>(p.getId(), p.getCreatedAt(), read(p.getPayloadJson(), type));
    }

    private String write(Object plan) {
        try {
            return om.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("PLAN_SERIALIZATION_FAILED", e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("PLAN_PAYLOAD_INVALID", e);
        }
    }
}
