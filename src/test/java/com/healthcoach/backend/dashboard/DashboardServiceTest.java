package com.healthcoach.backend.dashboard;

import com.healthcoach.backend.coach.meal.MealPlanFilter;
import com.healthcoach.backend.coach.model.RecommendationType;
import com.healthcoach.backend.coach.recommendation.RecommendationEngine;
import com.healthcoach.backend.coach.service.CoachService;
import com.healthcoach.backend.config.CoachProperties;
import com.healthcoach.backend.dashboard.dto.DashboardResponse;
import com.healthcoach.backend.dashboard.service.DashboardService;
import com.healthcoach.backend.users.profile.entity.UserProfile;
import com.healthcoach.backend.users.profile.service.UserProfileService;
import com.healthcoach.backend.users.progress.dto.ProgressDto;
import com.healthcoach.backend.users.progress.service.ProgressService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    @Mock UserProfileService profiles;
    @Mock ProgressService progress;

    private DashboardService svc() {
        CoachProperties props = new CoachProperties();
        props.setRecentProgressLimit(5);
        CoachService coach = new CoachService(new RecommendationEngine(), new MealPlanFilter());
        return new DashboardService(profiles, progress, coach, props);
    }

    private static UserProfile jane() {
        UserProfile p = new UserProfile();
        p.setUserId(2L);
        p.setAge(32);
        p.setGender("female");
        p.setHeightCm(165.0);
        p.setWeightKg(60.0);
        p.setActivityLevel("lightly_active");
        p.setFitnessGoals(new LinkedHashSet<>(List.of("endurance", "strength")));
        p.setDietaryRestrictions(new LinkedHashSet<>(List.of("vegetarian")));
        return p;
    }

    @Test
    void build_shouldFeedLatestProgressAndProfileRestrictions() {
        when(profiles.require(2L)).thenReturn(jane());
        when(progress.list(2L, 5)).thenReturn(List.of(
                new ProgressDto(9L, LocalDate.of(2026, 4, 2), false, 2500.0, 1891.0, null, null),
                new ProgressDto(8L, LocalDate.of(2026, 4, 1), true, 1800.0, 1891.0, null, null)));

        DashboardResponse r = svc().build(2L);

        assertThat(r.profile().userId()).isEqualTo(2L);
        assertThat(r.recentProgress()).hasSize(2);
        assertThat(r.plan().nutritionTargets().dailyCalories()).isEqualTo(1891);
        assertThat(r.plan().recommendations().workout()).extracting("type")
                .containsExactly(RecommendationType.MOTIVATION);
        assertThat(r.plan().recommendations().nutrition()).extracting("type")
                .containsExactly(RecommendationType.CALORIE_CONTROL, RecommendationType.PROTEIN);
        // vegetarian is not a meal filter: full catalog
        assertThat(r.plan().mealPlan().get("breakfast")).hasSize(2);
    }

    @Test
    void build_missingProfile_shouldPropagateNotFound() {
        when(profiles.require(404L)).thenThrow(new IllegalStateException("PROFILE_NOT_FOUND"));

        assertThatThrownBy(() -> svc().build(404L))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("PROFILE_NOT_FOUND");
        verifyNoInteractions(progress);
    }
}
