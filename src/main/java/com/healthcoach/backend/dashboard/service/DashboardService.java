package com.healthcoach.backend.dashboard.service;

import com.healthcoach.backend.coach.dto.PersonalizedPlanResponse;
import com.healthcoach.backend.coach.model.MealPreferences;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.service.CoachService;
import com.healthcoach.backend.config.CoachProperties;
import com.healthcoach.backend.dashboard.dto.DashboardResponse;
import com.healthcoach.backend.users.profile.entity.UserProfile;
import com.healthcoach.backend.users.profile.service.UserProfileService;
import com.healthcoach.backend.users.progress.dto.ProgressDto;
import com.healthcoach.backend.users.progress.service.ProgressService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Stored profile + recent progress -> full coaching bundle. Meal plan uses the
 * profile's own dietary restrictions.
 */
@Slf4j
@Service
public class DashboardService {

    private final UserProfileService profiles;
    private final ProgressService progress;
    private final CoachService coach;
    private final CoachProperties props;

    public DashboardService(UserProfileService profiles, ProgressService progress,
                            CoachService coach, CoachProperties props) {
        this.profiles = profiles;
        this.progress = progress;
        this.coach = coach;
        this.props = props;
    }

    @Transactional(readOnly = true)
    public DashboardResponse build(Long userId) {
        UserProfile stored = profiles.require(userId);
        Profile profile = UserProfileService.toCoachProfile(stored);

        List<ProgressDto> recent = progress.list(userId, props.getRecentProgressLimit());
        List<ProgressEntry> entries = recent.stream()
                .map(ProgressService::toEntry)
                .toList();

        PersonalizedPlanResponse plan = coach.personalize(profile, entries,
                new MealPreferences(profile.dietaryRestrictions(), List.of()));
        log.info("[Dashboard] userId={} progressEntries={} kcal={}",
                userId, entries.size(), plan.nutritionTargets().dailyCalories());

        return new DashboardResponse(UserProfileService.toDto(stored), recent, plan);
    }
}
