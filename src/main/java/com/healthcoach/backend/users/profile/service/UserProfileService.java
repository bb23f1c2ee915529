package com.healthcoach.backend.users.profile.service;

import com.healthcoach.backend.coach.model.ActivityLevel;
import com.healthcoach.backend.coach.model.Gender;
import com.healthcoach.backend.coach.model.Preferences;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.common.web.ApiExceptionHandler;
import com.healthcoach.backend.users.profile.dto.UpsertProfileRequest;
import com.healthcoach.backend.users.profile.dto.UserProfileDto;
import com.healthcoach.backend.users.profile.entity.UserProfile;
import com.healthcoach.backend.users.profile.repo.UserProfileRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
public class UserProfileService {

    private final UserProfileRepository repo;

    public UserProfileService(UserProfileRepository repo) {
        this.repo = repo;
    }

    @Transactional
    public UserProfileDto upsert(Long userId, UpsertProfileRequest req) {
        UserProfile p = repo.findById(userId).orElseGet(() -> {
            UserProfile np = new UserProfile();
            np.setUserId(userId);
            return np;
        });

        if (req.age() != null) p.setAge(req.age());
        if (req.weight() != null) p.setWeightKg(req.weight());
        if (req.height() != null) p.setHeightCm(req.height());
        if (req.gender() != null) p.setGender(req.gender());
        if (req.activityLevel() != null) p.setActivityLevel(req.activityLevel());
        if (req.fitnessGoals() != null) p.setFitnessGoals(tags(req.fitnessGoals()));

        var prefs = req.preferences();
        if (prefs != null) {
            if (prefs.workoutTypes() != null) p.setWorkoutTypes(tags(prefs.workoutTypes()));
            if (prefs.duration() != null) p.setSessionMinutes(prefs.duration());
            if (prefs.daysPerWeek() != null) p.setDaysPerWeek(prefs.daysPerWeek());
            if (prefs.dietaryRestrictions() != null) p.setDietaryRestrictions(tags(prefs.dietaryRestrictions()));
        }

        UserProfile saved = repo.save(p);
        log.info("[Profile] upsert userId={} goals={} restrictions={}",
                userId, saved.getFitnessGoals(), saved.getDietaryRestrictions());
        return toDto(saved);
    }

    @Transactional(readOnly = true)
    public UserProfileDto get(Long userId) {
        return toDto(require(userId));
    }

    @Transactional(readOnly = true)
    public Optional<Profile> findCoachProfile(Long userId) {
        return repo.findById(userId).map(UserProfileService::toCoachProfile);
    }

    /** @throws IllegalStateException PROFILE_NOT_FOUND */
    @Transactional(readOnly = true)
    public UserProfile require(Long userId) {
        return repo.findById(userId)
                .orElseThrow(() -> new IllegalStateException(ApiExceptionHandler.PROFILE_NOT_FOUND));
    }

    public static Profile toCoachProfile(UserProfile p) {
        return new Profile(
                p.getAge(),
                p.getWeightKg(),
                p.getHeightCm(),
                Gender.fromKey(p.getGender()),
                ActivityLevel.fromKey(p.getActivityLevel()),
                Set.copyOf(nz(p.getFitnessGoals())),
                preferencesOf(p)
        );
    }

    public static UserProfileDto toDto(UserProfile p) {
        return new UserProfileDto(
                p.getUserId(),
                p.getAge(),
                p.getWeightKg(),
                p.getHeightCm(),
                p.getGender(),
                p.getActivityLevel(),
                nz(p.getFitnessGoals()),
                preferencesOf(p),
                p.getUpdatedAt()
        );
    }

    private static Preferences preferencesOf(UserProfile p) {
        return new Preferences(
                nz(p.getWorkoutTypes()),
                p.getSessionMinutes(),
                p.getDaysPerWeek(),
                nz(p.getDietaryRestrictions())
        );
    }

    /** trimmed, lower-cased, de-duplicated, first occurrence order */
    public static Set<String> tags(Collection<String> raw) {
        Set<String> out = new LinkedHashSet<>();
        for (String s : raw) {
            if (s == null) continue;
            String t = s.trim().toLowerCase(Locale.ROOT);
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    private static Set<String> nz(Set<String> v) {
        return (v == null) ? Set.of() : v;
    }
}
