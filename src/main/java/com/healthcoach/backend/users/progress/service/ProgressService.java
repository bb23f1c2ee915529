package com.healthcoach.backend.users.progress.service;

import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.nutrition.NutritionCalculator;
import com.healthcoach.backend.config.CoachProperties;
import com.healthcoach.backend.users.profile.service.UserProfileService;
import com.healthcoach.backend.users.progress.dto.ProgressDto;
import com.healthcoach.backend.users.progress.dto.RecordProgressRequest;
import com.healthcoach.backend.users.progress.entity.ProgressRecord;
import com.healthcoach.backend.users.progress.repo.ProgressRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
public class ProgressService {

    private final ProgressRecordRepository repo;
    private final UserProfileService profiles;
    private final CoachProperties props;

    public ProgressService(ProgressRecordRepository repo, UserProfileService profiles, CoachProperties props) {
        this.repo = repo;
        this.profiles = profiles;
        this.props = props;
    }

    /**
     * One entry per user and day. A second post for the same day merges into it:
     * only the fields it carries are overwritten.
     *
     * @throws org.springframework.dao.DataIntegrityViolationException when a concurrent
     *         post created the same day first (mapped to 409)
     */
    @Transactional
    public ProgressDto record(Long userId, RecordProgressRequest req) {
        LocalDate day = (req.date() != null) ? req.date() : LocalDate.now();

        ProgressRecord e = repo.findByUserIdAndEntryDate(userId, day).orElseGet(ProgressRecord::new);
        e.setUserId(userId);
        e.setEntryDate(day);
        if (req.workoutCompleted() != null) e.setWorkoutCompleted(req.workoutCompleted());
        if (req.caloriesConsumed() != null) e.setCaloriesConsumed(req.caloriesConsumed());
        if (req.targetCalories() != null) e.setTargetCalories(req.targetCalories());
        else if (e.getTargetCalories() == null) e.setTargetCalories(derivedTarget(userId));
        if (req.weight() != null) e.setWeightKg(req.weight());
        if (req.notes() != null) e.setNotes(req.notes());

        // flush here so a unique-key race fails inside this call, not at commit
        ProgressRecord saved = repo.saveAndFlush(e);
        log.info("[Progress] userId={} date={} workoutCompleted={} kcal={}/{}",
                userId, day, saved.getWorkoutCompleted(), saved.getCaloriesConsumed(), saved.getTargetCalories());
        return toDto(saved);
    }

    /** most recent first; limit clamped to [1, maxPageSize] */
    @Transactional(readOnly = true)
    public List<ProgressDto> list(Long userId, Integer limit) {
        int size = (limit == null) ? props.getDefaultPageSize() : limit;
        size = Math.max(1, Math.min(props.getMaxPageSize(), size));
        return load(userId, size).stream().map(ProgressService::toDto).toList();
    }

    private List<ProgressRecord> load(Long userId, int size) {
        return repo.findByUserIdOrderByEntryDateDesc(userId, PageRequest.of(0, size));
    }

    /** today's calorie target from the stored profile; null when the profile is missing or incomplete */
    private Double derivedTarget(Long userId) {
        return profiles.findCoachProfile(userId)
                .filter(Profile::hasBiometrics)
                .map(p -> (double) NutritionCalculator.computeTargets(p).dailyCalories())
                .orElse(null);
    }

    /** engine view of a logged day */
    public static ProgressEntry toEntry(ProgressDto d) {
        return new ProgressEntry(d.workoutCompleted(), d.caloriesConsumed(), d.targetCalories());
    }

    public static ProgressDto toDto(ProgressRecord r) {
        return new ProgressDto(
                r.getId(),
                r.getEntryDate(),
                r.getWorkoutCompleted(),
                r.getCaloriesConsumed(),
                r.getTargetCalories(),
                r.getWeightKg(),
                r.getNotes()
        );
    }
}
