package com.healthcoach.backend.coach.recommendation;

import com.healthcoach.backend.coach.model.ActivityLevel;
import com.healthcoach.backend.coach.model.Gender;
import com.healthcoach.backend.coach.model.Preferences;
import com.healthcoach.backend.coach.model.Profile;
import com.healthcoach.backend.coach.model.ProgressEntry;
import com.healthcoach.backend.coach.model.Recommendation;
import com.healthcoach.backend.coach.model.RecommendationType;
import com.healthcoach.backend.coach.model.Recommendations;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class RecommendationEngineTest {

    private final RecommendationEngine engine = new RecommendationEngine();

    private static Profile profile(Set<String> goals, Set<String> restrictions) {
        return new Profile(28, 75.0, 175.0, Gender.MALE, ActivityLevel.MODERATELY_ACTIVE, goals,
                new Preferences(Set.of(), 45, 4, restrictions));
    }

    private static List<RecommendationType> types(List<Recommendation> recs) {
        return recs.stream().map(Recommendation::type).toList();
    }

    @Test
    void missed_workout_without_goals_yields_motivation_only() {
        Recommendations r = engine.generate(profile(Set.of(), Set.of()),
                List.of(new ProgressEntry(false, null, null)));

        assertThat(types(r.workout())).containsExactly(RecommendationType.MOTIVATION);
        assertThat(r.workout().get(0).action()).isEqualTo("Start with a 20-minute beginner workout");
    }

    @Test
    void workout_rules_are_cumulative_in_rule_order() {
        Recommendations r = engine.generate(profile(Set.of("muscle_gain", "weight_loss"), Set.of()),
                List.of(new ProgressEntry(false, 1800.0, 2000.0)));

        assertThat(types(r.workout())).containsExactly(
                RecommendationType.MOTIVATION, RecommendationType.CARDIO, RecommendationType.STRENGTH);
    }

    @Test
    void completed_or_unknown_workout_is_not_a_miss() {
        Profile p = profile(Set.of(), Set.of());
        assertThat(engine.generate(p, List.of(new ProgressEntry(true, null, null))).workout()).isEmpty();
        assertThat(engine.generate(p, List.of(new ProgressEntry(null, null, null))).workout()).isEmpty();
    }

    @Test
    void only_the_most_recent_entry_is_read() {
        Recommendations r = engine.generate(profile(Set.of(), Set.of()), List.of(
                new ProgressEntry(true, 1900.0, 2000.0),
                new ProgressEntry(false, 5000.0, 2000.0)));

        assertThat(r.workout()).isEmpty();
        assertThat(r.nutrition()).isEmpty();
    }

    @Test
    void calorie_overshoot_above_120_percent_fires_calorie_control() {
        Recommendations r = engine.generate(profile(Set.of(), Set.of()),
                List.of(new ProgressEntry(true, 2600.0, 2000.0)));

        assertThat(types(r.nutrition())).containsExactly(RecommendationType.CALORIE_CONTROL);
    }

    @Test
    void exactly_120_percent_is_not_an_overshoot() {
        Recommendations r = engine.generate(profile(Set.of(), Set.of()),
                List.of(new ProgressEntry(true, 2400.0, 2000.0)));

        assertThat(r.nutrition()).isEmpty();
    }

    @Test
    void missing_calorie_values_never_fire() {
        Profile p = profile(Set.of(), Set.of());
        assertThat(engine.generate(p, List.of(new ProgressEntry(true, 5000.0, null))).nutrition()).isEmpty();
        assertThat(engine.generate(p, List.of(new ProgressEntry(true, null, 2000.0))).nutrition()).isEmpty();
    }

    @Test
    void vegetarian_gets_plant_protein_after_calorie_control() {
        Recommendations r = engine.generate(profile(Set.of(), Set.of("vegetarian")),
                List.of(new ProgressEntry(true, 3000.0, 2000.0)));

        assertThat(types(r.nutrition()))
                .containsExactly(RecommendationType.CALORIE_CONTROL, RecommendationType.PROTEIN);
    }

    @Test
    void lifestyle_is_always_sleep_then_hydration() {
        Recommendations empty = engine.generate(profile(Set.of(), Set.of()), List.of());
        Recommendations busy = engine.generate(profile(Set.of("weight_loss"), Set.of("vegan")),
                List.of(new ProgressEntry(false, 9000.0, 2000.0)));

        for (Recommendations r : List.of(empty, busy)) {
            assertThat(types(r.lifestyle()))
                    .containsExactly(RecommendationType.SLEEP, RecommendationType.HYDRATION);
        }
        assertThat(empty.lifestyle().get(0).action()).isEqualTo("Aim for 7-9 hours of sleep tonight");
        assertThat(empty.lifestyle().get(1).action()).isEqualTo("Drink at least 8 glasses of water today");
    }

    @Test
    void empty_profile_and_no_progress_yield_only_lifestyle() {
        Profile bare = new Profile(null, null, null, null, null, null, null);

        Recommendations r = engine.generate(bare, null);

        assertThat(r.workout()).isEmpty();
        assertThat(r.nutrition()).isEmpty();
        assertThat(r.lifestyle()).hasSize(2);
    }
}
