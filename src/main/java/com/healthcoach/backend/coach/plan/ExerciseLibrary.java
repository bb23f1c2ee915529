package com.healthcoach.backend.coach.plan;

import com.healthcoach.backend.coach.model.Exercise;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bodyweight exercise pool per session focus. Order is the rotation order used by
 * {@link WorkoutPlanGenerator}.
 */
public final class ExerciseLibrary {

    public static final String STRENGTH = "strength";
    public static final String CARDIO = "cardio";
    public static final String FLEXIBILITY = "flexibility";

    private static final Map<String, List<Exercise>> BY_FOCUS;

    static {
        Map<String, List<Exercise>> m = new LinkedHashMap<>();
        m.put(STRENGTH, List.of(
                new Exercise("Push-ups", STRENGTH, 3, "10-15", List.of("chest", "shoulders", "triceps")),
                new Exercise("Bodyweight Squats", STRENGTH, 3, "12-15", List.of("quadriceps", "glutes", "hamstrings")),
                new Exercise("Dumbbell Rows", STRENGTH, 3, "10-12", List.of("back", "biceps")),
                new Exercise("Walking Lunges", STRENGTH, 3, "10 per leg", List.of("quadriceps", "glutes")),
                new Exercise("Plank", STRENGTH, 3, "30-60 sec", List.of("core"))
        ));
        m.put(CARDIO, List.of(
                new Exercise("Jumping Jacks", CARDIO, 3, "45 sec", List.of("full body")),
                new Exercise("High Knees", CARDIO, 3, "30 sec", List.of("legs", "core")),
                new Exercise("Mountain Climbers", CARDIO, 3, "30 sec", List.of("core", "shoulders")),
                new Exercise("Burpees", CARDIO, 3, "8-12", List.of("full body")),
                new Exercise("Brisk Walk or Jog", CARDIO, 1, "20 min", List.of("legs"))
        ));
        m.put(FLEXIBILITY, List.of(
                new Exercise("Sun Salutation", FLEXIBILITY, 1, "5 rounds", List.of("full body")),
                new Exercise("Hamstring Stretch", FLEXIBILITY, 2, "30 sec per leg", List.of("hamstrings")),
                new Exercise("Hip Flexor Stretch", FLEXIBILITY, 2, "30 sec per side", List.of("hip flexors")),
                new Exercise("Cat-Cow", FLEXIBILITY, 2, "10", List.of("spine", "core")),
                new Exercise("Child's Pose", FLEXIBILITY, 1, "60 sec", List.of("back", "hips"))
        ));
        BY_FOCUS = Collections.unmodifiableMap(m);
    }

    private ExerciseLibrary() {}

    public static boolean isKnownFocus(String focus) {
        return BY_FOCUS.containsKey(focus);
    }

    /** focus keys in declaration order: strength, cardio, flexibility */
    public static List<String> focuses() {
        return List.copyOf(BY_FOCUS.keySet());
    }

    public static List<Exercise> forFocus(String focus) {
        return BY_FOCUS.getOrDefault(focus, List.of());
    }
}
