package com.healthcoach.backend.coach.meal;

import com.healthcoach.backend.coach.model.MealDefinition;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only meal reference table, grouped by slot. Built once at class init and
 * never mutated; list order is the plan order.
 */
public final class MealCatalog {

    private static final Map<MealSlot, List<MealDefinition>> MEALS;

    static {
        EnumMap<MealSlot, List<MealDefinition>> m = new EnumMap<>(MealSlot.class);

        m.put(MealSlot.BREAKFAST, List.of(
                new MealDefinition("Overnight Oats with Berries", 350, 15, 55, 8,
                        List.of("oats", "milk", "berries", "honey"), 5, false, true),
                new MealDefinition("Avocado Toast", 320, 12, 35, 18,
                        List.of("whole grain bread", "avocado", "eggs", "tomato"), 10, false, false)
        ));
        m.put(MealSlot.LUNCH, List.of(
                new MealDefinition("Grilled Chicken Salad", 450, 35, 25, 22,
                        List.of("chicken breast", "mixed greens", "olive oil", "vegetables"), 15, false, true),
                new MealDefinition("Quinoa Buddha Bowl", 420, 18, 52, 16,
                        List.of("quinoa", "chickpeas", "vegetables", "tahini"), 20, true, true)
        ));
        m.put(MealSlot.DINNER, List.of(
                new MealDefinition("Baked Salmon with Vegetables", 480, 40, 20, 25,
                        List.of("salmon", "broccoli", "sweet potato", "olive oil"), 25, false, true)
        ));

        MEALS = Collections.unmodifiableMap(m);
    }

    private MealCatalog() {}

    /** slot -> meals, iteration in slot declaration order */
    public static Map<MealSlot, List<MealDefinition>> all() {
        return MEALS;
    }

    public static List<MealDefinition> forSlot(MealSlot slot) {
        return MEALS.getOrDefault(slot, List.of());
    }
}
