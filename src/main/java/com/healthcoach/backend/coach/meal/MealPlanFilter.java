package com.healthcoach.backend.coach.meal;

import com.healthcoach.backend.coach.model.MealDefinition;
import com.healthcoach.backend.coach.model.MealPreferences;
import com.healthcoach.backend.coach.model.Profile;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dietary-tag filter over {@link MealCatalog}. Only vegan and gluten_free prune;
 * cuisinePreferences is a no-op and calorie targets are not consulted.
 */
@Component
public class MealPlanFilter {

    public static final String VEGAN = "vegan";
    public static final String GLUTEN_FREE = "gluten_free";

    private final Map<MealSlot, List<MealDefinition>> catalog;

    public MealPlanFilter() {
        this(MealCatalog.all());
    }

    /** the catalog is copied; later changes to the caller's map or lists are not seen */
    MealPlanFilter(Map<MealSlot, List<MealDefinition>> catalog) {
        Map<MealSlot, List<MealDefinition>> copy = new LinkedHashMap<>();
        catalog.forEach((slot, meals) -> copy.put(slot, List.copyOf(meals)));
        this.catalog = Collections.unmodifiableMap(copy);
    }

    /**
     * @param profile kept in the signature for future calorie-aware selection; unused
     * @param prefs   may be null (no restrictions)
     */
    public Map<String, List<MealDefinition>> buildPlan(Profile profile, MealPreferences prefs) {
        Set<String> restrictions = (prefs == null) ? Set.of() : prefs.restrictions();

        Map<String, List<MealDefinition>> plan = new LinkedHashMap<>();
        catalog.forEach((slot, meals) -> plan.put(
                slot.key(),
                meals.stream().filter(m -> allowed(m, restrictions)).toList()
        ));
        return plan;
    }

    static boolean allowed(MealDefinition meal, Set<String> restrictions) {
        if (restrictions.contains(VEGAN) && !meal.vegan()) return false;
        if (restrictions.contains(GLUTEN_FREE) && !meal.glutenFree()) return false;
        return true;
    }
}
