package com.healthcoach.backend.coach.meal;

import com.healthcoach.backend.coach.model.MealDefinition;
import com.healthcoach.backend.coach.model.MealPreferences;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class MealPlanFilterTest {

    private final MealPlanFilter filter = new MealPlanFilter();

    private static List<String> names(List<MealDefinition> meals) {
        return meals.stream().map(MealDefinition::name).toList();
    }

    @Test
    void no_restrictions_returns_full_catalog_in_order() {
        Map<String, List<MealDefinition>> plan = filter.buildPlan(null, null);

        assertThat(plan.keySet()).containsExactly("breakfast", "lunch", "dinner");
        assertThat(names(plan.get("breakfast"))).containsExactly("Overnight Oats with Berries", "Avocado Toast");
        assertThat(names(plan.get("lunch"))).containsExactly("Grilled Chicken Salad", "Quinoa Buddha Bowl");
        assertThat(names(plan.get("dinner"))).containsExactly("Baked Salmon with Vegetables");
    }

    @Test
    void empty_preferences_behave_like_none() {
        assertThat(filter.buildPlan(null, new MealPreferences(null, null)))
                .isEqualTo(filter.buildPlan(null, null));
    }

    @Test
    void vegan_keeps_only_vegan_meals_and_may_empty_slots() {
        Map<String, List<MealDefinition>> plan =
                filter.buildPlan(null, new MealPreferences(Set.of("vegan"), List.of()));

        assertThat(plan.get("breakfast")).isEmpty();
        assertThat(names(plan.get("lunch"))).containsExactly("Quinoa Buddha Bowl");
        assertThat(plan.get("dinner")).isEmpty();
        assertThat(plan.values()).allSatisfy(meals -> assertThat(meals).allMatch(MealDefinition::vegan));
    }

    @Test
    void gluten_free_drops_avocado_toast_only() {
        Map<String, List<MealDefinition>> plan =
                filter.buildPlan(null, new MealPreferences(Set.of("gluten_free"), List.of()));

        assertThat(names(plan.get("breakfast"))).containsExactly("Overnight Oats with Berries");
        assertThat(plan.get("lunch")).hasSize(2);
        assertThat(plan.get("dinner")).hasSize(1);
    }

    @Test
    void cuisine_preferences_do_not_filter() {
        Map<String, List<MealDefinition>> plan =
                filter.buildPlan(null, new MealPreferences(Set.of(), List.of("italian", "thai")));

        assertThat(plan).isEqualTo(filter.buildPlan(null, null));
    }

    @Test
    void unknown_restrictions_are_ignored() {
        Map<String, List<MealDefinition>> plan =
                filter.buildPlan(null, new MealPreferences(Set.of("vegetarian", "keto"), List.of()));

        assertThat(plan).isEqualTo(filter.buildPlan(null, null));
    }

    @Test
    void custom_catalog_single_non_gluten_free_meal_is_excluded() {
        MealDefinition gf1 = meal("Rice Bowl", true);
        MealDefinition wheat = meal("Pasta", false);
        MealDefinition gf2 = meal("Omelette", true);

        Map<MealSlot, List<MealDefinition>> catalog = new LinkedHashMap<>();
        catalog.put(MealSlot.LUNCH, List.of(gf1, wheat, gf2));
        MealPlanFilter custom = new MealPlanFilter(catalog);

        Map<String, List<MealDefinition>> plan =
                custom.buildPlan(null, new MealPreferences(Set.of("gluten_free"), List.of()));

        assertThat(plan.get("lunch")).containsExactly(gf1, gf2);
    }

    @Test
    void custom_catalog_is_copied_so_later_caller_changes_are_not_seen() {
        MealDefinition rice = meal("Rice Bowl", true);
        List<MealDefinition> lunch = new ArrayList<>(List.of(rice));
        Map<MealSlot, List<MealDefinition>> catalog = new LinkedHashMap<>();
        catalog.put(MealSlot.LUNCH, lunch);
        MealPlanFilter custom = new MealPlanFilter(catalog);

        lunch.add(meal("Pasta", false));
        catalog.put(MealSlot.DINNER, List.of(meal("Stew", true)));

        Map<String, List<MealDefinition>> plan = custom.buildPlan(null, null);
        assertThat(plan.keySet()).containsExactly("lunch");
        assertThat(plan.get("lunch")).containsExactly(rice);
    }

    @Test
    void catalog_is_read_only() {
        assertThatThrownBy(() -> MealCatalog.all().put(MealSlot.DINNER, List.of()))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> MealCatalog.forSlot(MealSlot.LUNCH).clear())
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> MealCatalog.forSlot(MealSlot.DINNER).get(0).ingredients().add("salt"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    private static MealDefinition meal(String name, boolean glutenFree) {
        return new MealDefinition(name, 400, 20, 40, 15, List.of("x"), 10, false, glutenFree);
    }
}
