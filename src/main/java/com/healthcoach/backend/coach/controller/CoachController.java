package com.healthcoach.backend.coach.controller;

import com.healthcoach.backend.coach.dto.CoachRequest;
import com.healthcoach.backend.coach.dto.PersonalizedPlanResponse;
import com.healthcoach.backend.coach.model.MealDefinition;
import com.healthcoach.backend.coach.model.NutritionTargets;
import com.healthcoach.backend.coach.model.Recommendations;
import com.healthcoach.backend.coach.service.CoachService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** Stateless coaching endpoints: the caller sends the profile and history inline. */
@RestController
@RequestMapping(value = "/api/v1/coach", produces = MediaType.APPLICATION_JSON_VALUE)
public class CoachController {

    private final CoachService svc;

    public CoachController(CoachService svc) {
        this.svc = svc;
    }

    @PostMapping("/nutrition-targets")
    public NutritionTargets nutritionTargets(@Valid @RequestBody CoachRequest req) {
        return svc.nutritionTargets(req.profile());
    }

    @PostMapping("/recommendations")
    public Recommendations recommendations(@Valid @RequestBody CoachRequest req) {
        return svc.recommendations(req.profile(), req.recentProgress());
    }

    @PostMapping("/meal-plan")
    public Map<String, List<MealDefinition>> mealPlan(@Valid @RequestBody CoachRequest req) {
        return svc.mealPlan(req.profile(), req.preferences());
    }

    @PostMapping("/personalize")
    public PersonalizedPlanResponse personalize(@Valid @RequestBody CoachRequest req) {
        return svc.personalize(req.profile(), req.recentProgress(), req.preferences());
    }
}
