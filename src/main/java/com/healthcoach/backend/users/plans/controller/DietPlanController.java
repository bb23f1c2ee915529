package com.healthcoach.backend.users.plans.controller;

import com.healthcoach.backend.coach.model.DietPlan;
import com.healthcoach.backend.users.plans.dto.ActivePlanDto;
import com.healthcoach.backend.users.plans.dto.GenerateDietPlanRequest;
import com.healthcoach.backend.users.plans.service.PlanService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = "/api/v1/users/{userId}/diet-plans", produces = MediaType.APPLICATION_JSON_VALUE)
public class DietPlanController {

    private final PlanService svc;

    public DietPlanController(PlanService svc) {
        this.svc = svc;
    }

    /** body is optional */
    @PostMapping("/generate")
    public ResponseEntity<ActivePlanDto<DietPlan>> generate(@PathVariable Long userId,
                                                            @Valid @RequestBody(required = false)
                                                            GenerateDietPlanRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(svc.generateDiet(userId, req));
    }

    @GetMapping("/active")
    public ActivePlanDto<DietPlan> active(@PathVariable Long userId) {
        return svc.activeDiet(userId);
    }
}
