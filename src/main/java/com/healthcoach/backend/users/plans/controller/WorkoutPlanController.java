package com.healthcoach.backend.users.plans.controller;

import com.healthcoach.backend.coach.model.WorkoutPlan;
import com.healthcoach.backend.users.plans.dto.ActivePlanDto;
import com.healthcoach.backend.users.plans.service.PlanService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping(value = "/api/v1/users/{userId}/workout-plans", produces = MediaType.APPLICATION_JSON_VALUE)
public class WorkoutPlanController {

    private final PlanService svc;

    public WorkoutPlanController(PlanService svc) {
        this.svc = svc;
    }

    @PostMapping("/generate")
    public ResponseEntity<ActivePlanDto<WorkoutPlan>> generate(@PathVariable Long userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(svc.generateWorkout(userId));
    }

    @GetMapping("/active")
    public ActivePlanDto<WorkoutPlan> active(@PathVariable Long userId) {
        return svc.activeWorkout(userId);
    }
}
