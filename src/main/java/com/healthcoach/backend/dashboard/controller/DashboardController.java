package com.healthcoach.backend.dashboard.controller;

import com.healthcoach.backend.dashboard.dto.DashboardResponse;
import com.healthcoach.backend.dashboard.service.DashboardService;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users/{userId}/dashboard")
public class DashboardController {

    private final DashboardService svc;

    public DashboardController(DashboardService svc) {
        this.svc = svc;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public DashboardResponse get(@PathVariable Long userId) {
        return svc.build(userId);
    }
}
