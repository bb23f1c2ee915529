package com.healthcoach.backend.users.progress.controller;

import com.healthcoach.backend.users.progress.dto.ProgressDto;
import com.healthcoach.backend.users.progress.dto.RecordProgressRequest;
import com.healthcoach.backend.users.progress.service.ProgressService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/users/{userId}/progress")
public class ProgressController {

    private final ProgressService svc;

    public ProgressController(ProgressService svc) {
        this.svc = svc;
    }

    @PostMapping
    public ResponseEntity<ProgressDto> record(@PathVariable Long userId,
                                              @Valid @RequestBody RecordProgressRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(svc.record(userId, req));
    }

    @GetMapping
    public List<ProgressDto> list(@PathVariable Long userId,
                                  @RequestParam(value = "limit", required = false) Integer limit) {
        return svc.list(userId, limit);
    }
}
