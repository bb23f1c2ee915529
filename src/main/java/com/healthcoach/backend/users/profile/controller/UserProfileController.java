package com.healthcoach.backend.users.profile.controller;

import com.healthcoach.backend.users.profile.dto.UpsertProfileRequest;
import com.healthcoach.backend.users.profile.dto.UserProfileDto;
import com.healthcoach.backend.users.profile.service.UserProfileService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** userId comes from the gateway that owns authentication */
@RestController
@RequestMapping("/api/v1/users/{userId}/profile")
public class UserProfileController {

    private final UserProfileService svc;

    public UserProfileController(UserProfileService svc) {
        this.svc = svc;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UserProfileDto> get(@PathVariable Long userId) {
        return ResponseEntity.ok(svc.get(userId));
    }

    @PutMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<UserProfileDto> upsert(@PathVariable Long userId,
                                                 @Valid @RequestBody UpsertProfileRequest req) {
        return ResponseEntity.ok(svc.upsert(userId, req));
    }
}
