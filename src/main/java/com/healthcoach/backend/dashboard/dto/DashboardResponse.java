package com.healthcoach.backend.dashboard.dto;

import com.healthcoach.backend.coach.dto.PersonalizedPlanResponse;
import com.healthcoach.backend.users.profile.dto.UserProfileDto;
import com.healthcoach.backend.users.progress.dto.ProgressDto;

import java.util.List;

public record DashboardResponse(
        UserProfileDto profile,
        List<ProgressDto> recentProgress,   // most recent first
        PersonalizedPlanResponse plan
) {}
