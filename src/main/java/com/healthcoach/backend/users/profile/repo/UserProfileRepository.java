package com.healthcoach.backend.users.profile.repo;

import com.healthcoach.backend.users.profile.entity.UserProfile;
import org.springframework.data.jpa.repository.JpaRepository;

public interface UserProfileRepository extends JpaRepository<UserProfile, Long> {
}
