package com.healthcoach.backend.users.plans.repo;

import com.healthcoach.backend.users.plans.entity.GeneratedPlan;
import com.healthcoach.backend.users.plans.entity.PlanKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface GeneratedPlanRepository extends JpaRepository<GeneratedPlan, Long> {

    /** newest active row wins if a race ever left two */
    Optional<GeneratedPlan> findFirstByUserIdAndKindAndActiveTrueOrderByIdDesc(Long userId, PlanKind kind);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           update GeneratedPlan p
              set p.active = false
            where p.userId = :userId
              and p.kind = :kind
              and p.active = true
           """)
    int retireActive(@Param("userId") Long userId, @Param("kind") PlanKind kind);
}
