package com.healthcoach.backend.users.progress.repo;

import com.healthcoach.backend.users.progress.entity.ProgressRecord;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface ProgressRecordRepository extends JpaRepository<ProgressRecord, Long> {

    Optional<ProgressRecord> findByUserIdAndEntryDate(Long userId, LocalDate entryDate);

    /** most recent first */
    List<ProgressRecord> findByUserIdOrderByEntryDateDesc(Long userId, Pageable page);
}
