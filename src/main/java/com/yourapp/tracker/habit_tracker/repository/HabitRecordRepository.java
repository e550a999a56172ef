package com.yourapp.tracker.habit_tracker.repository;

import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface HabitRecordRepository extends JpaRepository<HabitRecord, Long> {
    // Newest first
    List<HabitRecord> findByHabitIdOrderByDateDesc(Long habitId);

    Optional<HabitRecord> findByHabitIdAndDate(Long habitId, LocalDate date);

    long countByHabitId(Long habitId);

    @Modifying
    @Query("DELETE FROM HabitRecord r WHERE r.habitId = :habitId")
    int deleteByHabitId(@Param("habitId") Long habitId);
}
