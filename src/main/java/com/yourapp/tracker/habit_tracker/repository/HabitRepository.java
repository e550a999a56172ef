package com.yourapp.tracker.habit_tracker.repository;

import com.yourapp.tracker.habit_tracker.model.Habit;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface HabitRepository extends JpaRepository<Habit, Long> {
    Optional<Habit> findByName(String name);

    // Name taken by some other habit (used when renaming)
    boolean existsByNameAndIdNot(String name, Long id);

    List<Habit> findAllByOrderByNameAsc();
}
