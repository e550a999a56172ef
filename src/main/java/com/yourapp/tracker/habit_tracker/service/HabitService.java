package com.yourapp.tracker.habit_tracker.service;

import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import com.yourapp.tracker.habit_tracker.repository.HabitRecordRepository;
import com.yourapp.tracker.habit_tracker.repository.HabitRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Habit half of the store. Every public method runs in its own transaction and hands out
 * detached copies of the entities it loads.
 */
@Service
@Transactional(readOnly = true)
public class HabitService {
    private static final Logger logger = LoggerFactory.getLogger(HabitService.class);

    static final int MAX_NAME_LENGTH = 255;

    private final HabitRepository habitRepo;
    private final HabitRecordRepository recordRepo;

    @Autowired
    public HabitService(HabitRepository habitRepo, HabitRecordRepository recordRepo) {
        this.habitRepo = habitRepo;
        this.recordRepo = recordRepo;
    }

    @Transactional
    public StoreResult<Habit> createHabit(String name) {
        StoreResult<String> validName = validateName(name);
        if (!validName.isOk()) {
            return StoreResult.invalidInput(validName.getMessage());
        }
        String trimmed = validName.getValue();

        Optional<Habit> existing = habitRepo.findByName(trimmed);
        if (existing.isPresent()) {
            return StoreResult.alreadyExists("Habit already exists", existing.get().copy());
        }

        Habit saved = habitRepo.save(new Habit(trimmed));
        logger.info("Created habit {} '{}'", saved.getId(), saved.getName());
        return StoreResult.ok(saved.copy());
    }

    public StoreResult<Habit> findHabitByName(String name) {
        if (name == null || name.isBlank()) {
            return StoreResult.notFound("Habit not found");
        }
        return habitRepo.findByName(name.trim())
                .map(habit -> StoreResult.ok(habit.copy()))
                .orElseGet(() -> StoreResult.notFound("Habit not found"));
    }

    public StoreResult<Habit> findHabitById(Long id) {
        if (id == null) {
            return StoreResult.notFound("Habit not found");
        }
        return habitRepo.findById(id)
                .map(habit -> StoreResult.ok(habit.copy()))
                .orElseGet(() -> StoreResult.notFound("Habit not found with id: " + id));
    }

    public List<Habit> listHabits() {
        return habitRepo.findAllByOrderByNameAsc().stream()
                .map(Habit::copy)
                .collect(Collectors.toList());
    }

    @Transactional
    public StoreResult<Habit> renameHabit(Long id, String newName) {
        StoreResult<String> validName = validateName(newName);
        if (!validName.isOk()) {
            return StoreResult.invalidInput(validName.getMessage());
        }
        String trimmed = validName.getValue();

        Optional<Habit> found = id == null ? Optional.empty() : habitRepo.findById(id);
        if (found.isEmpty()) {
            return StoreResult.notFound("Habit not found with id: " + id);
        }
        Habit habit = found.get();

        if (habitRepo.existsByNameAndIdNot(trimmed, id)) {
            Habit other = habitRepo.findByName(trimmed).map(Habit::copy).orElse(null);
            return StoreResult.alreadyExists("Habit already exists", other);
        }

        String oldName = habit.getName();
        habit.setName(trimmed);
        Habit saved = habitRepo.save(habit);
        logger.info("Renamed habit {} from '{}' to '{}'", id, oldName, trimmed);
        return StoreResult.ok(saved.copy());
    }

    /**
     * Deletes the habit together with all of its records in one transaction.
     */
    @Transactional
    public StoreResult<Habit> deleteHabit(Long id) {
        Optional<Habit> found = id == null ? Optional.empty() : habitRepo.findById(id);
        if (found.isEmpty()) {
            return StoreResult.notFound("Habit not found with id: " + id);
        }
        Habit habit = found.get();

        // First delete all records for this habit
        int removed = recordRepo.deleteByHabitId(id);

        // Then delete the habit
        habitRepo.delete(habit);
        logger.info("Deleted habit {} '{}' and {} record(s)", id, habit.getName(), removed);
        return StoreResult.ok(habit.copy());
    }

    public StoreResult<Integer> longestStreak(Long habitId) {
        if (habitId == null || !habitRepo.existsById(habitId)) {
            return StoreResult.notFound("Habit not found with id: " + habitId);
        }
        List<LocalDate> dates = recordRepo.findByHabitIdOrderByDateDesc(habitId).stream()
                .map(HabitRecord::getDate)
                .collect(Collectors.toList());
        return StoreResult.ok(StreakCalculator.longestStreakOfDates(dates));
    }

    private static StoreResult<String> validateName(String name) {
        if (name == null || name.isBlank()) {
            return StoreResult.invalidInput("Habit cannot be empty");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            return StoreResult.invalidInput("Habit name is longer than " + MAX_NAME_LENGTH + " characters");
        }
        return StoreResult.ok(trimmed);
    }
}
