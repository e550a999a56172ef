package com.yourapp.tracker.habit_tracker.service;

import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import com.yourapp.tracker.habit_tracker.repository.HabitRecordRepository;
import com.yourapp.tracker.habit_tracker.repository.HabitRepository;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Record half of the store. A habit has at most one record per date.
 */
@Service
@RequiredArgsConstructor
public class HabitRecordService {
    private static final Logger logger = LoggerFactory.getLogger(HabitRecordService.class);

    private static final String INVALID_DATE = "Invalid date format! Please use the format YYYY-MM-DD";

    private final HabitRecordRepository recordRepo;
    private final HabitRepository habitRepo;

    @Transactional
    public StoreResult<HabitRecord> createRecord(Long habitId, String date) {
        if (date == null || date.isBlank()) {
            return StoreResult.invalidInput("Date cannot be empty");
        }
        Optional<LocalDate> parsed = RecordDates.tryParse(date);
        if (parsed.isEmpty()) {
            return StoreResult.invalidInput(INVALID_DATE);
        }
        if (habitId == null || !habitRepo.existsById(habitId)) {
            return StoreResult.notFound("Habit not found with id: " + habitId);
        }

        Optional<HabitRecord> existing = recordRepo.findByHabitIdAndDate(habitId, parsed.get());
        if (existing.isPresent()) {
            return StoreResult.alreadyExists("Record already exists", existing.get().copy());
        }

        HabitRecord saved = recordRepo.save(new HabitRecord(habitId, parsed.get()));
        logger.info("Created record {} for habit {} on {}", saved.getId(), habitId, saved.getDate());
        return StoreResult.ok(saved.copy());
    }

    @Transactional(readOnly = true)
    public List<HabitRecord> listRecords(Long habitId) {
        return recordRepo.findByHabitIdOrderByDateDesc(habitId).stream()
                .map(HabitRecord::copy)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public long countRecords(Long habitId) {
        return recordRepo.countByHabitId(habitId);
    }

    @Transactional(readOnly = true)
    public StoreResult<HabitRecord> findRecordByDate(Long habitId, String date) {
        Optional<LocalDate> parsed = RecordDates.tryParse(date);
        if (parsed.isEmpty()) {
            return StoreResult.invalidInput(INVALID_DATE);
        }
        return recordRepo.findByHabitIdAndDate(habitId, parsed.get())
                .map(record -> StoreResult.ok(record.copy()))
                .orElseGet(() -> StoreResult.notFound("Record not found"));
    }

    @Transactional(readOnly = true)
    public StoreResult<HabitRecord> findRecordById(Long id) {
        if (id == null) {
            return StoreResult.notFound("Record not found");
        }
        return recordRepo.findById(id)
                .map(record -> StoreResult.ok(record.copy()))
                .orElseGet(() -> StoreResult.notFound("Record not found with id: " + id));
    }

    @Transactional
    public StoreResult<HabitRecord> updateRecord(Long id, String newDate) {
        if (newDate == null || newDate.isBlank()) {
            return StoreResult.invalidInput("Date cannot be empty");
        }
        Optional<LocalDate> parsed = RecordDates.tryParse(newDate);
        if (parsed.isEmpty()) {
            return StoreResult.invalidInput(INVALID_DATE);
        }

        Optional<HabitRecord> found = id == null ? Optional.empty() : recordRepo.findById(id);
        if (found.isEmpty()) {
            return StoreResult.notFound("Record not found with id: " + id);
        }
        HabitRecord record = found.get();
        if (record.getDate().equals(parsed.get())) {
            return StoreResult.ok(record.copy());
        }

        Optional<HabitRecord> clash = recordRepo.findByHabitIdAndDate(record.getHabitId(), parsed.get());
        if (clash.isPresent()) {
            return StoreResult.alreadyExists("Record already exists", clash.get().copy());
        }

        LocalDate oldDate = record.getDate();
        record.setDate(parsed.get());
        HabitRecord saved = recordRepo.save(record);
        logger.info("Moved record {} of habit {} from {} to {}", id, record.getHabitId(), oldDate, saved.getDate());
        return StoreResult.ok(saved.copy());
    }

    @Transactional
    public StoreResult<HabitRecord> deleteRecord(Long id) {
        Optional<HabitRecord> found = id == null ? Optional.empty() : recordRepo.findById(id);
        if (found.isEmpty()) {
            return StoreResult.notFound("Record not found with id: " + id);
        }
        HabitRecord record = found.get();
        recordRepo.delete(record);
        logger.info("Deleted record {} of habit {} on {}", id, record.getHabitId(), record.getDate());
        return StoreResult.ok(record.copy());
    }
}
