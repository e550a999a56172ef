package com.yourapp.tracker.habit_tracker.service;

import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import com.yourapp.tracker.habit_tracker.repository.HabitRecordRepository;
import com.yourapp.tracker.habit_tracker.repository.HabitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class HabitRecordServiceTest {

    @Autowired
    private HabitService habitService;

    @Autowired
    private HabitRecordService recordService;

    @Autowired
    private HabitRepository habitRepo;

    @Autowired
    private HabitRecordRepository recordRepo;

    private Habit running;

    @BeforeEach
    void setUp() {
        recordRepo.deleteAll();
        habitRepo.deleteAll();
        running = habitService.createHabit("Running").getValue();
    }

    @Test
    void createsRecord() {
        StoreResult<HabitRecord> result = recordService.createRecord(running.getId(), " 2025-01-15 ");

        assertThat(result.isOk()).isTrue();
        assertThat(result.getValue().getHabitId()).isEqualTo(running.getId());
        assertThat(result.getValue().getDate()).isEqualTo(LocalDate.of(2025, 1, 15));
    }

    @Test
    void rejectsEmptyOrMalformedDate() {
        assertThat(recordService.createRecord(running.getId(), "").getStatus()).isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(recordService.createRecord(running.getId(), "  ").getStatus()).isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(recordService.createRecord(running.getId(), "15/01/2025").getStatus())
                .isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(recordService.createRecord(running.getId(), "2025-02-30").getStatus())
                .isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(recordService.listRecords(running.getId())).isEmpty();
    }

    @Test
    void rejectsRecordForMissingHabit() {
        StoreResult<HabitRecord> result = recordService.createRecord(running.getId() + 1000, "2025-01-01");

        assertThat(result.getStatus()).isEqualTo(StoreStatus.NOT_FOUND);
        assertThat(recordRepo.count()).isZero();
    }

    @Test
    void schemaRejectsOrphanRecords() {
        assertThatThrownBy(() -> recordRepo.saveAndFlush(new HabitRecord(running.getId() + 1000, LocalDate.now())))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void duplicateDateReportsExistingRecord() {
        HabitRecord first = recordService.createRecord(running.getId(), "2025-01-01").getValue();

        StoreResult<HabitRecord> second = recordService.createRecord(running.getId(), "2025-01-01");

        assertThat(second.getStatus()).isEqualTo(StoreStatus.ALREADY_EXISTS);
        assertThat(second.getExisting()).contains(first);
        assertThat(recordService.listRecords(running.getId())).hasSize(1);
    }

    @Test
    void sameDateIsFineForAnotherHabit() {
        Habit reading = habitService.createHabit("Reading").getValue();
        recordService.createRecord(running.getId(), "2025-01-01");

        assertThat(recordService.createRecord(reading.getId(), "2025-01-01").isOk()).isTrue();
    }

    @Test
    void schemaRejectsDuplicateDate() {
        recordService.createRecord(running.getId(), "2025-01-01");

        assertThatThrownBy(() -> recordRepo.saveAndFlush(new HabitRecord(running.getId(), LocalDate.of(2025, 1, 1))))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void listsNewestFirst() {
        recordService.createRecord(running.getId(), "2025-01-02");
        recordService.createRecord(running.getId(), "2025-03-01");
        recordService.createRecord(running.getId(), "2024-12-31");

        assertThat(recordService.listRecords(running.getId()))
                .extracting(HabitRecord::getDate)
                .containsExactly(LocalDate.of(2025, 3, 1), LocalDate.of(2025, 1, 2), LocalDate.of(2024, 12, 31));
        assertThat(recordService.countRecords(running.getId())).isEqualTo(3);
    }

    @Test
    void findsRecordByDate() {
        HabitRecord record = recordService.createRecord(running.getId(), "2025-01-01").getValue();

        assertThat(recordService.findRecordByDate(running.getId(), "2025-01-01").getValue()).isEqualTo(record);
        assertThat(recordService.findRecordByDate(running.getId(), "2025-01-02").getStatus())
                .isEqualTo(StoreStatus.NOT_FOUND);
        assertThat(recordService.findRecordByDate(running.getId(), "yesterday").getStatus())
                .isEqualTo(StoreStatus.INVALID_INPUT);
    }

    @Test
    void updatesRecordDate() {
        HabitRecord record = recordService.createRecord(running.getId(), "2025-01-01").getValue();

        StoreResult<HabitRecord> updated = recordService.updateRecord(record.getId(), "2025-01-05");

        assertThat(updated.isOk()).isTrue();
        assertThat(updated.getValue().getId()).isEqualTo(record.getId());
        assertThat(recordService.findRecordById(record.getId()).getValue().getDate())
                .isEqualTo(LocalDate.of(2025, 1, 5));
    }

    @Test
    void updateToOwnDateIsAllowed() {
        HabitRecord record = recordService.createRecord(running.getId(), "2025-01-01").getValue();

        assertThat(recordService.updateRecord(record.getId(), "2025-01-01").isOk()).isTrue();
    }

    @Test
    void updateFollowsCreateRules() {
        HabitRecord first = recordService.createRecord(running.getId(), "2025-01-01").getValue();
        HabitRecord second = recordService.createRecord(running.getId(), "2025-01-02").getValue();

        StoreResult<HabitRecord> clash = recordService.updateRecord(second.getId(), "2025-01-01");
        assertThat(clash.getStatus()).isEqualTo(StoreStatus.ALREADY_EXISTS);
        assertThat(clash.getExisting()).contains(first);

        assertThat(recordService.updateRecord(second.getId(), "").getStatus()).isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(recordService.updateRecord(second.getId(), "2025-13-01").getStatus())
                .isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(recordService.updateRecord(second.getId() + 1000, "2025-01-09").getStatus())
                .isEqualTo(StoreStatus.NOT_FOUND);
        assertThat(recordService.findRecordById(second.getId()).getValue().getDate())
                .isEqualTo(LocalDate.of(2025, 1, 2));
    }

    @Test
    void deletesRecord() {
        HabitRecord record = recordService.createRecord(running.getId(), "2025-01-01").getValue();

        assertThat(recordService.deleteRecord(record.getId()).isOk()).isTrue();
        assertThat(recordService.deleteRecord(record.getId()).getStatus()).isEqualTo(StoreStatus.NOT_FOUND);
        assertThat(recordService.listRecords(running.getId())).isEmpty();
    }

    @Test
    void databaseCascadeRemovesRecordsWithTheirHabit() {
        recordService.createRecord(running.getId(), "2025-01-01");

        habitRepo.deleteById(running.getId());

        assertThat(recordRepo.count()).isZero();
    }
}
