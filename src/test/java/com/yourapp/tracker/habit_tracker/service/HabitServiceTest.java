package com.yourapp.tracker.habit_tracker.service;

import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import com.yourapp.tracker.habit_tracker.repository.HabitRecordRepository;
import com.yourapp.tracker.habit_tracker.repository.HabitRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

@SpringBootTest
@ActiveProfiles("test")
class HabitServiceTest {

    @Autowired
    private HabitService habitService;

    @Autowired
    private HabitRecordService recordService;

    @SpyBean
    private HabitRepository habitRepo;

    @Autowired
    private HabitRecordRepository recordRepo;

    @BeforeEach
    void cleanDatabase() {
        recordRepo.deleteAll();
        habitRepo.deleteAll();
    }

    @Test
    void createsHabitWithTrimmedName() {
        StoreResult<Habit> result = habitService.createHabit("  Running  ");

        assertThat(result.getStatus()).isEqualTo(StoreStatus.OK);
        assertThat(result.getValue().getId()).isNotNull();
        assertThat(result.getValue().getName()).isEqualTo("Running");
    }

    @Test
    void rejectsBlankName() {
        assertThat(habitService.createHabit("   ").getStatus()).isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(habitService.createHabit("").getStatus()).isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(habitService.createHabit(null).getStatus()).isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(habitService.listHabits()).isEmpty();
    }

    @Test
    void rejectsOverlongName() {
        String name = "x".repeat(HabitService.MAX_NAME_LENGTH + 1);
        assertThat(habitService.createHabit(name).getStatus()).isEqualTo(StoreStatus.INVALID_INPUT);
    }

    @Test
    void duplicateNameReportsExistingHabit() {
        Habit first = habitService.createHabit("Running").getValue();

        StoreResult<Habit> second = habitService.createHabit("Running ");

        assertThat(second.getStatus()).isEqualTo(StoreStatus.ALREADY_EXISTS);
        assertThat(second.getExisting()).hasValueSatisfying(h -> assertThat(h.getId()).isEqualTo(first.getId()));
        assertThat(habitService.listHabits())
                .extracting(Habit::getName)
                .containsExactly("Running");
    }

    @Test
    void listsHabitsByName() {
        habitService.createHabit("Yoga");
        habitService.createHabit("Coding");
        habitService.createHabit("Meditation");

        List<Habit> habits = habitService.listHabits();

        assertThat(habits).extracting(Habit::getName).containsExactly("Coding", "Meditation", "Yoga");
    }

    @Test
    void findsByNameAndId() {
        Habit created = habitService.createHabit("Reading").getValue();

        assertThat(habitService.findHabitByName(" Reading").getValue()).isEqualTo(created);
        assertThat(habitService.findHabitById(created.getId()).getValue().getName()).isEqualTo("Reading");
        assertThat(habitService.findHabitByName("Writing").getStatus()).isEqualTo(StoreStatus.NOT_FOUND);
        assertThat(habitService.findHabitById(created.getId() + 1000).getStatus()).isEqualTo(StoreStatus.NOT_FOUND);
    }

    @Test
    void renameKeepsIdentity() {
        Habit habit = habitService.createHabit("Runing").getValue();

        StoreResult<Habit> renamed = habitService.renameHabit(habit.getId(), " Running ");

        assertThat(renamed.isOk()).isTrue();
        assertThat(renamed.getValue().getId()).isEqualTo(habit.getId());
        assertThat(habitService.findHabitById(habit.getId()).getValue().getName()).isEqualTo("Running");
    }

    @Test
    void renameToOwnNameIsAllowed() {
        Habit habit = habitService.createHabit("Running").getValue();

        assertThat(habitService.renameHabit(habit.getId(), "Running").isOk()).isTrue();
    }

    @Test
    void renameFollowsCreateRules() {
        Habit running = habitService.createHabit("Running").getValue();
        habitService.createHabit("Reading");

        assertThat(habitService.renameHabit(running.getId(), "Reading").getStatus())
                .isEqualTo(StoreStatus.ALREADY_EXISTS);
        assertThat(habitService.renameHabit(running.getId(), " ").getStatus())
                .isEqualTo(StoreStatus.INVALID_INPUT);
        assertThat(habitService.renameHabit(running.getId() + 1000, "Swimming").getStatus())
                .isEqualTo(StoreStatus.NOT_FOUND);
        assertThat(habitService.findHabitById(running.getId()).getValue().getName()).isEqualTo("Running");
    }

    @Test
    void returnedHabitsAreCopies() {
        Habit habit = habitService.createHabit("Running").getValue();
        habit.setName("Changed outside the store");

        assertThat(habitService.findHabitById(habit.getId()).getValue().getName()).isEqualTo("Running");
    }

    @Test
    void deleteCascadesToRecords() {
        Habit habit = habitService.createHabit("Running").getValue();
        recordService.createRecord(habit.getId(), "2025-01-01");
        recordService.createRecord(habit.getId(), "2025-01-02");
        Habit other = habitService.createHabit("Reading").getValue();
        recordService.createRecord(other.getId(), "2025-01-01");

        StoreResult<Habit> deleted = habitService.deleteHabit(habit.getId());

        assertThat(deleted.isOk()).isTrue();
        assertThat(recordService.listRecords(habit.getId())).isEmpty();
        assertThat(recordService.countRecords(habit.getId())).isZero();
        assertThat(recordService.listRecords(other.getId())).hasSize(1);
        assertThat(habitService.findHabitById(habit.getId()).getStatus()).isEqualTo(StoreStatus.NOT_FOUND);
    }

    @Test
    void failedDeleteRollsBackRecordRemoval() {
        Habit habit = habitService.createHabit("Running").getValue();
        recordService.createRecord(habit.getId(), "2025-01-01");
        recordService.createRecord(habit.getId(), "2025-01-02");
        doThrow(new DataAccessResourceFailureException("disk full")).when(habitRepo).delete(any(Habit.class));

        assertThatThrownBy(() -> habitService.deleteHabit(habit.getId()))
                .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(habitService.findHabitById(habit.getId()).isOk()).isTrue();
        assertThat(recordService.listRecords(habit.getId()))
                .extracting(HabitRecord::getDate)
                .extracting(Object::toString)
                .containsExactly("2025-01-02", "2025-01-01");
    }

    @Test
    void deletingTwiceReportsNotFound() {
        Habit habit = habitService.createHabit("Running").getValue();

        assertThat(habitService.deleteHabit(habit.getId()).isOk()).isTrue();
        assertThat(habitService.deleteHabit(habit.getId()).getStatus()).isEqualTo(StoreStatus.NOT_FOUND);
    }

    @Test
    void longestStreakUsesStoredRecords() {
        Habit habit = habitService.createHabit("Running").getValue();
        for (String day : List.of("2025-03-01", "2025-03-02", "2025-03-03", "2025-03-10")) {
            recordService.createRecord(habit.getId(), day);
        }

        assertThat(habitService.longestStreak(habit.getId()).getValue()).isEqualTo(3);
        assertThat(habitService.longestStreak(habit.getId() + 1000).getStatus()).isEqualTo(StoreStatus.NOT_FOUND);
    }

    @Test
    void longestStreakOfHabitWithoutRecordsIsZero() {
        Habit habit = habitService.createHabit("Running").getValue();

        assertThat(habitService.longestStreak(habit.getId()).getValue()).isZero();
    }
}
