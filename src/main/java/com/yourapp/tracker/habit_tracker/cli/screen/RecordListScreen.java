package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import com.yourapp.tracker.habit_tracker.navigation.Selection;
import com.yourapp.tracker.habit_tracker.service.RecordDates;
import com.yourapp.tracker.habit_tracker.service.StoreResult;

import java.io.IOException;
import java.util.List;

public class RecordListScreen implements Screen {
    private final Long habitId;

    public RecordListScreen(Long habitId) {
        this.habitId = habitId;
    }

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        StoreResult<Habit> habit = context.habits().findHabitById(habitId);
        if (!habit.isOk()) {
            context.clear();
            context.message("Error: " + habit.getMessage());
            return Navigation.pop();
        }

        List<HabitRecord> records = context.records().listRecords(habitId);
        Selection<HabitRecord> choice = context.choose(
                List.of("Records: " + habit.getValue().getName()),
                records,
                record -> RecordDates.format(record.getDate()));
        switch (choice.getOutcome()) {
            case SELECTED:
                return Navigation.push(new RecordMenuScreen(choice.getItem().getId()));
            case NO_ITEMS:
                context.clear();
                context.message("No records found!");
                return Navigation.pop();
            default:
                return Navigation.pop();
        }
    }
}
