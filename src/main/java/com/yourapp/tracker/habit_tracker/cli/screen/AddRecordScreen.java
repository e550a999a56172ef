package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import com.yourapp.tracker.habit_tracker.navigation.Selection;
import com.yourapp.tracker.habit_tracker.service.StoreResult;

import java.io.IOException;
import java.util.Optional;

public class AddRecordScreen implements Screen {
    private final Long habitId;

    public AddRecordScreen(Long habitId) {
        this.habitId = habitId;
    }

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        Selection<String> input = context.prompt("Add a new record", "Enter the date of the record (YYYY-MM-DD): ");
        if (!input.isSelected()) {
            return Navigation.pop();
        }

        StoreResult<HabitRecord> result = context.records().createRecord(habitId, input.getItem());
        switch (result.getStatus()) {
            case OK:
                context.message("", "Record added successfully");
                return Navigation.replace(new RecordMenuScreen(result.getValue().getId()));
            case ALREADY_EXISTS:
                context.message("", "Record already exists!");
                Optional<HabitRecord> existing = result.getExisting();
                return existing.isPresent()
                        ? Navigation.replace(new RecordMenuScreen(existing.get().getId()))
                        : Navigation.pop();
            case INVALID_INPUT:
                context.message("", result.getMessage());
                return Navigation.stay();
            default:
                context.message("", "Error: " + result.getMessage());
                return Navigation.pop();
        }
    }
}
