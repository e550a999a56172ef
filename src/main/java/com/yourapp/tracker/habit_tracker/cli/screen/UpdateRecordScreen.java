package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.HabitRecord;
import com.yourapp.tracker.habit_tracker.navigation.Selection;
import com.yourapp.tracker.habit_tracker.service.StoreResult;

import java.io.IOException;

public class UpdateRecordScreen implements Screen {
    private final Long recordId;
    private final String title;

    public UpdateRecordScreen(Long recordId, String title) {
        this.recordId = recordId;
        this.title = title;
    }

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        Selection<String> input = context.prompt("Update Record: " + title,
                "Enter the new date of the record (YYYY-MM-DD): ");
        if (!input.isSelected()) {
            return Navigation.pop();
        }

        StoreResult<HabitRecord> result = context.records().updateRecord(recordId, input.getItem());
        switch (result.getStatus()) {
            case OK:
                context.message("", "Record updated successfully");
                return Navigation.pop();
            case ALREADY_EXISTS:
                context.message("", "Record already exists!");
                return Navigation.pop();
            case INVALID_INPUT:
                context.message("", result.getMessage());
                return Navigation.stay();
            default:
                context.message("", "Error: " + result.getMessage());
                return Navigation.pop();
        }
    }
}
