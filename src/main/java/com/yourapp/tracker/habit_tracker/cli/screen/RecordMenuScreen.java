package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.MenuOption;
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

public class RecordMenuScreen implements Screen {

    enum Option implements MenuOption {
        UPDATE_RECORD("Update record"),
        DELETE_RECORD("Delete record"),
        BACK("Back");

        private final String label;

        Option(String label) {
            this.label = label;
        }

        @Override
        public String label() {
            return label;
        }
    }

    private final Long recordId;

    public RecordMenuScreen(Long recordId) {
        this.recordId = recordId;
    }

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        StoreResult<HabitRecord> found = context.records().findRecordById(recordId);
        if (!found.isOk()) {
            context.clear();
            context.message("Error: " + found.getMessage());
            return Navigation.pop();
        }
        HabitRecord record = found.getValue();
        StoreResult<Habit> habit = context.habits().findHabitById(record.getHabitId());
        String habitName = habit.isOk() ? habit.getValue().getName() : "";
        String title = habitName + " - " + RecordDates.format(record.getDate());

        Selection<Option> choice = context.menu(List.of("Record: " + title), Option.values());
        if (!choice.isSelected()) {
            return Navigation.pop();
        }

        switch (choice.getItem()) {
            case UPDATE_RECORD:
                return Navigation.push(new UpdateRecordScreen(recordId, title));
            case DELETE_RECORD:
                StoreResult<HabitRecord> deleted = context.records().deleteRecord(recordId);
                context.message("", deleted.isOk() ? "Record deleted successfully" : "Error: " + deleted.getMessage());
                return Navigation.pop();
            default:
                return Navigation.pop();
        }
    }
}
