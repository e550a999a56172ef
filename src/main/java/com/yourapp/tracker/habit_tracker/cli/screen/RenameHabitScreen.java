package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.navigation.Selection;
import com.yourapp.tracker.habit_tracker.service.StoreResult;

import java.io.IOException;

public class RenameHabitScreen implements Screen {
    private final Long habitId;
    private final String currentName;

    public RenameHabitScreen(Long habitId, String currentName) {
        this.habitId = habitId;
        this.currentName = currentName;
    }

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        Selection<String> input = context.prompt("Update Habit: " + currentName, "Enter the new name of the habit: ");
        if (!input.isSelected()) {
            return Navigation.pop();
        }

        StoreResult<Habit> result = context.habits().renameHabit(habitId, input.getItem());
        switch (result.getStatus()) {
            case OK:
                context.message("", "Habit updated successfully");
                return Navigation.pop();
            case ALREADY_EXISTS:
                context.message("", "Habit already exists!");
                return Navigation.pop();
            case INVALID_INPUT:
                context.message("", "Error: " + result.getMessage());
                return Navigation.stay();
            default:
                context.message("", "Error: " + result.getMessage());
                return Navigation.pop();
        }
    }
}
