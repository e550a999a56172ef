package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.navigation.Selection;
import com.yourapp.tracker.habit_tracker.service.StoreResult;

import java.io.IOException;
import java.util.Optional;

public class AddHabitScreen implements Screen {

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        Selection<String> input = context.prompt("Add a new habit", "Enter a new habit: ");
        if (!input.isSelected()) {
            return Navigation.pop();
        }

        StoreResult<Habit> result = context.habits().createHabit(input.getItem());
        switch (result.getStatus()) {
            case OK:
                context.message("", "Habit added successfully");
                return Navigation.replace(new HabitMenuScreen(result.getValue().getId()));
            case ALREADY_EXISTS:
                context.message("", "Habit already exists!");
                Optional<Habit> existing = result.getExisting();
                return existing.isPresent()
                        ? Navigation.replace(new HabitMenuScreen(existing.get().getId()))
                        : Navigation.pop();
            case INVALID_INPUT:
                context.message("", "Error: " + result.getMessage());
                return Navigation.stay();
            default:
                context.message("", "Error: " + result.getMessage());
                return Navigation.pop();
        }
    }
}
