package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.navigation.Selection;

import java.io.IOException;
import java.util.List;

public class HabitListScreen implements Screen {

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        List<Habit> habits = context.habits().listHabits();
        Selection<Habit> choice = context.choose(List.of("My Habits"), habits, Habit::getName);
        switch (choice.getOutcome()) {
            case SELECTED:
                return Navigation.push(new HabitMenuScreen(choice.getItem().getId()));
            case NO_ITEMS:
                context.clear();
                context.message("No habits found!");
                return Navigation.pop();
            default:
                return Navigation.pop();
        }
    }
}
