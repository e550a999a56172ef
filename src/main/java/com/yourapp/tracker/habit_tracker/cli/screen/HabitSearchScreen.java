package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.navigation.Selection;

import java.io.IOException;

public class HabitSearchScreen implements Screen {

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        Selection<Habit> choice = context.search("Search habits", context.habits().listHabits(), Habit::getName);
        switch (choice.getOutcome()) {
            case SELECTED:
                return Navigation.replace(new HabitMenuScreen(choice.getItem().getId()));
            case NO_ITEMS:
                context.clear();
                context.message("No habits found!");
                return Navigation.pop();
            default:
                return Navigation.pop();
        }
    }
}
