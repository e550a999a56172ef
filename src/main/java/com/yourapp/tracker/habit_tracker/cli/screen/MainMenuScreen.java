package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.MenuOption;
import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.navigation.Selection;

import java.io.IOException;
import java.util.List;

public class MainMenuScreen implements Screen {

    enum Option implements MenuOption {
        ADD_HABIT("Add a new habit"),
        VIEW_HABITS("View habits"),
        SEARCH_HABITS("Search habits"),
        EXIT("Exit");

        private final String label;

        Option(String label) {
            this.label = label;
        }

        @Override
        public String label() {
            return label;
        }
    }

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        Selection<Option> choice = context.menu(List.of("Habit Tracker"), Option.values());
        if (!choice.isSelected()) {
            return Navigation.exit();
        }
        switch (choice.getItem()) {
            case ADD_HABIT:
                return Navigation.push(new AddHabitScreen());
            case VIEW_HABITS:
                return Navigation.push(new HabitListScreen());
            case SEARCH_HABITS:
                return Navigation.push(new HabitSearchScreen());
            default:
                return Navigation.exit();
        }
    }
}
