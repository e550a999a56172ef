package com.yourapp.tracker.habit_tracker.cli.screen;

import com.yourapp.tracker.habit_tracker.cli.MenuOption;
import com.yourapp.tracker.habit_tracker.cli.Navigation;
import com.yourapp.tracker.habit_tracker.cli.Screen;
import com.yourapp.tracker.habit_tracker.cli.ScreenContext;
import com.yourapp.tracker.habit_tracker.model.Habit;
import com.yourapp.tracker.habit_tracker.navigation.Selection;
import com.yourapp.tracker.habit_tracker.service.StoreResult;

import java.io.IOException;
import java.util.List;

/**
 * Actions on one habit, with its longest streak in the header.
 */
public class HabitMenuScreen implements Screen {

    enum Option implements MenuOption {
        ADD_RECORD("Add a new record"),
        VIEW_RECORDS("View records"),
        UPDATE_HABIT("Update habit"),
        DELETE_HABIT("Delete habit"),
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

    private final Long habitId;

    public HabitMenuScreen(Long habitId) {
        this.habitId = habitId;
    }

    @Override
    public Navigation show(ScreenContext context) throws IOException {
        StoreResult<Habit> found = context.habits().findHabitById(habitId);
        StoreResult<Integer> streak = context.habits().longestStreak(habitId);
        if (!found.isOk() || !streak.isOk()) {
            context.clear();
            context.message("Error: " + (found.isOk() ? streak.getMessage() : found.getMessage()));
            return Navigation.pop();
        }
        Habit habit = found.getValue();
        long recordCount = context.records().countRecords(habitId);

        Selection<Option> choice = context.menu(List.of(
                "Habit: " + habit.getName(),
                "Longest streak: " + streak.getValue() + " days",
                "Records: " + recordCount), Option.values());
        if (!choice.isSelected()) {
            return Navigation.pop();
        }

        switch (choice.getItem()) {
            case ADD_RECORD:
                return Navigation.push(new AddRecordScreen(habitId));
            case VIEW_RECORDS:
                return Navigation.push(new RecordListScreen(habitId));
            case UPDATE_HABIT:
                return Navigation.push(new RenameHabitScreen(habitId, habit.getName()));
            case DELETE_HABIT:
                StoreResult<Habit> deleted = context.habits().deleteHabit(habitId);
                context.message("", deleted.isOk() ? "Habit deleted successfully" : "Error: " + deleted.getMessage());
                return Navigation.pop();
            default:
                return Navigation.pop();
        }
    }
}
