package com.yourapp.tracker.habit_tracker.cli;

import com.yourapp.tracker.habit_tracker.config.HabitTrackerProperties;
import com.yourapp.tracker.habit_tracker.navigation.LiveFilter;
import com.yourapp.tracker.habit_tracker.navigation.Pager;
import com.yourapp.tracker.habit_tracker.navigation.Selection;
import com.yourapp.tracker.habit_tracker.navigation.TextPrompt;
import com.yourapp.tracker.habit_tracker.service.HabitRecordService;
import com.yourapp.tracker.habit_tracker.service.HabitService;
import com.yourapp.tracker.habit_tracker.terminal.KeyEvent;
import com.yourapp.tracker.habit_tracker.terminal.KeyType;
import com.yourapp.tracker.habit_tracker.terminal.MenuTerminal;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

/**
 * Services and drawing helpers shared by all screens.
 */
public class ScreenContext {
    static final int WIDTH = 50;
    private static final String KEY_HINT = "ESC = Back | ENTER = Select";

    private final HabitService habits;
    private final HabitRecordService records;
    private final HabitTrackerProperties properties;
    private final MenuTerminal terminal;

    public ScreenContext(HabitService habits,
                         HabitRecordService records,
                         HabitTrackerProperties properties,
                         MenuTerminal terminal) {
        this.habits = habits;
        this.records = records;
        this.properties = properties;
        this.terminal = terminal;
    }

    public HabitService habits() {
        return habits;
    }

    public HabitRecordService records() {
        return records;
    }

    /**
     * Fixed option menu; all options fit on one page, so up and down simply wrap.
     */
    public <T extends MenuOption> Selection<T> menu(List<String> title, T[] options) throws IOException {
        Pager<T> pager = new Pager<>(Arrays.asList(options), Math.max(options.length, 1));
        return pager.run(terminal, p -> {
            header(title);
            items(p.getPageItems(), p.getSelectedIndex(), MenuOption::label);
            terminal.flush();
        });
    }

    /**
     * Paginated list using the configured page size.
     */
    public <T> Selection<T> choose(List<String> title, List<T> items, Function<? super T, String> label)
            throws IOException {
        Pager<T> pager = new Pager<>(items, properties.getPageSize());
        return pager.run(terminal, p -> {
            header(title);
            String page = "Page " + (p.getCurrentPage() + 1) + " of " + p.getPageCount();
            terminal.println(padRight(page, WIDTH - KEY_HINT.length()) + KEY_HINT);
            terminal.println("");
            items(p.getPageItems(), p.getSelectedIndex(), label);
            terminal.flush();
        });
    }

    public <T> Selection<T> search(String title, List<T> items, Function<? super T, String> label)
            throws IOException {
        LiveFilter<T> filter = new LiveFilter<>(items, label, properties.getFilterLimit());
        return filter.run(terminal, f -> {
            header(List.of(title));
            terminal.println("Search: " + f.getQuery());
            terminal.println("");
            List<T> displayed = f.getDisplayed();
            if (displayed.isEmpty()) {
                terminal.println("  (no matches)");
            }
            items(displayed, f.getSelectedIndex(), label);
            terminal.flush();
        });
    }

    public Selection<String> prompt(String title, String question) throws IOException {
        return new TextPrompt().run(terminal, p -> {
            header(List.of(title));
            terminal.println(question + p.getText());
            terminal.flush();
        });
    }

    /**
     * Shows the lines and waits for Enter (or Escape).
     */
    public void message(String... lines) throws IOException {
        for (String line : lines) {
            terminal.println(line);
        }
        terminal.println("Press Enter to continue...");
        terminal.flush();
        KeyType key;
        do {
            KeyEvent event = terminal.readKey();
            key = event.getType();
        } while (key != KeyType.ENTER && key != KeyType.ESCAPE);
    }

    public void clear() {
        terminal.clear();
        terminal.flush();
    }

    private void header(List<String> title) {
        terminal.clear();
        for (String line : title) {
            terminal.println(center(line));
        }
        terminal.println("─".repeat(WIDTH));
        terminal.println("");
    }

    private <T> void items(List<T> items, int selectedIndex, Function<? super T, String> label) {
        for (int i = 0; i < items.size(); i++) {
            String marker = i == selectedIndex ? " > " : "   ";
            terminal.println(marker + label.apply(items.get(i)));
        }
    }

    private static String center(String text) {
        if (text.length() >= WIDTH) {
            return text;
        }
        int left = (WIDTH - text.length()) / 2;
        return " ".repeat(left) + text;
    }

    private static String padRight(String text, int width) {
        return text.length() >= width ? text + " " : text + " ".repeat(width - text.length());
    }
}
