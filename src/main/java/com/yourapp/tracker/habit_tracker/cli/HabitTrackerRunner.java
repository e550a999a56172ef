package com.yourapp.tracker.habit_tracker.cli;

import com.yourapp.tracker.habit_tracker.cli.screen.MainMenuScreen;
import com.yourapp.tracker.habit_tracker.config.HabitTrackerProperties;
import com.yourapp.tracker.habit_tracker.service.HabitRecordService;
import com.yourapp.tracker.habit_tracker.service.HabitService;
import com.yourapp.tracker.habit_tracker.terminal.MenuTerminal;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Starts the menu loop once the context is up. The application exits when the loop returns.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "habit-tracker", name = "interactive", havingValue = "true", matchIfMissing = true)
public class HabitTrackerRunner implements CommandLineRunner {
    private static final Logger logger = LoggerFactory.getLogger(HabitTrackerRunner.class);

    private final HabitService habitService;
    private final HabitRecordService recordService;
    private final HabitTrackerProperties properties;
    private final MenuTerminal terminal;

    @Override
    public void run(String... args) throws Exception {
        logger.info("Using data directory {}", properties.getDataDir());
        ScreenContext context = new ScreenContext(habitService, recordService, properties, terminal);
        new ScreenController(context).run(new MainMenuScreen());
        context.clear();
    }
}
