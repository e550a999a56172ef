package com.yourapp.tracker.habit_tracker.config;

import com.yourapp.tracker.habit_tracker.terminal.JLineMenuTerminal;
import com.yourapp.tracker.habit_tracker.terminal.KeyDecoder;
import com.yourapp.tracker.habit_tracker.terminal.MenuTerminal;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Opens the system terminal. Skipped entirely when running non-interactively.
 */
@Configuration
@ConditionalOnProperty(prefix = "habit-tracker", name = "interactive", havingValue = "true", matchIfMissing = true)
public class TerminalConfig {

    @Bean(destroyMethod = "close")
    public Terminal terminal() throws IOException {
        return TerminalBuilder.builder()
                .name("habit-tracker")
                .system(true)
                .build();
    }

    @Bean
    public MenuTerminal menuTerminal(Terminal terminal, HabitTrackerProperties properties) {
        return new JLineMenuTerminal(terminal, new KeyDecoder(properties.getEscapeTimeoutMillis()));
    }
}
