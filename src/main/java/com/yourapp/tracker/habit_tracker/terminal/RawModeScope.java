package com.yourapp.tracker.habit_tracker.terminal;

import org.jline.terminal.Attributes;
import org.jline.terminal.Terminal;

/**
 * Puts the terminal into raw mode until {@link #close()} restores the attributes it found.
 * Use with try-with-resources so the terminal is restored on every exit path.
 */
public final class RawModeScope implements AutoCloseable {
    private final Terminal terminal;
    private final Attributes previous;

    private RawModeScope(Terminal terminal, Attributes previous) {
        this.terminal = terminal;
        this.previous = previous;
    }

    public static RawModeScope enter(Terminal terminal) {
        return new RawModeScope(terminal, terminal.enterRawMode());
    }

    @Override
    public void close() {
        terminal.setAttributes(previous);
    }
}
