package com.yourapp.tracker.habit_tracker.terminal;

import java.io.IOException;

@FunctionalInterface
public interface KeyReader {
    /**
     * Blocks for the next key press.
     */
    KeyEvent readKey() throws IOException;
}
