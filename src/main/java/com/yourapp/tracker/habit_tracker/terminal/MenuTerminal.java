package com.yourapp.tracker.habit_tracker.terminal;

/**
 * What the screens need from a terminal: key presses in, lines out.
 */
public interface MenuTerminal extends KeyReader {
    void clear();

    void println(String line);

    void flush();
}
