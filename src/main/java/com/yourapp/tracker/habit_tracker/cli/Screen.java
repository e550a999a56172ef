package com.yourapp.tracker.habit_tracker.cli;

import java.io.IOException;

/**
 * One step of the menu flow. A screen draws itself, runs its interaction and tells the
 * controller where to go next; it never calls another screen directly.
 */
public interface Screen {
    Navigation show(ScreenContext context) throws IOException;
}
