package com.yourapp.tracker.habit_tracker.terminal;

public enum KeyType {
    CHARACTER,
    BACKSPACE,
    ENTER,
    ESCAPE,
    ARROW_UP,
    ARROW_DOWN,
    IGNORED
}
