package com.yourapp.tracker.habit_tracker.cli;

public interface MenuOption {
    String label();
}
