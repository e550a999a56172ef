package com.yourapp.tracker.habit_tracker.service;

public enum StoreStatus {
    OK,
    ALREADY_EXISTS,
    NOT_FOUND,
    INVALID_INPUT
}
