package com.yourapp.tracker.habit_tracker.exception;

/**
 * Raised when user-supplied text cannot be turned into a value, such as a date that is not {@code YYYY-MM-DD}.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }
}
