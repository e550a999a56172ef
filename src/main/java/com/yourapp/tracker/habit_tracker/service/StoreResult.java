package com.yourapp.tracker.habit_tracker.service;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a store operation. Expected failures (duplicates, missing rows, bad input)
 * are reported through {@link #getStatus()} instead of exceptions.
 *
 * <p>For {@link StoreStatus#ALREADY_EXISTS} the conflicting entity is attached when the store
 * could look it up, so the caller can carry on with it.
 */
public final class StoreResult<T> {
    private final StoreStatus status;
    private final T value;
    private final T existing;
    private final String message;

    private StoreResult(StoreStatus status, T value, T existing, String message) {
        this.status = Objects.requireNonNull(status, "status");
        this.value = value;
        this.existing = existing;
        this.message = message;
    }

    public static <T> StoreResult<T> ok(T value) {
        return new StoreResult<>(StoreStatus.OK, Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> StoreResult<T> alreadyExists(String message, T existing) {
        return new StoreResult<>(StoreStatus.ALREADY_EXISTS, null, existing, message);
    }

    public static <T> StoreResult<T> notFound(String message) {
        return new StoreResult<>(StoreStatus.NOT_FOUND, null, null, message);
    }

    public static <T> StoreResult<T> invalidInput(String message) {
        return new StoreResult<>(StoreStatus.INVALID_INPUT, null, null, message);
    }

    public StoreStatus getStatus() {
        return status;
    }

    public boolean isOk() {
        return status == StoreStatus.OK;
    }

    /**
     * @throws IllegalStateException if the operation did not succeed
     */
    public T getValue() {
        if (status != StoreStatus.OK) {
            throw new IllegalStateException("No value for " + status + ": " + message);
        }
        return value;
    }

    public Optional<T> getExisting() {
        return Optional.ofNullable(existing);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return status == StoreStatus.OK
                ? "StoreResult[OK, " + value + "]"
                : "StoreResult[" + status + ", " + message + "]";
    }
}
