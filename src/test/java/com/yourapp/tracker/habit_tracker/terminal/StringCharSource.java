package com.yourapp.tracker.habit_tracker.terminal;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Replays a fixed string. Once it is used up, blocking reads report end of input and
 * timed reads report a timeout.
 */
class StringCharSource implements CharSource {
    private final Deque<Integer> remaining = new ArrayDeque<>();

    StringCharSource(String input) {
        input.chars().forEach(remaining::addLast);
    }

    @Override
    public int read() {
        return remaining.isEmpty() ? EOF : remaining.pollFirst();
    }

    @Override
    public int read(long timeoutMillis) {
        return remaining.isEmpty() ? TIMEOUT : remaining.pollFirst();
    }

    boolean isExhausted() {
        return remaining.isEmpty();
    }
}
