package com.yourapp.tracker.habit_tracker.terminal;

import java.io.IOException;

/**
 * Character input the {@link KeyDecoder} pulls from.
 */
public interface CharSource {
    int EOF = -1;
    int TIMEOUT = -2;

    /**
     * Blocks until a character is available.
     *
     * @return the character, or {@link #EOF}
     */
    int read() throws IOException;

    /**
     * Waits at most {@code timeoutMillis} for a character.
     *
     * @return the character, {@link #EOF}, or {@link #TIMEOUT} when nothing arrived in time
     */
    int read(long timeoutMillis) throws IOException;
}
