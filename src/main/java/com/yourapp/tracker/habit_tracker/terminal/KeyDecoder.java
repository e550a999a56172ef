package com.yourapp.tracker.habit_tracker.terminal;

import java.io.IOException;

/**
 * Turns raw terminal characters into {@link KeyEvent}s. This is the only place that knows
 * about escape sequences.
 *
 * <ul>
 *   <li>{@code ESC [ A} / {@code ESC [ B}: arrow up / down</li>
 *   <li>any other {@code ESC [} sequence (left/right arrows, Delete, Page Up, modified arrows): ignored.
 *       Parameter bytes are read up to and including the final byte, so nothing leaks into text input</li>
 *   <li>{@code ESC} alone, or followed by something other than {@code [}: escape</li>
 *   <li>CR or LF: enter; DEL or BS: backspace</li>
 *   <li>printable characters: character; other control characters: ignored</li>
 *   <li>end of input: escape</li>
 * </ul>
 */
public class KeyDecoder {
    private static final int ESC = 27;
    private static final int CR = '\r';
    private static final int LF = '\n';
    private static final int DEL = 127;
    private static final int BS = 8;

    private final long escapeTimeoutMillis;

    public KeyDecoder(long escapeTimeoutMillis) {
        this.escapeTimeoutMillis = escapeTimeoutMillis;
    }

    public KeyEvent decode(CharSource source) throws IOException {
        int ch = source.read();
        switch (ch) {
            case CharSource.EOF:
                return KeyEvent.ESCAPE;
            case ESC:
                return decodeEscape(source);
            case CR:
            case LF:
                return KeyEvent.ENTER;
            case DEL:
            case BS:
                return KeyEvent.BACKSPACE;
            default:
                return ch >= 32 ? KeyEvent.character((char) ch) : KeyEvent.IGNORED;
        }
    }

    private KeyEvent decodeEscape(CharSource source) throws IOException {
        int second = source.read(escapeTimeoutMillis);
        if (second != '[') {
            return KeyEvent.ESCAPE;
        }
        int next = source.read(escapeTimeoutMillis);
        boolean parameterized = false;
        while (isParameterOrIntermediate(next)) {
            parameterized = true;
            next = source.read(escapeTimeoutMillis);
        }
        if (!parameterized && next == 'A') {
            return KeyEvent.ARROW_UP;
        }
        if (!parameterized && next == 'B') {
            return KeyEvent.ARROW_DOWN;
        }
        return KeyEvent.IGNORED;
    }

    private static boolean isParameterOrIntermediate(int ch) {
        return ch >= 0x20 && ch <= 0x3F;
    }
}
