package com.yourapp.tracker.habit_tracker.terminal;

import java.util.Objects;

/**
 * A logical key press. Only {@link KeyType#CHARACTER} events carry a character.
 */
public final class KeyEvent {
    public static final KeyEvent BACKSPACE = new KeyEvent(KeyType.BACKSPACE, '\0');
    public static final KeyEvent ENTER = new KeyEvent(KeyType.ENTER, '\0');
    public static final KeyEvent ESCAPE = new KeyEvent(KeyType.ESCAPE, '\0');
    public static final KeyEvent ARROW_UP = new KeyEvent(KeyType.ARROW_UP, '\0');
    public static final KeyEvent ARROW_DOWN = new KeyEvent(KeyType.ARROW_DOWN, '\0');
    public static final KeyEvent IGNORED = new KeyEvent(KeyType.IGNORED, '\0');

    private final KeyType type;
    private final char character;

    private KeyEvent(KeyType type, char character) {
        this.type = type;
        this.character = character;
    }

    public static KeyEvent character(char c) {
        return new KeyEvent(KeyType.CHARACTER, c);
    }

    public KeyType getType() {
        return type;
    }

    public char getCharacter() {
        if (type != KeyType.CHARACTER) {
            throw new IllegalStateException(type + " carries no character");
        }
        return character;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof KeyEvent)) return false;
        KeyEvent other = (KeyEvent) o;
        return type == other.type && character == other.character;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, character);
    }

    @Override
    public String toString() {
        return type == KeyType.CHARACTER ? "CHARACTER('" + character + "')" : type.name();
    }
}
