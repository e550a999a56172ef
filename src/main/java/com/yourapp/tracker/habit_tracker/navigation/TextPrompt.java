package com.yourapp.tracker.habit_tracker.navigation;

import com.yourapp.tracker.habit_tracker.terminal.KeyEvent;
import com.yourapp.tracker.habit_tracker.terminal.KeyReader;

import java.io.IOException;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Single-line text entry driven by key events. Enter submits whatever was typed, even nothing.
 */
public class TextPrompt {
    private final StringBuilder text = new StringBuilder();

    public String getText() {
        return text.toString();
    }

    public Optional<Selection<String>> handle(KeyEvent key) {
        switch (key.getType()) {
            case CHARACTER:
                text.append(key.getCharacter());
                return Optional.empty();
            case BACKSPACE:
                deleteLastCodePoint(text);
                return Optional.empty();
            case ENTER:
                return Optional.of(Selection.selected(text.toString()));
            case ESCAPE:
                return Optional.of(Selection.cancelled());
            default:
                return Optional.empty();
        }
    }

    public Selection<String> run(KeyReader keys, Consumer<? super TextPrompt> renderer) throws IOException {
        while (true) {
            renderer.accept(this);
            Optional<Selection<String>> done = handle(keys.readKey());
            if (done.isPresent()) {
                return done.get();
            }
        }
    }

    /**
     * Removes the last character, taking both halves of a surrogate pair when the text ends in one.
     */
    static void deleteLastCodePoint(StringBuilder buffer) {
        int length = buffer.length();
        if (length == 0) {
            return;
        }
        buffer.setLength(length - Character.charCount(buffer.codePointBefore(length)));
    }
}
