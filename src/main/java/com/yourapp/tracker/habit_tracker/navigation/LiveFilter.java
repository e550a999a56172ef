package com.yourapp.tracker.habit_tracker.navigation;

import com.yourapp.tracker.habit_tracker.terminal.KeyEvent;
import com.yourapp.tracker.habit_tracker.terminal.KeyReader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Search-as-you-type selection. Typing narrows the candidates to those whose label contains
 * the query (case-insensitive), keeping their original order; only the first {@code limit}
 * matches are shown and selectable.
 */
public class LiveFilter<T> {
    public static final int DEFAULT_LIMIT = 5;

    private final List<T> candidates;
    private final Function<? super T, String> label;
    private final int limit;
    private final StringBuilder query = new StringBuilder();
    private int selectedIndex;

    public LiveFilter(List<? extends T> candidates, Function<? super T, String> label) {
        this(candidates, label, DEFAULT_LIMIT);
    }

    public LiveFilter(List<? extends T> candidates, Function<? super T, String> label, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("Limit must be at least 1, was " + limit);
        }
        this.candidates = Collections.unmodifiableList(new ArrayList<>(candidates));
        this.label = label;
        this.limit = limit;
    }

    public String getQuery() {
        return query.toString();
    }

    public int getSelectedIndex() {
        return selectedIndex;
    }

    public List<T> getMatches() {
        String needle = query.toString().toLowerCase(Locale.ROOT);
        List<T> matches = new ArrayList<>();
        for (T candidate : candidates) {
            if (label.apply(candidate).toLowerCase(Locale.ROOT).contains(needle)) {
                matches.add(candidate);
            }
        }
        return matches;
    }

    public List<T> getDisplayed() {
        List<T> matches = getMatches();
        return matches.size() <= limit ? matches : new ArrayList<>(matches.subList(0, limit));
    }

    /**
     * Applies one key press.
     *
     * @return the final selection when the key ends the interaction, empty otherwise
     */
    public Optional<Selection<T>> handle(KeyEvent key) {
        List<T> displayed = getDisplayed();
        if (selectedIndex >= displayed.size()) {
            selectedIndex = 0;
        }
        switch (key.getType()) {
            case CHARACTER:
                query.append(key.getCharacter());
                selectedIndex = 0;
                return Optional.empty();
            case BACKSPACE:
                TextPrompt.deleteLastCodePoint(query);
                selectedIndex = 0;
                return Optional.empty();
            case ARROW_DOWN:
                if (!displayed.isEmpty()) {
                    selectedIndex = (selectedIndex + 1) % displayed.size();
                }
                return Optional.empty();
            case ARROW_UP:
                if (!displayed.isEmpty()) {
                    selectedIndex = (selectedIndex - 1 + displayed.size()) % displayed.size();
                }
                return Optional.empty();
            case ENTER:
                if (displayed.isEmpty()) {
                    return Optional.empty();
                }
                return Optional.of(Selection.selected(displayed.get(selectedIndex)));
            case ESCAPE:
                return Optional.of(Selection.cancelled());
            default:
                return Optional.empty();
        }
    }

    /**
     * Renders, reads a key and repeats until the user selects or cancels.
     * With no candidates at all it returns {@link Selection.Outcome#NO_ITEMS} straight away.
     */
    public Selection<T> run(KeyReader keys, Consumer<? super LiveFilter<T>> renderer) throws IOException {
        if (candidates.isEmpty()) {
            return Selection.noItems();
        }
        while (true) {
            renderer.accept(this);
            Optional<Selection<T>> done = handle(keys.readKey());
            if (done.isPresent()) {
                return done.get();
            }
        }
    }
}
