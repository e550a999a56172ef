package com.yourapp.tracker.habit_tracker.navigation;

import com.yourapp.tracker.habit_tracker.terminal.KeyEvent;
import com.yourapp.tracker.habit_tracker.terminal.KeyReader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Paginated list selection. Up and down move through the current page and roll over
 * into the previous or next page, wrapping at both ends of the list.
 *
 * <p>The item list is fixed when the pager is created.
 */
public class Pager<T> {
    public static final int DEFAULT_PAGE_SIZE = 5;

    private final List<T> items;
    private final int pageSize;
    private int currentPage;
    private int selectedIndex;

    public Pager(List<? extends T> items) {
        this(items, DEFAULT_PAGE_SIZE);
    }

    public Pager(List<? extends T> items, int pageSize) {
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be at least 1, was " + pageSize);
        }
        this.items = Collections.unmodifiableList(new ArrayList<>(items));
        this.pageSize = pageSize;
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int getPageCount() {
        return (items.size() + pageSize - 1) / pageSize;
    }

    public int getCurrentPage() {
        return currentPage;
    }

    public int getSelectedIndex() {
        return selectedIndex;
    }

    public List<T> getPageItems() {
        return pageItems(currentPage);
    }

    public T getSelectedItem() {
        return getPageItems().get(selectedIndex);
    }

    /**
     * Applies one key press.
     *
     * @return the final selection when the key ends the interaction, empty otherwise
     */
    public Optional<Selection<T>> handle(KeyEvent key) {
        if (isEmpty()) {
            return Optional.of(Selection.noItems());
        }
        switch (key.getType()) {
            case ARROW_DOWN:
                selectedIndex++;
                if (selectedIndex >= pageItems(currentPage).size()) {
                    currentPage = (currentPage + 1) % getPageCount();
                    selectedIndex = 0;
                }
                return Optional.empty();
            case ARROW_UP:
                selectedIndex--;
                if (selectedIndex < 0) {
                    currentPage = (currentPage - 1 + getPageCount()) % getPageCount();
                    selectedIndex = pageItems(currentPage).size() - 1;
                }
                return Optional.empty();
            case ENTER:
                return Optional.of(Selection.selected(getSelectedItem()));
            case ESCAPE:
                return Optional.of(Selection.cancelled());
            default:
                return Optional.empty();
        }
    }

    /**
     * Renders, reads a key and repeats until the user selects or cancels.
     * An empty pager returns {@link Selection.Outcome#NO_ITEMS} without reading anything.
     */
    public Selection<T> run(KeyReader keys, Consumer<? super Pager<T>> renderer) throws IOException {
        if (isEmpty()) {
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

    private List<T> pageItems(int page) {
        int from = page * pageSize;
        int to = Math.min(from + pageSize, items.size());
        return items.subList(from, to);
    }
}
