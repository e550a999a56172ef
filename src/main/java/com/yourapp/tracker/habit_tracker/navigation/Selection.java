package com.yourapp.tracker.habit_tracker.navigation;

/**
 * How an interactive selection ended.
 */
public final class Selection<T> {
    public enum Outcome {
        SELECTED,
        CANCELLED,
        NO_ITEMS
    }

    private final Outcome outcome;
    private final T item;

    private Selection(Outcome outcome, T item) {
        this.outcome = outcome;
        this.item = item;
    }

    public static <T> Selection<T> selected(T item) {
        return new Selection<>(Outcome.SELECTED, item);
    }

    public static <T> Selection<T> cancelled() {
        return new Selection<>(Outcome.CANCELLED, null);
    }

    public static <T> Selection<T> noItems() {
        return new Selection<>(Outcome.NO_ITEMS, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSelected() {
        return outcome == Outcome.SELECTED;
    }

    public T getItem() {
        if (outcome != Outcome.SELECTED) {
            throw new IllegalStateException("Nothing selected: " + outcome);
        }
        return item;
    }

    @Override
    public String toString() {
        return outcome == Outcome.SELECTED ? "SELECTED(" + item + ")" : outcome.name();
    }
}
