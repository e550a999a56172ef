package com.yourapp.tracker.habit_tracker.service;

import com.yourapp.tracker.habit_tracker.exception.InvalidInputException;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Longest run of calendar-consecutive days in a set of dates.
 * Order and duplicates in the input do not matter.
 */
public final class StreakCalculator {

    private StreakCalculator() {
    }

    /**
     * @param days dates formatted as {@code YYYY-MM-DD}
     * @return the longest streak, 0 for no dates
     * @throws InvalidInputException if any entry is not a valid date
     */
    public static int longestStreak(List<String> days) {
        List<LocalDate> parsed = new ArrayList<>(days.size());
        for (String day : days) {
            parsed.add(RecordDates.parse(day));
        }
        return longestStreakOfDates(parsed);
    }

    public static int longestStreakOfDates(Collection<LocalDate> dates) {
        // TreeSet both dedupes and sorts ascending
        TreeSet<LocalDate> unique = new TreeSet<>();
        for (LocalDate date : dates) {
            if (date == null) {
                throw new InvalidInputException("Invalid date format: null");
            }
            unique.add(date);
        }

        int max = 0;
        int current = 0;
        LocalDate previous = null;
        for (LocalDate date : unique) {
            if (previous != null && previous.plusDays(1).equals(date)) {
                current++;
            } else {
                current = 1;
            }
            max = Math.max(max, current);
            previous = date;
        }
        return max;
    }
}
