package com.yourapp.tracker.habit_tracker.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "habit-tracker")
public class HabitTrackerProperties {
    private String dataDir;
    private int pageSize = 5;               // rows per page in list screens
    private int filterLimit = 5;            // matches offered by the search screen
    private long escapeTimeoutMillis = 50;  // wait for the rest of an escape sequence
    private boolean interactive = true;

    @PostConstruct
    public void init() {
        if (pageSize < 1) {
            throw new IllegalStateException("habit-tracker.page-size must be at least 1, was " + pageSize);
        }
        if (filterLimit < 1) {
            throw new IllegalStateException("habit-tracker.filter-limit must be at least 1, was " + filterLimit);
        }
        if (escapeTimeoutMillis < 0) {
            throw new IllegalStateException("habit-tracker.escape-timeout-millis must not be negative");
        }
    }

    public String getDataDir() { return dataDir; }
    public void setDataDir(String dataDir) { this.dataDir = dataDir; }
    public int getPageSize() { return pageSize; }
    public void setPageSize(int pageSize) { this.pageSize = pageSize; }
    public int getFilterLimit() { return filterLimit; }
    public void setFilterLimit(int filterLimit) { this.filterLimit = filterLimit; }
    public long getEscapeTimeoutMillis() { return escapeTimeoutMillis; }
    public void setEscapeTimeoutMillis(long escapeTimeoutMillis) { this.escapeTimeoutMillis = escapeTimeoutMillis; }
    public boolean isInteractive() { return interactive; }
    public void setInteractive(boolean interactive) { this.interactive = interactive; }
}
