package com.billreminder.service;

import java.time.LocalDate;

/**
 * One firing of a reminder: the occurrence date in the reminder's zone, and how many days
 * ahead of that date the notice goes out (0 for the on-time firing).
 */
public record Occurrence(Long reminderId, LocalDate date, int leadDays) {

    public String key() {
        String base = reminderId + "@" + date;
        return leadDays == 0 ? base : base + "-T" + leadDays;
    }

    public boolean isOnTime() {
        return leadDays == 0;
    }
}
