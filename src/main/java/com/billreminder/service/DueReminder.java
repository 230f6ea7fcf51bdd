package com.billreminder.service;

import com.billreminder.domain.model.Reminder;

import java.time.ZoneId;

public record DueReminder(Reminder reminder, Occurrence occurrence, ZoneId zone) {

    public Long reminderId() {
        return reminder.getId();
    }

    public String occurrenceKey() {
        return occurrence.key();
    }
}
