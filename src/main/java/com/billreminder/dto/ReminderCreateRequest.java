package com.billreminder.dto;

import java.time.LocalDate;

public record ReminderCreateRequest(
        String text,
        String time,
        String frequency,
        Integer dayOfMonth,
        String dayOfWeek,
        LocalDate dueDate,
        String timezone,
        Integer advanceNoticeDays
) {
}
