package com.billreminder.service;

import com.billreminder.domain.enums.Frequency;
import com.billreminder.domain.model.Reminder;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.util.Map;

@Component
public class ReminderMessageFormatter {

    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("HH:mm");
    private static final DateTimeFormatter DATE_FMT = DateTimeFormatter.ofPattern("dd.MM.yyyy");
    private static final Map<Frequency, String> FREQUENCY_LABELS = Map.of(
            Frequency.ONCE, "one-time",
            Frequency.DAILY, "daily",
            Frequency.WEEKLY, "weekly",
            Frequency.MONTHLY, "monthly"
    );

    public String format(Reminder reminder, Occurrence occurrence) {
        String title;
        if (occurrence.leadDays() == 0) {
            title = "🚨 Payment due today";
        } else if (occurrence.leadDays() == 1) {
            title = "⏳ Payment due in 1 day";
        } else {
            title = "⏳ Payment due in " + occurrence.leadDays() + " days";
        }
        return title + "\n\n"
                + "🧾 " + reminder.getText() + "\n"
                + "⏰ " + reminder.getRemindAt().format(TIME_FMT) + " - " + FREQUENCY_LABELS.get(reminder.getFrequency()) + "\n"
                + "📅 " + occurrence.date().format(DATE_FMT);
    }

    public String formatNothingDue() {
        return "✅ Nothing to pay today";
    }
}
