package com.billreminder.service;

import com.billreminder.config.ReminderProperties;
import com.billreminder.domain.enums.Frequency;
import com.billreminder.domain.model.Reminder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Decides whether a reminder has an occurrence firing at a given instant.
 * <p>
 * A firing scheduled at local date-time {@code S} matches while {@code S <= now < S + matchWindow}.
 * Monthly reminders anchored past the end of a short month fire on its last day.
 * Stateless; safe to call from any thread.
 */
@Component
public class RecurrenceEvaluator {

    public static final int MAX_ADVANCE_NOTICE_DAYS = 2;

    private final Duration matchWindow;

    @Autowired
    public RecurrenceEvaluator(ReminderProperties properties) {
        this(properties.matchWindow());
    }

    public RecurrenceEvaluator(Duration matchWindow) {
        this.matchWindow = matchWindow;
    }

    public Optional<Occurrence> evaluate(Reminder reminder, ZoneId zone, Instant now) {
        if (reminder.getRemindAt() == null || reminder.getFrequency() == null) {
            return Optional.empty();
        }
        ZonedDateTime nowLocal = now.atZone(zone);
        LocalTime fireTime = reminder.getRemindAt().truncatedTo(ChronoUnit.MINUTES);
        LocalDate today = nowLocal.toLocalDate();

        // the window may have opened yesterday when it straddles midnight
        for (LocalDate fireDate : new LocalDate[]{today, today.minusDays(1)}) {
            ZonedDateTime scheduled = ZonedDateTime.of(fireDate, fireTime, zone);
            if (nowLocal.isBefore(scheduled) || !nowLocal.isBefore(scheduled.plus(matchWindow))) {
                continue;
            }
            Optional<Occurrence> occurrence = occurrenceFiringOn(reminder, fireDate);
            if (occurrence.isPresent()) {
                return occurrence;
            }
        }
        return Optional.empty();
    }

    public boolean occursOn(Reminder reminder, LocalDate date) {
        Frequency frequency = reminder.getFrequency();
        if (frequency == null) {
            return false;
        }
        return switch (frequency) {
            case DAILY -> true;
            case WEEKLY -> date.getDayOfWeek() == weeklyAnchor(reminder);
            case MONTHLY -> matchesDayOfMonth(reminder.getDayOfMonth(), date);
            case ONCE -> reminder.getDueDate() != null
                    ? reminder.getDueDate().equals(date)
                    : matchesDayOfMonth(reminder.getDayOfMonth(), date);
        };
    }

    private Optional<Occurrence> occurrenceFiringOn(Reminder reminder, LocalDate fireDate) {
        if (occursOn(reminder, fireDate)) {
            return Optional.of(new Occurrence(reminder.getId(), fireDate, 0));
        }
        if (!reminder.getFrequency().supportsAdvanceNotice()) {
            return Optional.empty();
        }
        int lead = Math.min(MAX_ADVANCE_NOTICE_DAYS, Math.max(0, reminder.getAdvanceNoticeDays()));
        for (int days = 1; days <= lead; days++) {
            LocalDate occurrenceDate = fireDate.plusDays(days);
            if (occursOn(reminder, occurrenceDate)) {
                return Optional.of(new Occurrence(reminder.getId(), occurrenceDate, days));
            }
        }
        return Optional.empty();
    }

    private DayOfWeek weeklyAnchor(Reminder reminder) {
        return reminder.getDayOfWeek() == null ? DayOfWeek.MONDAY : reminder.getDayOfWeek();
    }

    private boolean matchesDayOfMonth(Integer dayOfMonth, LocalDate date) {
        if (dayOfMonth == null) {
            return false;
        }
        return date.getDayOfMonth() == Math.min(dayOfMonth, date.lengthOfMonth());
    }
}
