package com.billreminder.service;

import com.billreminder.config.ReminderProperties;
import com.billreminder.domain.model.Reminder;
import com.billreminder.domain.model.User;
import com.billreminder.service.exception.ChannelException;
import com.billreminder.service.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Once a day tells every user with nothing due today (on-time or as an advance notice) that
 * there is nothing to pay. Nothing is logged; a missed or failed digest is not repeated.
 */
@Slf4j
@Service
public class DailyDigestService {

    private final Clock clock;
    private final ActiveWindowGate activeWindowGate;
    private final ReminderStore reminderStore;
    private final RecurrenceEvaluator recurrenceEvaluator;
    private final DueSetSelector dueSetSelector;
    private final NotificationChannel notificationChannel;
    private final ReminderMessageFormatter messageFormatter;
    private final boolean enabled;

    public DailyDigestService(Clock clock,
                              ActiveWindowGate activeWindowGate,
                              ReminderStore reminderStore,
                              RecurrenceEvaluator recurrenceEvaluator,
                              DueSetSelector dueSetSelector,
                              NotificationChannel notificationChannel,
                              ReminderMessageFormatter messageFormatter,
                              ReminderProperties properties) {
        this.clock = clock;
        this.activeWindowGate = activeWindowGate;
        this.reminderStore = reminderStore;
        this.recurrenceEvaluator = recurrenceEvaluator;
        this.dueSetSelector = dueSetSelector;
        this.notificationChannel = notificationChannel;
        this.messageFormatter = messageFormatter;
        this.enabled = properties.digest().enabled();
    }

    @Scheduled(cron = "${app.reminders.digest.cron:0 35 7 * * *}",
            zone = "${app.reminders.digest.zone:Asia/Ho_Chi_Minh}")
    public void runScheduledDigest() {
        if (!enabled) {
            return;
        }
        Instant now = clock.instant();
        runDigest(now, activeWindowGate.isOpen(now));
    }

    /**
     * @return ids of the users the status message was delivered to
     */
    public List<Long> runDigest(Instant now, boolean windowOpen) {
        if (!windowOpen) {
            log.debug("Skip daily digest: outside active window. now={}", now);
            return List.of();
        }

        List<User> users;
        Map<Long, List<Reminder>> remindersByUser;
        try {
            users = reminderStore.listUsers();
            remindersByUser = reminderStore.listActiveReminders().stream()
                    .collect(Collectors.groupingBy(Reminder::getUserId));
        } catch (StoreUnavailableException e) {
            log.error("Daily digest aborted: store unavailable. now={}, error={}", now, e.getMessage(), e);
            return List.of();
        }

        List<Long> notified = new ArrayList<>();
        for (User user : users) {
            List<Reminder> reminders = remindersByUser.getOrDefault(user.getId(), List.of());
            if (reminders.stream().anyMatch(reminder -> isDueToday(reminder, user, now))) {
                continue;
            }
            try {
                notificationChannel.send(user.getId(), messageFormatter.formatNothingDue());
                notified.add(user.getId());
            } catch (ChannelException e) {
                log.warn("Failed to send daily digest. userId={}, kind={}, error={}",
                        user.getId(), e.getKind(), e.getMessage());
            }
        }
        log.info("Daily digest finished. users={}, notified={}", users.size(), notified.size());
        return notified;
    }

    boolean isDueToday(Reminder reminder, User owner, Instant now) {
        ZoneId zone = dueSetSelector.resolveZone(reminder, owner);
        LocalDate today = now.atZone(zone).toLocalDate();
        if (recurrenceEvaluator.occursOn(reminder, today)) {
            return true;
        }
        if (reminder.getFrequency() == null || !reminder.getFrequency().supportsAdvanceNotice()) {
            return false;
        }
        int lead = Math.min(RecurrenceEvaluator.MAX_ADVANCE_NOTICE_DAYS, Math.max(0, reminder.getAdvanceNoticeDays()));
        for (int days = 1; days <= lead; days++) {
            if (recurrenceEvaluator.occursOn(reminder, today.plusDays(days))) {
                return true;
            }
        }
        return false;
    }
}
