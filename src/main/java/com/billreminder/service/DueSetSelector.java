package com.billreminder.service;

import com.billreminder.config.ReminderProperties;
import com.billreminder.domain.model.Reminder;
import com.billreminder.domain.model.User;
import com.billreminder.service.exception.StoreUnavailableException;
import com.billreminder.util.ZoneIds;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
public class DueSetSelector {

    private final ReminderStore reminderStore;
    private final RecurrenceEvaluator recurrenceEvaluator;
    private final ZoneId defaultZone;

    public DueSetSelector(ReminderStore reminderStore,
                          RecurrenceEvaluator recurrenceEvaluator,
                          ReminderProperties properties) {
        this.reminderStore = reminderStore;
        this.recurrenceEvaluator = recurrenceEvaluator;
        this.defaultZone = properties.defaultZone();
    }

    /**
     * Reads users and active reminders from the store and returns the occurrences due at {@code now}
     * that are not logged yet. Throws {@link StoreUnavailableException} rather than returning a partial set.
     */
    public List<DueReminder> selectDue(Instant now) {
        List<User> users = reminderStore.listUsers();
        List<Reminder> reminders = reminderStore.listActiveReminders();
        Map<Long, User> usersById = users.stream()
                .collect(Collectors.toMap(User::getId, Function.identity(), (first, second) -> first));
        return select(reminders, usersById, now);
    }

    public List<DueReminder> select(List<Reminder> reminders, Map<Long, User> usersById, Instant now) {
        List<DueReminder> due = new ArrayList<>();
        for (Reminder reminder : reminders) {
            if (!reminder.isActive()) {
                continue;
            }
            ZoneId zone = resolveZone(reminder, usersById.get(reminder.getUserId()));
            Optional<Occurrence> occurrence = recurrenceEvaluator.evaluate(reminder, zone, now);
            if (occurrence.isEmpty()) {
                continue;
            }
            if (reminderStore.listOccurrenceKeys(reminder.getId()).contains(occurrence.get().key())) {
                log.debug("Occurrence already logged. reminderId={}, occurrence={}",
                        reminder.getId(), occurrence.get().key());
                continue;
            }
            due.add(new DueReminder(reminder, occurrence.get(), zone));
        }
        due.sort(Comparator.comparing(DueReminder::reminderId));
        return due;
    }

    ZoneId resolveZone(Reminder reminder, User owner) {
        String zoneId = reminder.getTimezone();
        if (isBlank(zoneId) && owner != null) {
            zoneId = owner.getTimezone();
        }
        if (isBlank(zoneId)) {
            return defaultZone;
        }
        Optional<ZoneId> zone = ZoneIds.parse(zoneId);
        if (zone.isEmpty()) {
            log.warn("Unknown timezone '{}' for reminder {}, using {}", zoneId, reminder.getId(), defaultZone);
        }
        return zone.orElse(defaultZone);
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
