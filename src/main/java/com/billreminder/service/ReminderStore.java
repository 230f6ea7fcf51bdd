package com.billreminder.service;

import com.billreminder.domain.model.Reminder;
import com.billreminder.domain.model.User;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

/**
 * Durable reminder table plus the append-only dispatch log.
 * Read and write failures surface as {@link com.billreminder.service.exception.StoreUnavailableException}.
 */
public interface ReminderStore {

    List<User> listUsers();

    /**
     * Active reminders ordered by ascending id.
     */
    List<Reminder> listActiveReminders();

    Set<String> listOccurrenceKeys(Long reminderId);

    boolean hasOccurrence(Long reminderId, String occurrenceKey);

    /**
     * Appends a log entry; throws {@link com.billreminder.service.exception.DuplicateOccurrenceException}
     * when the same occurrence of the reminder is already logged.
     */
    void appendLog(Long reminderId, String occurrenceKey, OffsetDateTime sentAt, Long userId);

    /**
     * Null arguments leave the corresponding field unchanged.
     */
    void updateReminder(Long reminderId, OffsetDateTime lastSentAt, Boolean active);
}
