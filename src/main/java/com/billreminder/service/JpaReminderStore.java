package com.billreminder.service;

import com.billreminder.domain.model.Reminder;
import com.billreminder.domain.model.ReminderDispatchLog;
import com.billreminder.domain.model.User;
import com.billreminder.repository.ReminderDispatchLogRepository;
import com.billreminder.repository.ReminderRepository;
import com.billreminder.repository.UserRepository;
import com.billreminder.service.exception.DuplicateOccurrenceException;
import com.billreminder.service.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaReminderStore implements ReminderStore {

    private final UserRepository userRepository;
    private final ReminderRepository reminderRepository;
    private final ReminderDispatchLogRepository dispatchLogRepository;

    @Override
    public List<User> listUsers() {
        try {
            return userRepository.findAll();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to list users", e);
        }
    }

    @Override
    public List<Reminder> listActiveReminders() {
        try {
            return reminderRepository.findByActiveTrueOrderByIdAsc();
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to list active reminders", e);
        }
    }

    @Override
    public Set<String> listOccurrenceKeys(Long reminderId) {
        try {
            return new HashSet<>(dispatchLogRepository.findOccurrenceKeysByReminderId(reminderId));
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read dispatch log for reminder " + reminderId, e);
        }
    }

    @Override
    public boolean hasOccurrence(Long reminderId, String occurrenceKey) {
        try {
            return dispatchLogRepository.existsByReminderIdAndOccurrenceKey(reminderId, occurrenceKey);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to read dispatch log for reminder " + reminderId, e);
        }
    }

    @Override
    public void appendLog(Long reminderId, String occurrenceKey, OffsetDateTime sentAt, Long userId) {
        try {
            dispatchLogRepository.saveAndFlush(new ReminderDispatchLog(reminderId, occurrenceKey, userId, sentAt));
            log.debug("Dispatch log appended. reminderId={}, occurrence={}", reminderId, occurrenceKey);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateOccurrenceException(reminderId, occurrenceKey, e);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to append dispatch log for reminder " + reminderId, e);
        }
    }

    @Override
    public void updateReminder(Long reminderId, OffsetDateTime lastSentAt, Boolean active) {
        try {
            Optional<Reminder> found = reminderRepository.findById(reminderId);
            if (found.isEmpty()) {
                log.warn("Skip reminder update: reminder {} no longer exists", reminderId);
                return;
            }
            Reminder reminder = found.get();
            reminder.recordSent(lastSentAt);
            if (active != null) {
                reminder.setActive(active);
            }
            reminderRepository.save(reminder);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Failed to update reminder " + reminderId, e);
        }
    }
}
