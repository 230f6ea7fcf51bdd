package com.billreminder.service;

import com.billreminder.config.ReminderProperties;
import com.billreminder.domain.enums.Frequency;
import com.billreminder.domain.model.Reminder;
import com.billreminder.domain.model.ReminderDispatchLog;
import com.billreminder.domain.model.User;
import com.billreminder.dto.ReminderCreateRequest;
import com.billreminder.repository.ReminderDispatchLogRepository;
import com.billreminder.repository.ReminderRepository;
import com.billreminder.repository.UserRepository;
import com.billreminder.service.exception.ReminderNotFoundException;
import com.billreminder.service.exception.ReminderValidationException;
import com.billreminder.util.ZoneIds;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderService {

    private static final DateTimeFormatter TIME_INPUT_FMT = DateTimeFormatter.ofPattern("H:mm");

    private final UserRepository userRepository;
    private final ReminderRepository reminderRepository;
    private final ReminderDispatchLogRepository dispatchLogRepository;
    private final ReminderProperties properties;
    private final Clock clock;

    @Transactional
    public User registerUser(Long userId, String name) {
        User user = userRepository.findById(userId)
                .orElseGet(() -> {
                    log.info("Create new user. userId={}", userId);
                    return new User(userId, name, properties.defaultTimezone());
                });
        if (name != null && !name.isBlank()) {
            user.setName(name.trim());
        }
        return userRepository.save(user);
    }

    @Transactional
    public User setTimezone(Long userId, String timezone) {
        User user = requireUser(userId);
        ZoneId zone = ZoneIds.parse(timezone)
                .orElseThrow(() -> new ReminderValidationException("Unknown timezone: " + timezone));
        user.setTimezone(zone.getId());
        log.info("Updated timezone. userId={}, timezone={}", userId, zone.getId());
        return userRepository.save(user);
    }

    @Transactional
    public Reminder createReminder(Long userId, ReminderCreateRequest request) {
        User user = requireUser(userId);
        if (request == null || request.text() == null || request.text().isBlank()) {
            throw new ReminderValidationException("Reminder text is required");
        }

        Reminder reminder = new Reminder();
        reminder.setUserId(user.getId());
        reminder.setText(request.text().trim());
        reminder.setFrequency(parseFrequency(request.frequency()));
        reminder.setRemindAt(parseTime(request.time()));
        reminder.setActive(true);

        if (request.timezone() != null && !request.timezone().isBlank()) {
            ZoneId zone = ZoneIds.parse(request.timezone())
                    .orElseThrow(() -> new ReminderValidationException("Unknown timezone: " + request.timezone()));
            reminder.setTimezone(zone.getId());
        }
        ZoneId zone = ZoneIds.parse(reminder.getTimezone())
                .or(() -> ZoneIds.parse(user.getTimezone()))
                .orElse(properties.defaultZone());

        applyAnchor(reminder, request, zone);
        reminder.setAdvanceNoticeDays(resolveAdvanceNoticeDays(reminder.getFrequency(), request.advanceNoticeDays()));

        Reminder saved = reminderRepository.save(reminder);
        log.info("Created reminder. reminderId={}, userId={}, frequency={}, time={}",
                saved.getId(), userId, saved.getFrequency(), saved.getRemindAt());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<Reminder> listReminders(Long userId) {
        requireUser(userId);
        return reminderRepository.findByUserIdOrderByIdAsc(userId);
    }

    @Transactional
    public Reminder toggleReminder(Long userId, Long reminderId) {
        Reminder reminder = requireOwnedReminder(userId, reminderId);
        reminder.setActive(!reminder.isActive());
        log.info("Toggled reminder. reminderId={}, active={}", reminderId, reminder.isActive());
        return reminderRepository.save(reminder);
    }

    @Transactional
    public void deleteReminder(Long userId, Long reminderId) {
        Reminder reminder = requireOwnedReminder(userId, reminderId);
        reminderRepository.delete(reminder);
        log.info("Deleted reminder. reminderId={}, userId={}", reminderId, userId);
    }

    @Transactional(readOnly = true)
    public List<ReminderDispatchLog> history(Long userId, Long reminderId) {
        requireOwnedReminder(userId, reminderId);
        return dispatchLogRepository.findByReminderIdOrderBySentAtDesc(reminderId);
    }

    /**
     * First date on {@code dayOfMonth} (clamped to the month length) whose {@code time} is still
     * ahead of {@code now} in {@code zone}: this month, otherwise next month.
     */
    static LocalDate resolveOnceDueDate(int dayOfMonth, LocalTime time, ZoneId zone, Instant now) {
        ZonedDateTime nowLocal = now.atZone(zone);
        YearMonth month = YearMonth.from(nowLocal);
        LocalDate candidate = month.atDay(Math.min(dayOfMonth, month.lengthOfMonth()));
        if (ZonedDateTime.of(candidate, time, zone).isAfter(nowLocal)) {
            return candidate;
        }
        YearMonth next = month.plusMonths(1);
        return next.atDay(Math.min(dayOfMonth, next.lengthOfMonth()));
    }

    private void applyAnchor(Reminder reminder, ReminderCreateRequest request, ZoneId zone) {
        switch (reminder.getFrequency()) {
            case DAILY -> {
            }
            case WEEKLY -> reminder.setDayOfWeek(parseDayOfWeek(request.dayOfWeek()));
            case MONTHLY -> reminder.setDayOfMonth(requireDayOfMonth(request.dayOfMonth()));
            case ONCE -> {
                if (request.dueDate() != null) {
                    if (!ZonedDateTime.of(request.dueDate(), reminder.getRemindAt(), zone).toInstant().isAfter(clock.instant())) {
                        throw new ReminderValidationException("dueDate must be in the future: " + request.dueDate());
                    }
                    reminder.setDueDate(request.dueDate());
                } else {
                    int day = requireDayOfMonth(request.dayOfMonth());
                    reminder.setDayOfMonth(day);
                    reminder.setDueDate(resolveOnceDueDate(day, reminder.getRemindAt(), zone, clock.instant()));
                }
            }
        }
    }

    private int resolveAdvanceNoticeDays(Frequency frequency, Integer requested) {
        if (!frequency.supportsAdvanceNotice()) {
            return 0;
        }
        int days = requested == null ? properties.defaultAdvanceNoticeDays() : requested;
        if (days < 0 || days > RecurrenceEvaluator.MAX_ADVANCE_NOTICE_DAYS) {
            throw new ReminderValidationException("advanceNoticeDays must be between 0 and "
                    + RecurrenceEvaluator.MAX_ADVANCE_NOTICE_DAYS);
        }
        return days;
    }

    private Frequency parseFrequency(String value) {
        if (value == null || value.isBlank()) {
            throw new ReminderValidationException("Frequency is required");
        }
        try {
            return Frequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ReminderValidationException("Unknown frequency: " + value);
        }
    }

    private LocalTime parseTime(String value) {
        if (value == null || value.isBlank()) {
            throw new ReminderValidationException("Time is required (HH:mm)");
        }
        try {
            return LocalTime.parse(value.trim(), TIME_INPUT_FMT);
        } catch (DateTimeParseException e) {
            throw new ReminderValidationException("Invalid time, expected HH:mm: " + value);
        }
    }

    private DayOfWeek parseDayOfWeek(String value) {
        if (value == null || value.isBlank()) {
            return DayOfWeek.MONDAY;
        }
        try {
            return DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ReminderValidationException("Unknown day of week: " + value);
        }
    }

    private int requireDayOfMonth(Integer value) {
        if (value == null || value < 1 || value > 31) {
            throw new ReminderValidationException("dayOfMonth must be between 1 and 31");
        }
        return value;
    }

    private User requireUser(Long userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ReminderNotFoundException("User not found: " + userId));
    }

    private Reminder requireOwnedReminder(Long userId, Long reminderId) {
        return reminderRepository.findByIdAndUserId(reminderId, userId)
                .orElseThrow(() -> new ReminderNotFoundException("Reminder not found: " + reminderId));
    }
}
