package com.billreminder.controller;

import com.billreminder.domain.enums.Frequency;
import com.billreminder.domain.model.Reminder;
import com.billreminder.domain.model.ReminderDispatchLog;
import com.billreminder.domain.model.User;
import com.billreminder.dto.ReminderCreateRequest;
import com.billreminder.service.ReminderService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;

@RestController
@RequiredArgsConstructor
@RequestMapping("/api/users/{userId}")
public class ReminderController {

    private final ReminderService reminderService;

    @PutMapping
    public ResponseEntity<UserDto> register(@PathVariable Long userId, @RequestBody(required = false) UserRegisterRequest request) {
        User user = reminderService.registerUser(userId, request == null ? null : request.name());
        return ResponseEntity.ok(UserDto.from(user));
    }

    @PutMapping("/timezone")
    public ResponseEntity<UserDto> setTimezone(@PathVariable Long userId, @RequestBody TimezoneRequest request) {
        User user = reminderService.setTimezone(userId, request.timezone());
        return ResponseEntity.ok(UserDto.from(user));
    }

    @GetMapping("/reminders")
    public ResponseEntity<List<ReminderDto>> list(@PathVariable Long userId) {
        List<ReminderDto> reminders = reminderService.listReminders(userId)
                .stream()
                .map(ReminderDto::from)
                .toList();
        return ResponseEntity.ok(reminders);
    }

    @PostMapping("/reminders")
    public ResponseEntity<ReminderDto> create(@PathVariable Long userId, @RequestBody ReminderCreateRequest request) {
        Reminder reminder = reminderService.createReminder(userId, request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ReminderDto.from(reminder));
    }

    @PostMapping("/reminders/{reminderId}/toggle")
    public ResponseEntity<ReminderDto> toggle(@PathVariable Long userId, @PathVariable Long reminderId) {
        return ResponseEntity.ok(ReminderDto.from(reminderService.toggleReminder(userId, reminderId)));
    }

    @DeleteMapping("/reminders/{reminderId}")
    public ResponseEntity<Void> delete(@PathVariable Long userId, @PathVariable Long reminderId) {
        reminderService.deleteReminder(userId, reminderId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/reminders/{reminderId}/history")
    public ResponseEntity<List<LogEntryDto>> history(@PathVariable Long userId, @PathVariable Long reminderId) {
        List<LogEntryDto> entries = reminderService.history(userId, reminderId)
                .stream()
                .map(LogEntryDto::from)
                .toList();
        return ResponseEntity.ok(entries);
    }

    public record UserRegisterRequest(String name) {
    }

    public record TimezoneRequest(String timezone) {
    }

    public record UserDto(Long id, String name, String timezone, OffsetDateTime createdAt) {
        public static UserDto from(User user) {
            return new UserDto(user.getId(), user.getName(), user.getTimezone(), user.getCreatedAt());
        }
    }

    public record ReminderDto(
            Long id,
            String text,
            Frequency frequency,
            LocalTime time,
            Integer dayOfMonth,
            DayOfWeek dayOfWeek,
            LocalDate dueDate,
            String timezone,
            int advanceNoticeDays,
            boolean active,
            OffsetDateTime createdAt,
            OffsetDateTime lastSentAt
    ) {
        public static ReminderDto from(Reminder reminder) {
            return new ReminderDto(
                    reminder.getId(),
                    reminder.getText(),
                    reminder.getFrequency(),
                    reminder.getRemindAt(),
                    reminder.getDayOfMonth(),
                    reminder.getDayOfWeek(),
                    reminder.getDueDate(),
                    reminder.getTimezone(),
                    reminder.getAdvanceNoticeDays(),
                    reminder.isActive(),
                    reminder.getCreatedAt(),
                    reminder.getLastSentAt()
            );
        }
    }

    public record LogEntryDto(String occurrence, OffsetDateTime sentAt) {
        public static LogEntryDto from(ReminderDispatchLog entry) {
            return new LogEntryDto(entry.getOccurrenceKey(), entry.getSentAt());
        }
    }
}
