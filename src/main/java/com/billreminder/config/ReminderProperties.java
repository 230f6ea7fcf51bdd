package com.billreminder.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;

@Validated
@ConfigurationProperties(prefix = "app.reminders")
public record ReminderProperties(
        @DefaultValue("Asia/Ho_Chi_Minh") @NotBlank String defaultTimezone,
        @DefaultValue("15000") @Min(1000) long cycleIntervalMs,
        @DefaultValue("PT1M") @NotNull Duration matchWindow,
        @DefaultValue("4") @Min(1) int dispatchThreads,
        @DefaultValue("100") @Min(1) int dispatchQueueCapacity,
        @DefaultValue("2") @Min(0) @Max(2) int defaultAdvanceNoticeDays,
        @DefaultValue @Valid Retry retry,
        @DefaultValue @Valid Window window,
        @DefaultValue @Valid Digest digest
) {

    public ReminderProperties {
        if (matchWindow.compareTo(Duration.ofMinutes(1)) < 0 || matchWindow.compareTo(Duration.ofHours(12)) > 0) {
            throw new IllegalArgumentException("app.reminders.match-window must be between PT1M and PT12H: " + matchWindow);
        }
    }

    public ZoneId defaultZone() {
        return ZoneId.of(defaultTimezone);
    }

    public record Retry(
            @DefaultValue("5") @Min(1) int maxAttempts,
            @DefaultValue("PT30S") @NotNull Duration initialBackoff,
            @DefaultValue("PT5M") @NotNull Duration maxBackoff
    ) {
    }

    public record Window(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("07:30") @NotNull LocalTime start,
            @DefaultValue("07:40") @NotNull LocalTime end,
            @DefaultValue("Asia/Ho_Chi_Minh") @NotBlank String zone
    ) {
    }

    /**
     * Daily "nothing due" status message. The trigger itself is {@code cron} in {@code zone}.
     */
    public record Digest(
            @DefaultValue("true") boolean enabled,
            @DefaultValue("0 35 7 * * *") @NotBlank String cron,
            @DefaultValue("Asia/Ho_Chi_Minh") @NotBlank String zone
    ) {
    }
}
