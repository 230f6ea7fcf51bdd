package com.billreminder.service;

import com.billreminder.config.ReminderProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Coarse on/off switch for reminder cycles. Disabled means always open; a window whose end is
 * before its start wraps past midnight.
 */
@Slf4j
@Component
public class ActiveWindowGate {

    private final ReminderProperties.Window window;
    private final ZoneId zone;

    public ActiveWindowGate(ReminderProperties properties) {
        this.window = properties.window();
        this.zone = ZoneId.of(window.zone());
        if (window.enabled()) {
            log.info("Reminder cycles limited to {}-{} ({})", window.start(), window.end(), zone);
        }
    }

    public boolean isOpen(Instant now) {
        if (!window.enabled()) {
            return true;
        }
        LocalTime local = now.atZone(zone).toLocalTime();
        LocalTime start = window.start();
        LocalTime end = window.end();
        if (start.isBefore(end)) {
            return !local.isBefore(start) && local.isBefore(end);
        }
        return !local.isBefore(start) || local.isBefore(end);
    }
}
