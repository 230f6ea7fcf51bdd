package com.billreminder.util;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Optional;

public final class ZoneIds {

    private ZoneIds() {
    }

    public static Optional<ZoneId> parse(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(value.trim()));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }
}
