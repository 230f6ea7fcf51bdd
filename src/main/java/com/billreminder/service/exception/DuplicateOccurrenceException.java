package com.billreminder.service.exception;

import lombok.Getter;

@Getter
public class DuplicateOccurrenceException extends RuntimeException {

    private final Long reminderId;
    private final String occurrenceKey;

    public DuplicateOccurrenceException(Long reminderId, String occurrenceKey, Throwable cause) {
        super("Occurrence already logged. reminderId=" + reminderId + ", occurrence=" + occurrenceKey, cause);
        this.reminderId = reminderId;
        this.occurrenceKey = occurrenceKey;
    }
}
