package com.billreminder.service.exception;

public class ReminderValidationException extends RuntimeException {

    public ReminderValidationException(String message) {
        super(message);
    }
}
