package com.billreminder.service;

import com.billreminder.domain.enums.DispatchStatus;

public record DispatchResult(Long reminderId, String occurrenceKey, DispatchStatus status, String detail) {

    static DispatchResult of(DueReminder candidate, DispatchStatus status, String detail) {
        return new DispatchResult(candidate.reminderId(), candidate.occurrenceKey(), status, detail);
    }
}
