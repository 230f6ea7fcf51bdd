package com.billreminder.domain.enums;

public enum DispatchStatus {
    SENT,
    DUPLICATE,
    DEFERRED,
    FAILED_TRANSIENT,
    FAILED_PERMANENT,
    FAILED_STORE;

    public boolean isFailure() {
        return this == FAILED_TRANSIENT || this == FAILED_PERMANENT || this == FAILED_STORE;
    }
}
