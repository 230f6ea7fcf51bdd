package com.billreminder.domain.enums;

public enum Frequency {
    ONCE,
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * Advance notices are separate log entries, so a one-time reminder never gets them.
     */
    public boolean supportsAdvanceNotice() {
        return this == MONTHLY;
    }
}
