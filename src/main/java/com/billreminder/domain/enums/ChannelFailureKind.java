package com.billreminder.domain.enums;

public enum ChannelFailureKind {
    TRANSIENT,
    PERMANENT
}
