package com.billreminder.service.exception;

import com.billreminder.domain.enums.ChannelFailureKind;
import lombok.Getter;

@Getter
public class ChannelException extends RuntimeException {

    private final ChannelFailureKind kind;

    public ChannelException(ChannelFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isPermanent() {
        return kind == ChannelFailureKind.PERMANENT;
    }
}
