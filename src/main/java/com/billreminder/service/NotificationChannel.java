package com.billreminder.service;

/**
 * Outbound messaging to a user. Failures are reported as
 * {@link com.billreminder.service.exception.ChannelException}, classified transient or permanent.
 */
public interface NotificationChannel {

    void send(Long userId, String text);
}
