package com.billreminder.service;

import com.billreminder.config.ReminderProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks transient send failures per occurrence key and spaces out the retries that later
 * cycles make. State is in memory only; a restart starts every occurrence afresh.
 */
@Component
public class TransientRetryPolicy {

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final Map<String, RetryState> states = new ConcurrentHashMap<>();

    @Autowired
    public TransientRetryPolicy(ReminderProperties properties) {
        this(properties.retry().maxAttempts(), properties.retry().initialBackoff(), properties.retry().maxBackoff());
    }

    public TransientRetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
    }

    public boolean mayAttempt(String occurrenceKey, Instant now) {
        RetryState state = states.get(occurrenceKey);
        if (state == null) {
            return true;
        }
        return state.attempts() < maxAttempts && !now.isBefore(state.nextAttemptAt());
    }

    public boolean isExhausted(String occurrenceKey) {
        RetryState state = states.get(occurrenceKey);
        return state != null && state.attempts() >= maxAttempts;
    }

    public RetryState recordFailure(String occurrenceKey, Instant now) {
        return states.compute(occurrenceKey, (key, current) -> {
            int attempts = current == null ? 1 : current.attempts() + 1;
            return new RetryState(attempts, now.plus(backoff(attempts)));
        });
    }

    public void clear(String occurrenceKey) {
        states.remove(occurrenceKey);
    }

    /**
     * Drops state for occurrences that are no longer due.
     */
    public void retainOnly(Collection<String> dueOccurrenceKeys) {
        Set<String> keep = Set.copyOf(dueOccurrenceKeys);
        states.keySet().removeIf(key -> !keep.contains(key));
    }

    Duration backoff(int attempts) {
        int exponent = Math.min(16, Math.max(0, attempts - 1));
        Duration candidate = initialBackoff.multipliedBy(1L << exponent);
        return candidate.compareTo(maxBackoff) > 0 ? maxBackoff : candidate;
    }

    public record RetryState(int attempts, Instant nextAttemptAt) {
    }
}
