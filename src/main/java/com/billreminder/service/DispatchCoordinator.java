package com.billreminder.service;

import com.billreminder.domain.enums.DispatchStatus;
import com.billreminder.domain.enums.Frequency;
import com.billreminder.domain.model.Reminder;
import com.billreminder.service.exception.ChannelException;
import com.billreminder.service.exception.DuplicateOccurrenceException;
import com.billreminder.service.exception.StoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sends due occurrences and records them in the dispatch log.
 * <p>
 * Each candidate runs on the dispatch executor and fails on its own. Within one process the
 * log re-check, send and append for an occurrence key happen under one lock; across processes
 * the store's conditional append keeps a single log entry. {@link #dispatch} returns only after
 * every candidate has finished, so the next cycle always sees this cycle's appends.
 */
@Slf4j
@Service
public class DispatchCoordinator {

    private final ReminderStore reminderStore;
    private final NotificationChannel notificationChannel;
    private final ReminderMessageFormatter messageFormatter;
    private final TransientRetryPolicy retryPolicy;
    private final Executor dispatchExecutor;
    private final ConcurrentMap<String, OccurrenceLock> occurrenceLocks = new ConcurrentHashMap<>();

    public DispatchCoordinator(ReminderStore reminderStore,
                               NotificationChannel notificationChannel,
                               ReminderMessageFormatter messageFormatter,
                               TransientRetryPolicy retryPolicy,
                               @Qualifier("reminderDispatchExecutor") Executor dispatchExecutor) {
        this.reminderStore = reminderStore;
        this.notificationChannel = notificationChannel;
        this.messageFormatter = messageFormatter;
        this.retryPolicy = retryPolicy;
        this.dispatchExecutor = dispatchExecutor;
    }

    public DispatchReport dispatch(List<DueReminder> candidates, Instant now) {
        if (candidates.isEmpty()) {
            return DispatchReport.empty();
        }
        List<CompletableFuture<DispatchResult>> futures = candidates.stream()
                .map(candidate -> submit(candidate, now))
                .toList();
        return DispatchReport.of(futures.stream().map(CompletableFuture::join).toList());
    }

    private CompletableFuture<DispatchResult> submit(DueReminder candidate, Instant now) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> dispatchOne(candidate, now), dispatchExecutor)
                    .exceptionally(e -> {
                        log.error("Unexpected error dispatching reminder {}. occurrence={}, error={}",
                                candidate.reminderId(), candidate.occurrenceKey(), e.getMessage(), e);
                        return DispatchResult.of(candidate, DispatchStatus.FAILED_TRANSIENT, e.getMessage());
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Dispatch pool rejected reminder {}. occurrence={}, error={}",
                    candidate.reminderId(), candidate.occurrenceKey(), e.getMessage());
            return CompletableFuture.completedFuture(
                    DispatchResult.of(candidate, DispatchStatus.FAILED_TRANSIENT, "dispatch pool rejected task"));
        }
    }

    DispatchResult dispatchOne(DueReminder candidate, Instant now) {
        String key = candidate.occurrenceKey();
        if (!retryPolicy.mayAttempt(key, now)) {
            String reason = retryPolicy.isExhausted(key) ? "retry attempts exhausted" : "waiting for retry backoff";
            log.debug("Defer reminder {}. occurrence={}, reason={}", candidate.reminderId(), key, reason);
            return DispatchResult.of(candidate, DispatchStatus.DEFERRED, reason);
        }

        OccurrenceLock lock = acquire(key);
        try {
            if (reminderStore.hasOccurrence(candidate.reminderId(), key)) {
                return DispatchResult.of(candidate, DispatchStatus.DUPLICATE, "already logged");
            }
            return sendAndRecord(candidate, now);
        } catch (StoreUnavailableException e) {
            log.error("Store unavailable while dispatching reminder {}. occurrence={}, error={}",
                    candidate.reminderId(), key, e.getMessage(), e);
            return DispatchResult.of(candidate, DispatchStatus.FAILED_STORE, e.getMessage());
        } finally {
            release(key, lock);
        }
    }

    private DispatchResult sendAndRecord(DueReminder candidate, Instant now) {
        Reminder reminder = candidate.reminder();
        Occurrence occurrence = candidate.occurrence();
        String key = occurrence.key();

        try {
            notificationChannel.send(reminder.getUserId(), messageFormatter.format(reminder, occurrence));
        } catch (ChannelException e) {
            return handleChannelFailure(candidate, e, now);
        }
        retryPolicy.clear(key);

        OffsetDateTime sentAt = now.atOffset(ZoneOffset.UTC);
        try {
            reminderStore.appendLog(reminder.getId(), key, sentAt, reminder.getUserId());
        } catch (DuplicateOccurrenceException e) {
            log.info("Occurrence was logged by another dispatcher. reminderId={}, occurrence={}", reminder.getId(), key);
            return DispatchResult.of(candidate, DispatchStatus.DUPLICATE, "logged concurrently");
        } catch (StoreUnavailableException e) {
            log.error("Reminder {} was sent but its occurrence {} could not be logged", reminder.getId(), key);
            throw e;
        }

        boolean deactivate = reminder.getFrequency() == Frequency.ONCE && occurrence.isOnTime();
        try {
            reminderStore.updateReminder(reminder.getId(), sentAt, deactivate ? Boolean.FALSE : null);
        } catch (StoreUnavailableException e) {
            // the log entry already guards this occurrence
            log.error("Failed to update reminder {} after dispatch. occurrence={}, error={}",
                    reminder.getId(), key, e.getMessage(), e);
        }
        log.info("Reminder dispatched. reminderId={}, userId={}, occurrence={}, deactivated={}",
                reminder.getId(), reminder.getUserId(), key, deactivate);
        return DispatchResult.of(candidate, DispatchStatus.SENT, null);
    }

    private DispatchResult handleChannelFailure(DueReminder candidate, ChannelException e, Instant now) {
        Reminder reminder = candidate.reminder();
        String key = candidate.occurrenceKey();
        if (e.isPermanent()) {
            retryPolicy.clear(key);
            log.warn("User unreachable, deactivating reminder. reminderId={}, userId={}, error={}",
                    reminder.getId(), reminder.getUserId(), e.getMessage());
            try {
                reminderStore.updateReminder(reminder.getId(), null, Boolean.FALSE);
            } catch (StoreUnavailableException storeError) {
                log.error("Failed to deactivate reminder {}. error={}", reminder.getId(), storeError.getMessage(), storeError);
            }
            return DispatchResult.of(candidate, DispatchStatus.FAILED_PERMANENT, e.getMessage());
        }

        TransientRetryPolicy.RetryState state = retryPolicy.recordFailure(key, now);
        log.warn("Transient send failure. reminderId={}, occurrence={}, attempt={}, nextAttemptAt={}, error={}",
                reminder.getId(), key, state.attempts(), state.nextAttemptAt(), e.getMessage());
        return DispatchResult.of(candidate, DispatchStatus.FAILED_TRANSIENT, e.getMessage());
    }

    private OccurrenceLock acquire(String key) {
        OccurrenceLock lock = occurrenceLocks.compute(key, (k, current) -> {
            OccurrenceLock held = current == null ? new OccurrenceLock() : current;
            held.holders++;
            return held;
        });
        lock.mutex.lock();
        return lock;
    }

    private void release(String key, OccurrenceLock lock) {
        lock.mutex.unlock();
        occurrenceLocks.computeIfPresent(key, (k, current) -> --current.holders == 0 ? null : current);
    }

    private static final class OccurrenceLock {
        private final ReentrantLock mutex = new ReentrantLock();
        // guarded by the map's per-key compute
        private int holders;
    }
}
