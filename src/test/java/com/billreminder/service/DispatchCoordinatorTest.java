package com.billreminder.service;

import com.billreminder.domain.enums.ChannelFailureKind;
import com.billreminder.domain.enums.DispatchStatus;
import com.billreminder.domain.enums.Frequency;
import com.billreminder.domain.model.Reminder;
import com.billreminder.service.exception.ChannelException;
import com.billreminder.service.exception.DuplicateOccurrenceException;
import com.billreminder.service.exception.StoreUnavailableException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static com.billreminder.ReminderTestData.daily;
import static com.billreminder.ReminderTestData.reminder;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("DispatchCoordinator Tests")
class DispatchCoordinatorTest {

    private static final ZoneId SAIGON = ZoneId.of("Asia/Ho_Chi_Minh");
    private static final Instant NOW = Instant.parse("2025-03-10T00:35:00Z");
    private static final OffsetDateTime SENT_AT = NOW.atOffset(ZoneOffset.UTC);

    @Mock
    private ReminderStore reminderStore;

    @Mock
    private NotificationChannel notificationChannel;

    private TransientRetryPolicy retryPolicy;
    private DispatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        retryPolicy = new TransientRetryPolicy(3, Duration.ofSeconds(30), Duration.ofMinutes(5));
        coordinator = new DispatchCoordinator(reminderStore, notificationChannel,
                new ReminderMessageFormatter(), retryPolicy, Runnable::run);
    }

    @Nested
    @DisplayName("Successful sends")
    class SuccessfulSends {

        @Test
        @DisplayName("Should append the log entry and then move last sent forward")
        void shouldLogThenUpdate() {
            DueReminder candidate = due(daily(1, 101, "07:35"), 0);

            DispatchReport report = coordinator.dispatch(List.of(candidate), NOW);

            assertThat(report.sent()).extracting(DispatchResult::occurrenceKey).containsExactly("1@2025-03-10");
            assertThat(report.failed()).isEmpty();
            verify(notificationChannel).send(eq(101L), anyString());
            verify(reminderStore).appendLog(1L, "1@2025-03-10", SENT_AT, 101L);
            verify(reminderStore).updateReminder(eq(1L), eq(SENT_AT), isNull());
        }

        @Test
        @DisplayName("Should deactivate a one-time reminder after its on-time send")
        void shouldDeactivateOnceReminder() {
            Reminder once = reminder(4, 104, Frequency.ONCE, "07:35");
            once.setDueDate(LocalDate.of(2025, 3, 10));

            coordinator.dispatch(List.of(due(once, 0)), NOW);

            verify(reminderStore).updateReminder(4L, SENT_AT, Boolean.FALSE);
        }

        @Test
        @DisplayName("Should keep a one-time reminder active after an advance notice")
        void shouldKeepOnceReminderActiveAfterNotice() {
            Reminder once = reminder(4, 104, Frequency.ONCE, "07:35");
            once.setDueDate(LocalDate.of(2025, 3, 11));

            coordinator.dispatch(List.of(due(once, 1)), NOW);

            verify(reminderStore).appendLog(4L, "4@2025-03-11-T1", SENT_AT, 104L);
            verify(reminderStore).updateReminder(eq(4L), eq(SENT_AT), isNull());
        }

        @Test
        @DisplayName("Should still report a send when the field update fails")
        void shouldReportSentWhenFieldUpdateFails() {
            doThrow(new StoreUnavailableException("update failed", null))
                    .when(reminderStore).updateReminder(anyLong(), any(), any());

            DispatchReport report = coordinator.dispatch(List.of(due(daily(1, 101, "07:35"), 0)), NOW);

            assertThat(report.sent()).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Should isolate a transient failure in the middle of the batch")
        void shouldIsolateTransientFailure() {
            lenient().doThrow(new ChannelException(ChannelFailureKind.TRANSIENT, "timeout", null))
                    .when(notificationChannel).send(eq(102L), anyString());

            DispatchReport report = coordinator.dispatch(List.of(
                    due(daily(1, 101, "07:35"), 0),
                    due(daily(2, 102, "07:35"), 0),
                    due(daily(3, 103, "07:35"), 0)), NOW);

            assertThat(report.sent()).extracting(DispatchResult::reminderId).containsExactly(1L, 3L);
            assertThat(report.failed()).singleElement()
                    .satisfies(result -> assertThat(result.status()).isEqualTo(DispatchStatus.FAILED_TRANSIENT));
            verify(reminderStore, never()).appendLog(eq(2L), anyString(), any(), anyLong());
            verify(reminderStore, never()).updateReminder(eq(2L), any(), any());
        }

        @Test
        @DisplayName("Should deactivate the reminder on a permanent failure")
        void shouldDeactivateOnPermanentFailure() {
            doThrow(new ChannelException(ChannelFailureKind.PERMANENT, "bot was blocked", null))
                    .when(notificationChannel).send(eq(101L), anyString());

            DispatchReport report = coordinator.dispatch(List.of(due(daily(1, 101, "07:35"), 0)), NOW);

            assertThat(report.failed()).extracting(DispatchResult::status).containsExactly(DispatchStatus.FAILED_PERMANENT);
            verify(reminderStore).updateReminder(1L, null, Boolean.FALSE);
            verify(reminderStore, never()).appendLog(anyLong(), anyString(), any(), anyLong());
        }

        @Test
        @DisplayName("Should treat a concurrent log entry as a benign duplicate")
        void shouldTreatDuplicateAppendAsBenign() {
            doThrow(new DuplicateOccurrenceException(1L, "1@2025-03-10", null))
                    .when(reminderStore).appendLog(anyLong(), anyString(), any(), anyLong());

            DispatchReport report = coordinator.dispatch(List.of(due(daily(1, 101, "07:35"), 0)), NOW);

            assertThat(report.skipped()).extracting(DispatchResult::status).containsExactly(DispatchStatus.DUPLICATE);
            verify(reminderStore, never()).updateReminder(anyLong(), any(), any());
        }

        @Test
        @DisplayName("Should not send when the occurrence is logged before the lock is taken")
        void shouldNotSendAlreadyLoggedOccurrence() {
            when(reminderStore.hasOccurrence(1L, "1@2025-03-10")).thenReturn(true);

            DispatchReport report = coordinator.dispatch(List.of(due(daily(1, 101, "07:35"), 0)), NOW);

            assertThat(report.skipped()).hasSize(1);
            verify(notificationChannel, never()).send(anyLong(), anyString());
        }

        @Test
        @DisplayName("Should report a task the dispatch pool rejects instead of waiting for it")
        void shouldReportRejectedTask() {
            DispatchCoordinator closing = new DispatchCoordinator(reminderStore, notificationChannel,
                    new ReminderMessageFormatter(), retryPolicy, task -> {
                        throw new RejectedExecutionException("pool shut down");
                    });

            DispatchReport report = closing.dispatch(List.of(due(daily(1, 101, "07:35"), 0)), NOW);

            assertThat(report.failed()).extracting(DispatchResult::status).containsExactly(DispatchStatus.FAILED_TRANSIENT);
            verify(notificationChannel, never()).send(anyLong(), anyString());
        }

        @Test
        @DisplayName("Should report a store failure on append")
        void shouldReportStoreFailureOnAppend() {
            doThrow(new StoreUnavailableException("log offline", null))
                    .when(reminderStore).appendLog(anyLong(), anyString(), any(), anyLong());

            DispatchReport report = coordinator.dispatch(List.of(due(daily(1, 101, "07:35"), 0)), NOW);

            assertThat(report.failed()).extracting(DispatchResult::status).containsExactly(DispatchStatus.FAILED_STORE);
        }
    }

    @Nested
    @DisplayName("Retry backoff")
    class RetryBackoff {

        @Test
        @DisplayName("Should defer a retry until the backoff has elapsed")
        void shouldDeferUntilBackoffElapsed() {
            DueReminder candidate = due(daily(1, 101, "07:35"), 0);
            doThrow(new ChannelException(ChannelFailureKind.TRANSIENT, "timeout", null))
                    .doNothing()
                    .when(notificationChannel).send(eq(101L), anyString());

            DispatchReport first = coordinator.dispatch(List.of(candidate), NOW);
            DispatchReport early = coordinator.dispatch(List.of(candidate), NOW.plusSeconds(10));
            DispatchReport retried = coordinator.dispatch(List.of(candidate), NOW.plusSeconds(30));

            assertThat(first.failed()).hasSize(1);
            assertThat(early.skipped()).extracting(DispatchResult::status).containsExactly(DispatchStatus.DEFERRED);
            assertThat(retried.sent()).hasSize(1);
            verify(notificationChannel, times(2)).send(eq(101L), anyString());
        }

        @Test
        @DisplayName("Should give up after the attempt limit")
        void shouldGiveUpAfterMaxAttempts() {
            DueReminder candidate = due(daily(1, 101, "07:35"), 0);
            doThrow(new ChannelException(ChannelFailureKind.TRANSIENT, "timeout", null))
                    .when(notificationChannel).send(eq(101L), anyString());

            Instant at = NOW;
            for (int i = 0; i < 3; i++) {
                coordinator.dispatch(List.of(candidate), at);
                at = at.plus(Duration.ofMinutes(10));
            }
            DispatchReport afterLimit = coordinator.dispatch(List.of(candidate), at);

            assertThat(retryPolicy.isExhausted("1@2025-03-10")).isTrue();
            assertThat(afterLimit.skipped()).singleElement()
                    .satisfies(result -> assertThat(result.detail()).isEqualTo("retry attempts exhausted"));
            verify(notificationChannel, times(3)).send(eq(101L), anyString());
        }
    }

    @Test
    @DisplayName("Should send an occurrence once when it is dispatched twice in parallel")
    void shouldSendOnceUnderParallelDispatch() throws InterruptedException {
        InMemoryReminderStore store = new InMemoryReminderStore();
        ScriptedNotificationChannel channel = new ScriptedNotificationChannel();
        Reminder reminder = daily(1, 101, "07:35");
        store.addReminder(reminder);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            DispatchCoordinator parallel = new DispatchCoordinator(store, channel, new ReminderMessageFormatter(),
                    new TransientRetryPolicy(3, Duration.ofSeconds(30), Duration.ofMinutes(5)), pool);

            DispatchReport report = parallel.dispatch(List.of(due(reminder, 0), due(reminder, 0)), NOW);

            assertThat(report.sent()).hasSize(1);
            assertThat(report.skipped()).extracting(DispatchResult::status).containsExactly(DispatchStatus.DUPLICATE);
            assertThat(channel.deliveries()).hasSize(1);
            assertThat(store.logEntries()).hasSize(1);
        } finally {
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }
    }

    private DueReminder due(Reminder reminder, int leadDays) {
        LocalDate date = reminder.getDueDate() != null ? reminder.getDueDate() : LocalDate.of(2025, 3, 10);
        return new DueReminder(reminder, new Occurrence(reminder.getId(), date, leadDays), SAIGON);
    }
}
