package com.billreminder.service;

import com.billreminder.ReminderTestData;
import com.billreminder.config.ReminderProperties;
import com.billreminder.domain.enums.ChannelFailureKind;
import com.billreminder.domain.enums.Frequency;
import com.billreminder.domain.model.Reminder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static com.billreminder.ReminderTestData.daily;
import static com.billreminder.ReminderTestData.reminder;
import static com.billreminder.ReminderTestData.user;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Daily digest")
class DailyDigestServiceTest {

    // Monday 10 March 2025, 07:35 in Saigon
    private static final Instant SAIGON_0735 = Instant.parse("2025-03-10T00:35:00Z");

    private InMemoryReminderStore store;
    private ScriptedNotificationChannel channel;

    @BeforeEach
    void setUp() {
        store = new InMemoryReminderStore();
        channel = new ScriptedNotificationChannel();
        store.addUser(user(101, ReminderTestData.SAIGON));
        store.addUser(user(102, ReminderTestData.SAIGON));
        store.addUser(user(103, ReminderTestData.SAIGON));
        store.addUser(user(104, ReminderTestData.SAIGON));

        store.addReminder(daily(1, 101, "20:00"));
        store.addReminder(monthly(2, 102, 12, 2));
        store.addReminder(monthly(3, 103, 20, 2));
        Reminder paused = daily(4, 103, "08:00");
        paused.setActive(false);
        store.addReminder(paused);
    }

    @Test
    @DisplayName("Only users with nothing due today or in the advance-notice range get the status")
    void notifiesUsersWithNothingDue() {
        DailyDigestService digest = digest(Clock.systemUTC(), ReminderTestData.properties());

        assertThat(digest.runDigest(SAIGON_0735, true)).containsExactlyInAnyOrder(103L, 104L);
        assertThat(channel.deliveries())
                .extracting(ScriptedNotificationChannel.Delivery::text)
                .containsOnly(new ReminderMessageFormatter().formatNothingDue());
        assertThat(store.logEntries()).isEmpty();
    }

    @Test
    @DisplayName("A failed send for one user does not stop the others")
    void isolatesChannelFailures() {
        DailyDigestService digest = digest(Clock.systemUTC(), ReminderTestData.properties());
        channel.failNext(103L, ChannelFailureKind.TRANSIENT);

        assertThat(digest.runDigest(SAIGON_0735, true)).containsExactly(104L);
        assertThat(channel.deliveriesTo(104L)).isEqualTo(1);
    }

    @Test
    @DisplayName("Due-ness is judged in the reminder's own zone")
    void usesReminderZone() {
        Reminder losAngeles = daily(5, 104, "07:00");
        losAngeles.setFrequency(Frequency.WEEKLY);
        losAngeles.setDayOfWeek(DayOfWeek.SUNDAY);
        losAngeles.setTimezone("America/Los_Angeles");
        store.addReminder(losAngeles);
        DailyDigestService digest = digest(Clock.systemUTC(), ReminderTestData.properties());

        // still Sunday 9 March in Los Angeles
        assertThat(digest.runDigest(SAIGON_0735, true)).containsExactly(103L);
    }

    @Test
    @DisplayName("A closed window or an unavailable store sends nothing")
    void closedWindowAndStoreOutage() {
        DailyDigestService digest = digest(Clock.systemUTC(), ReminderTestData.properties());

        assertThat(digest.runDigest(SAIGON_0735, false)).isEmpty();
        store.setUnavailable(true);
        assertThat(digest.runDigest(SAIGON_0735, true)).isEmpty();
        assertThat(channel.deliveries()).isEmpty();
    }

    @Test
    @DisplayName("The scheduled digest reads the clock and the window gate")
    void scheduledDigestUsesClockAndGate() {
        ReminderProperties windowed = ReminderTestData.properties(Duration.ofMinutes(1), true);

        digest(Clock.fixed(Instant.parse("2025-03-10T02:00:00Z"), ZoneOffset.UTC), windowed).runScheduledDigest();
        assertThat(channel.deliveries()).isEmpty();

        digest(Clock.fixed(SAIGON_0735, ZoneOffset.UTC), windowed).runScheduledDigest();
        assertThat(channel.deliveries()).hasSize(2);
    }

    private Reminder monthly(long id, long userId, int dayOfMonth, int advanceNoticeDays) {
        Reminder reminder = reminder(id, userId, Frequency.MONTHLY, "07:35");
        reminder.setDayOfMonth(dayOfMonth);
        reminder.setAdvanceNoticeDays(advanceNoticeDays);
        return reminder;
    }

    private DailyDigestService digest(Clock clock, ReminderProperties properties) {
        RecurrenceEvaluator evaluator = new RecurrenceEvaluator(properties);
        return new DailyDigestService(clock, new ActiveWindowGate(properties), store, evaluator,
                new DueSetSelector(store, evaluator, properties), channel, new ReminderMessageFormatter(), properties);
    }
}
