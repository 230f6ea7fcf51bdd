package com.billreminder.service;

import com.billreminder.service.exception.StoreUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReminderCycleService {

    private final Clock clock;
    private final ActiveWindowGate activeWindowGate;
    private final DueSetSelector dueSetSelector;
    private final DispatchCoordinator dispatchCoordinator;
    private final TransientRetryPolicy retryPolicy;

    @Scheduled(fixedDelayString = "${app.reminders.cycle-interval-ms:15000}")
    public void runScheduledCycle() {
        Instant now = clock.instant();
        runCycle(now, activeWindowGate.isOpen(now));
    }

    public DispatchReport runCycle(Instant now, boolean windowOpen) {
        if (!windowOpen) {
            log.debug("Skip reminder cycle: outside active window. now={}", now);
            return DispatchReport.empty();
        }

        List<DueReminder> due;
        try {
            due = dueSetSelector.selectDue(now);
        } catch (StoreUnavailableException e) {
            log.error("Reminder cycle aborted: store unavailable. now={}, error={}", now, e.getMessage(), e);
            return DispatchReport.empty();
        }

        retryPolicy.retainOnly(due.stream().map(DueReminder::occurrenceKey).toList());
        if (due.isEmpty()) {
            return DispatchReport.empty();
        }

        log.info("Due reminders selected. count={}, now={}", due.size(), now);
        DispatchReport report = dispatchCoordinator.dispatch(due, now);
        log.info("Reminder cycle finished. sent={}, failed={}, skipped={}",
                report.sent().size(), report.failed().size(), report.skipped().size());
        return report;
    }
}
