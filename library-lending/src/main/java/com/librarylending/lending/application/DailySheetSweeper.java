package com.librarylending.lending.application;

import com.librarylending.common.Lifecycle;
import com.librarylending.lending.domain.patron.Patron;
import com.librarylending.lending.projections.DailySheetProjection;
import dk.cloudcreate.essentials.shared.concurrent.ThreadFactoryBuilder;
import org.slf4j.*;

import java.time.Clock;
import java.util.concurrent.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Scheduled sweep acting on the {@link DailySheetProjection}: it expires closed-ended holds whose expiration has passed
 * and registers overdue checkouts on the patrons.<br>
 * Books don't expire their own holds and patrons don't notice their own overdue checkouts, so without the sweeper both
 * stay advisory.<br>
 * Every sweep first catches the daily sheet up, so it acts on every book event appended before the sweep started.
 * Each action goes through the {@link LibraryService}, which reloads the aggregate and lets it decide, so acting on a
 * lagging daily sheet is harmless: the aggregate rejects what no longer applies.<br>
 * An overdue checkout stays on the daily sheet until the book is returned, so every sweep offers it to the patron again
 * and the patron rejects the repeat with {@link Patron#OVERDUE_ALREADY_REGISTERED}.
 */
public class DailySheetSweeper implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(DailySheetSweeper.class);

    private final LibraryService           libraryService;
    private final DailySheetProjection     dailySheet;
    private final LibraryConfiguration     configuration;
    private final Clock                    clock;
    private       ScheduledExecutorService scheduler;
    private       ScheduledFuture<?>       scheduledSweep;
    private volatile boolean               started;

    public DailySheetSweeper(LibraryService libraryService,
                             DailySheetProjection dailySheet,
                             LibraryConfiguration configuration,
                             Clock clock) {
        this.libraryService = requireNonNull(libraryService, "No libraryService provided");
        this.dailySheet = requireNonNull(dailySheet, "No dailySheet provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public synchronized void start() {
        if (started) {
            return;
        }
        log.info("Starting DailySheetSweeper with sweep interval {}", configuration.sweepInterval);
        scheduler = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                                                                       .nameFormat("daily-sheet-sweeper-%d")
                                                                       .daemon(true)
                                                                       .build());
        var intervalMillis = configuration.sweepInterval.toMillis();
        scheduledSweep = scheduler.scheduleAtFixedRate(this::scheduledSweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        started = true;
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            return;
        }
        log.info("Stopping DailySheetSweeper");
        scheduledSweep.cancel(false);
        scheduler.shutdownNow();
        scheduledSweep = null;
        scheduler = null;
        started = false;
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    /**
     * Expire the holds and register the overdue checkouts that are due at the current time
     */
    public synchronized SweepResult sweep() {
        var now = clock.instant();
        dailySheet.catchUp();

        var holdsExpired       = 0;
        var overduesRegistered = 0;
        var rejected           = 0;
        for (var hold : dailySheet.getHoldsExpiredAt(now)) {
            var result = libraryService.expireHold(hold.bookId);
            if (result.isSuccess()) {
                log.debug("Expired hold of patron '{}' on book '{}' which expired at {}", hold.patronId, hold.bookId, hold.holdTill);
                holdsExpired++;
            } else {
                log.debug("Couldn't expire hold on book '{}': {}", hold.bookId, result.error().orElse(""));
                rejected++;
            }
        }

        dailySheet.updateOverdueCheckouts(now);
        for (var overdues : dailySheet.getOverdueCheckouts().values()) {
            for (var overdue : overdues) {
                var result = libraryService.registerOverdueCheckout(overdue.patronId, overdue.bookId);
                if (result.isSuccess()) {
                    log.debug("Registered overdue checkout of book '{}' for patron '{}', who now has {} overdue checkout(s) at branch '{}'",
                              overdue.bookId,
                              overdue.patronId,
                              result.value(),
                              overdue.libraryBranchId);
                    overduesRegistered++;
                } else if (Patron.OVERDUE_ALREADY_REGISTERED.equals(result.error().orElse(null))) {
                    log.trace("Overdue checkout of book '{}' is already registered for patron '{}'", overdue.bookId, overdue.patronId);
                } else {
                    log.debug("Couldn't register overdue checkout of book '{}' for patron '{}': {}",
                              overdue.bookId,
                              overdue.patronId,
                              result.error().orElse(""));
                    rejected++;
                }
            }
        }

        var sweepResult = new SweepResult(holdsExpired, overduesRegistered, rejected);
        if (sweepResult.sweptAnything()) {
            log.info("Sweep at {} completed: {}", now, sweepResult);
        }
        return sweepResult;
    }

    private void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException e) {
            // Keep the schedule alive, the next sweep retries
            log.error("Sweep failed", e);
        }
    }
}
