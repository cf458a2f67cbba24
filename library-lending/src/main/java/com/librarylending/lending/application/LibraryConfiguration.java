package com.librarylending.lending.application;

import java.time.Duration;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Settings for the {@link LibraryService}, the projections and the background processes
 */
public final class LibraryConfiguration {
    public static final Duration DEFAULT_HOLD_DURATION           = Duration.ofDays(7);
    public static final Duration DEFAULT_POLLING_INTERVAL        = Duration.ofMillis(500);
    public static final int      DEFAULT_SUBSCRIPTION_BATCH_SIZE = 100;
    public static final Duration DEFAULT_SWEEP_INTERVAL          = Duration.ofMinutes(1);
    public static final int      DEFAULT_RECORDER_RETRY_ATTEMPTS = 3;

    /**
     * How long a closed-ended hold lasts, unless the caller asks for a different duration
     */
    public final Duration holdDuration;
    /**
     * Delay between polls of the subscriptions driving projections and the patron recorder
     */
    public final Duration pollingInterval;
    public final int      subscriptionBatchSize;
    public final Duration sweepInterval;
    /**
     * How many times the patron recorder tries to append a recording event before it gives up on a concurrency conflict
     */
    public final int      recorderRetryAttempts;

    public LibraryConfiguration(Duration holdDuration,
                                Duration pollingInterval,
                                int subscriptionBatchSize,
                                Duration sweepInterval,
                                int recorderRetryAttempts) {
        this.holdDuration = requireNonNull(holdDuration, "No holdDuration provided");
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval provided");
        this.sweepInterval = requireNonNull(sweepInterval, "No sweepInterval provided");
        requireTrue(!holdDuration.isNegative() && !holdDuration.isZero(), "holdDuration must be positive");
        requireTrue(!pollingInterval.isNegative() && !pollingInterval.isZero(), "pollingInterval must be positive");
        requireTrue(!sweepInterval.isNegative() && !sweepInterval.isZero(), "sweepInterval must be positive");
        requireTrue(subscriptionBatchSize > 0, "subscriptionBatchSize must be > 0");
        requireTrue(recorderRetryAttempts > 0, "recorderRetryAttempts must be > 0");
        this.subscriptionBatchSize = subscriptionBatchSize;
        this.recorderRetryAttempts = recorderRetryAttempts;
    }

    public static LibraryConfiguration defaultConfiguration() {
        return new LibraryConfiguration(DEFAULT_HOLD_DURATION,
                                        DEFAULT_POLLING_INTERVAL,
                                        DEFAULT_SUBSCRIPTION_BATCH_SIZE,
                                        DEFAULT_SWEEP_INTERVAL,
                                        DEFAULT_RECORDER_RETRY_ATTEMPTS);
    }

    public LibraryConfiguration withPollingInterval(Duration pollingInterval) {
        return new LibraryConfiguration(holdDuration, pollingInterval, subscriptionBatchSize, sweepInterval, recorderRetryAttempts);
    }

    public LibraryConfiguration withSweepInterval(Duration sweepInterval) {
        return new LibraryConfiguration(holdDuration, pollingInterval, subscriptionBatchSize, sweepInterval, recorderRetryAttempts);
    }

    @Override
    public String toString() {
        return "LibraryConfiguration{" +
                "holdDuration=" + holdDuration +
                ", pollingInterval=" + pollingInterval +
                ", subscriptionBatchSize=" + subscriptionBatchSize +
                ", sweepInterval=" + sweepInterval +
                ", recorderRetryAttempts=" + recorderRetryAttempts +
                '}';
    }
}
