package com.librarylending.eventstore.subscription;

import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventstore.EventStore;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.types.GlobalPosition;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.*;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Catch-up subscription that drives a {@link PersistedEventHandler} from {@link EventStore#pollEvents(GlobalPosition, EventStreamFilter, Optional, Optional, Optional)}.<br>
 * <br>
 * The subscription remembers the position of the next event to deliver in a {@link SubscriptionResumePoint}, which is saved
 * through the {@link SubscriptionResumePointStore} after every delivered event. Events below the resume point are skipped, so
 * the same global position is never delivered twice, whether the event arrives from the background poll or from {@link #catchUp()}.<br>
 * A handler that throws is logged and the resume point stays at the failed event, so the event is redelivered:
 * {@link #catchUp()} rethrows the handler exception and the background poll re-subscribes from the resume point with back-off.<br>
 * Polling failures (e.g. a lost database connection) are retried the same way.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class PollingEventStoreSubscription implements EventStoreSubscription {
    private static final Logger log = LoggerFactory.getLogger(PollingEventStoreSubscription.class);

    private final SubscriberId                 subscriberId;
    private final EventStore                   eventStore;
    private final EventStreamFilter            filter;
    private final PersistedEventHandler        eventHandler;
    private final SubscriptionResumePointStore resumePointStore;
    private final GlobalPosition               onFirstSubscribeStartFrom;
    private final int                          batchSize;
    private final Duration                     pollingInterval;
    private final Clock                        clock;

    private SubscriptionResumePoint resumePoint;
    private Disposable              subscription;
    private volatile boolean        started;

    /**
     * @param subscriberId              the unique id of the subscriber, also the key of its resume point
     * @param eventStore                the event store to poll
     * @param filter                    the streams to subscribe to
     * @param eventHandler              the handler receiving the events
     * @param resumePointStore          the store persisting the resume point
     * @param onFirstSubscribeStartFrom where to start if no resume point has been persisted for <code>subscriberId</code>
     * @param batchSize                 option with the maximum number of events read per poll
     * @param pollingInterval           option with the delay between polls
     * @param clock                     clock used for {@link SubscriptionResumePoint#getLastUpdated()}
     */
    public PollingEventStoreSubscription(SubscriberId subscriberId,
                                         EventStore eventStore,
                                         EventStreamFilter filter,
                                         PersistedEventHandler eventHandler,
                                         SubscriptionResumePointStore resumePointStore,
                                         GlobalPosition onFirstSubscribeStartFrom,
                                         Optional<Integer> batchSize,
                                         Optional<Duration> pollingInterval,
                                         Clock clock) {
        this.subscriberId = requireNonNull(subscriberId, "No subscriberId provided");
        this.eventStore = requireNonNull(eventStore, "No eventStore provided");
        this.filter = requireNonNull(filter, "No filter provided");
        this.eventHandler = requireNonNull(eventHandler, "No eventHandler provided");
        this.resumePointStore = requireNonNull(resumePointStore, "No resumePointStore provided");
        this.onFirstSubscribeStartFrom = requireNonNull(onFirstSubscribeStartFrom, "No onFirstSubscribeStartFrom provided");
        this.batchSize = requireNonNull(batchSize, "No batchSize option provided").orElse(EventStore.DEFAULT_BATCH_SIZE);
        requireTrue(this.batchSize > 0, "batchSize must be > 0");
        this.pollingInterval = requireNonNull(pollingInterval, "No pollingInterval option provided").orElse(EventStore.DEFAULT_POLLING_INTERVAL);
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public synchronized void start() {
        if (started) {
            log.debug("[{}] Subscription was already started", subscriberId);
            return;
        }
        var startFrom = resolveResumePoint().getResumeFromAndIncluding();
        log.info("[{}] Starting subscription for {} from global position {}", subscriberId, filter, startFrom);
        subscription = Flux.defer(() -> eventStore.pollEvents(currentResumePoint().getResumeFromAndIncluding(),
                                                              filter,
                                                              Optional.of(batchSize),
                                                              Optional.of(pollingInterval),
                                                              Optional.of(subscriberId)))
                           .doOnNext(this::deliver)
                           .subscribeOn(Schedulers.boundedElastic())
                           .retryWhen(Retry.backoff(Long.MAX_VALUE, Duration.ofMillis(100))
                                           .maxBackoff(pollingInterval.multipliedBy(10))
                                           .doBeforeRetry(retrySignal -> log.warn("[{}] Re-subscribing from the resume point after failure #{}",
                                                                                  subscriberId,
                                                                                  retrySignal.totalRetries() + 1)))
                           .subscribe(event -> log.trace("[{}] Acknowledged global position {}", subscriberId, event.globalPosition()),
                                      error -> log.error(msg("[{}] Subscription terminated with an error", subscriberId), error));
        started = true;
    }

    @Override
    public synchronized void stop() {
        if (!started) {
            return;
        }
        log.info("[{}] Stopping subscription", subscriberId);
        if (subscription != null) {
            subscription.dispose();
            subscription = null;
        }
        started = false;
    }

    @Override
    public boolean isStarted() {
        return started;
    }

    @Override
    public SubscriberId subscriberId() {
        return subscriberId;
    }

    @Override
    public EventStreamFilter filter() {
        return filter;
    }

    @Override
    public synchronized SubscriptionResumePoint currentResumePoint() {
        var current = resolveResumePoint();
        return new SubscriptionResumePoint(subscriberId, current.getResumeFromAndIncluding(), current.getLastUpdated());
    }

    @Override
    public synchronized void resetFrom(GlobalPosition subscribeFromAndIncludingPosition) {
        requireNonNull(subscribeFromAndIncludingPosition, "No subscribeFromAndIncludingPosition provided");
        var wasStarted = started;
        stop();
        log.info("[{}] Resetting subscription to global position {}", subscriberId, subscribeFromAndIncludingPosition);
        resolveResumePoint().setResumeFromAndIncluding(subscribeFromAndIncludingPosition, OffsetDateTime.now(clock));
        resumePointStore.save(resumePoint);
        eventHandler.onResetFrom(subscribeFromAndIncludingPosition);
        if (wasStarted) {
            start();
        }
    }

    @Override
    public synchronized int catchUp() {
        var delivered = 0;
        while (true) {
            var events = eventStore.readAll(resolveResumePoint().getResumeFromAndIncluding(), batchSize, filter);
            if (events.isEmpty()) {
                return delivered;
            }
            for (var event : events) {
                if (deliver(event)) {
                    delivered++;
                }
            }
        }
    }

    @Override
    public void unsubscribe() {
        log.info("[{}] Unsubscribing", subscriberId);
        stop();
    }

    @Override
    public boolean isActive() {
        return started;
    }

    /**
     * @return true if the event was handed to the {@link PersistedEventHandler}, false if it was skipped because it's
     * below the resume point
     */
    private synchronized boolean deliver(RecordedEvent event) {
        var current = resolveResumePoint();
        if (event.globalPosition().compareTo(current.getResumeFromAndIncluding()) < 0) {
            log.trace("[{}] Skipping already delivered event at global position {}", subscriberId, event.globalPosition());
            return false;
        }
        try {
            log.trace("[{}] Handling {}", subscriberId, event);
            eventHandler.handle(event);
        } catch (RuntimeException e) {
            log.error(msg("[{}] Handler failed to handle event '{}' of type '{}' at global position {}. The event will be redelivered",
                          subscriberId,
                          event.eventId(),
                          event.eventType(),
                          event.globalPosition()),
                      e);
            throw e;
        }
        current.setResumeFromAndIncluding(event.globalPosition().next(), OffsetDateTime.now(clock));
        resumePointStore.save(current);
        return true;
    }

    private SubscriptionResumePoint resolveResumePoint() {
        if (resumePoint == null) {
            resumePoint = resumePointStore.load(subscriberId)
                                          .orElseGet(() -> {
                                              log.debug("[{}] No resume point found, starting from global position {}", subscriberId, onFirstSubscribeStartFrom);
                                              return new SubscriptionResumePoint(subscriberId, onFirstSubscribeStartFrom, OffsetDateTime.now(clock));
                                          });
        }
        return resumePoint;
    }

    @Override
    public String toString() {
        return "PollingEventStoreSubscription{" +
                "subscriberId=" + subscriberId +
                ", filter=" + filter +
                ", started=" + started +
                '}';
    }
}
