package com.librarylending.lending.application;

import com.librarylending.common.Lifecycle;
import com.librarylending.common.types.*;
import com.librarylending.eventsourced.aggregates.*;
import com.librarylending.eventstore.EventStore;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.persistence.OptimisticAppendToStreamException;
import com.librarylending.eventstore.subscription.*;
import com.librarylending.eventstore.types.GlobalPosition;
import com.librarylending.lending.domain.PatronId;
import com.librarylending.lending.domain.book.*;
import com.librarylending.lending.domain.book.BookEvent.*;
import com.librarylending.lending.domain.patron.*;
import org.slf4j.*;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Keeps each {@link Patron}'s record of its holds and checkouts in step with the book streams.<br>
 * For every book event concerning a patron, the recorder loads the patron, asks it to record the book event and appends
 * the resulting patron event. The patron rejects book events it has already recorded, so redelivery after a restart
 * is harmless.<br>
 * A concurrency conflict on the patron stream is retried, reloading the patron, up to
 * {@link LibraryConfiguration#recorderRetryAttempts} times. When every attempt fails the exception propagates and the book
 * event isn't acknowledged, so it's recorded on the next poll or {@link #catchUp()}.
 * <p>
 * Use a durable {@link SubscriptionResumePointStore} (e.g. {@link PostgresqlSubscriptionResumePointStore}) to continue
 * where the recorder left off after a restart.
 */
public class PatronLendingRecorder implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(PatronLendingRecorder.class);

    public static final SubscriberId SUBSCRIBER_ID = SubscriberId.of("PatronLendingRecorder");

    private final EventSourcedAggregateRepository<PatronId, PatronEvent, Patron> patrons;
    private final EventTypeRegistry<BookEvent>                                   bookEventTypeRegistry;
    private final PollingEventStoreSubscription                                  subscription;
    private final int                                                            retryAttempts;
    private final Clock                                                          clock;

    public PatronLendingRecorder(EventStore eventStore,
                                 SubscriptionResumePointStore resumePointStore,
                                 LibraryConfiguration configuration,
                                 Clock clock) {
        requireNonNull(eventStore, "No eventStore provided");
        requireNonNull(resumePointStore, "No resumePointStore provided");
        requireNonNull(configuration, "No configuration provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.retryAttempts = configuration.recorderRetryAttempts;
        this.bookEventTypeRegistry = BookEvent.eventTypeRegistry();
        this.patrons = new EventSourcedAggregateRepository<>(eventStore,
                                                             PatronEvent.eventTypeRegistry(),
                                                             Patron.class,
                                                             Patron::streamName,
                                                             Patron::new);
        this.subscription = new PollingEventStoreSubscription(SUBSCRIBER_ID,
                                                              eventStore,
                                                              EventStreamFilter.streamNamePrefixes(Book.STREAM_CATEGORY + "-"),
                                                              this::record,
                                                              resumePointStore,
                                                              GlobalPosition.FIRST,
                                                              Optional.of(configuration.subscriptionBatchSize),
                                                              Optional.of(configuration.pollingInterval),
                                                              clock);
    }

    @Override
    public void start() {
        subscription.start();
    }

    @Override
    public void stop() {
        subscription.stop();
    }

    @Override
    public boolean isStarted() {
        return subscription.isStarted();
    }

    /**
     * Synchronously record every book event appended since the last recorded one
     *
     * @return the number of book events handled
     */
    public int catchUp() {
        return subscription.catchUp();
    }

    /**
     * Record a single book event on the patron it concerns
     *
     * @throws OptimisticAppendToStreamException if the patron stream kept changing during all retry attempts
     */
    void record(RecordedEvent recordedEvent) {
        var bookEvent = bookEventTypeRegistry.fromRecordedEvent(recordedEvent);
        var recording = bookEvent.accept(new RecordingResolver(recordedEvent.streamRevision().longValue()));
        if (recording == null) {
            log.trace("[{}] Nothing to record for '{}'", recordedEvent.streamName(), recordedEvent.eventType());
            return;
        }

        var metaData = recordedEvent.metaData()
                                    .correlationId()
                                    .map(EventMetaData::correlatedBy)
                                    .orElseGet(() -> EventMetaData.correlatedBy(CorrelationId.random()))
                                    .withCausationId(recordedEvent.eventId());
        for (var attempt = 1; ; attempt++) {
            var patron = patrons.tryLoad(recording.patronId);
            if (patron.isEmpty()) {
                log.warn("[{}] Can't record '{}' at revision {} since patron '{}' doesn't exist",
                         recordedEvent.streamName(),
                         recordedEvent.eventType(),
                         recordedEvent.streamRevision(),
                         recording.patronId);
                return;
            }
            var decision = recording.decide.apply(patron.get());
            if (decision.isRejected()) {
                log.debug("[{}] Patron '{}' didn't record '{}' at revision {}: {}",
                          recordedEvent.streamName(),
                          recording.patronId,
                          recordedEvent.eventType(),
                          recordedEvent.streamRevision(),
                          decision.rejectionReason().orElse(""));
                return;
            }
            try {
                patrons.persist(patron.get(), metaData);
                log.debug("[{}] Recorded '{}' at revision {} on patron '{}'",
                          recordedEvent.streamName(),
                          recordedEvent.eventType(),
                          recordedEvent.streamRevision(),
                          recording.patronId);
                return;
            } catch (OptimisticAppendToStreamException e) {
                if (attempt >= retryAttempts) {
                    log.warn("[{}] Giving up recording '{}' on patron '{}' after {} attempt(s)",
                             recordedEvent.streamName(),
                             recordedEvent.eventType(),
                             recording.patronId,
                             attempt);
                    throw e;
                }
                log.debug("[{}] Concurrency conflict recording on patron '{}', attempt {} of {}",
                          recordedEvent.streamName(),
                          recording.patronId,
                          attempt,
                          retryAttempts);
            }
        }
    }

    private static final class Recording {
        private final PatronId                                  patronId;
        private final Function<Patron, Decision<PatronEvent>> decide;

        private Recording(PatronId patronId, Function<Patron, Decision<PatronEvent>> decide) {
            this.patronId = patronId;
            this.decide = decide;
        }
    }

    /**
     * Resolves the patron and the bookkeeping decision for a book event, or null if the event doesn't concern a patron
     */
    private class RecordingResolver implements BookEvent.Visitor<Recording> {
        private final long bookStreamRevision;

        private RecordingResolver(long bookStreamRevision) {
            this.bookStreamRevision = bookStreamRevision;
        }

        @Override
        public Recording visit(BookAddedToLibrary event) {
            return null;
        }

        @Override
        public Recording visit(BookPlacedOnHold event) {
            return new Recording(event.patronId,
                                 patron -> patron.recordHoldPlaced(event.bookId,
                                                                   event.libraryBranchId,
                                                                   event.holdType,
                                                                   event.holdTill,
                                                                   bookStreamRevision,
                                                                   clock.instant()));
        }

        @Override
        public Recording visit(BookHoldCanceled event) {
            return new Recording(event.patronId,
                                 patron -> patron.recordHoldRemoved(event.bookId, event.libraryBranchId, bookStreamRevision, clock.instant()));
        }

        @Override
        public Recording visit(BookHoldExpired event) {
            return new Recording(event.patronId,
                                 patron -> patron.recordHoldRemoved(event.bookId, event.libraryBranchId, bookStreamRevision, clock.instant()));
        }

        @Override
        public Recording visit(BookCheckedOut event) {
            return new Recording(event.patronId,
                                 patron -> patron.recordCheckout(event.bookId,
                                                                 event.libraryBranchId,
                                                                 event.checkedOutAt,
                                                                 event.dueDate,
                                                                 bookStreamRevision,
                                                                 clock.instant()));
        }

        @Override
        public Recording visit(BookReturned event) {
            return new Recording(event.patronId,
                                 patron -> patron.recordReturn(event.bookId, event.libraryBranchId, bookStreamRevision, clock.instant()));
        }

        @Override
        public Recording visit(UnknownBookEvent event) {
            return null;
        }
    }
}
