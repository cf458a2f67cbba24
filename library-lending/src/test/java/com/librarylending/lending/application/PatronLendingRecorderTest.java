package com.librarylending.lending.application;

import com.librarylending.eventstore.*;
import com.librarylending.eventstore.eventstream.*;
import com.librarylending.eventstore.persistence.OptimisticAppendToStreamException;
import com.librarylending.eventstore.serializer.json.JacksonJSONSerializer;
import com.librarylending.eventstore.subscription.InMemorySubscriptionResumePointStore;
import com.librarylending.eventstore.types.*;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.*;
import com.librarylending.lending.domain.patron.*;
import com.librarylending.lending.test_data.*;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class PatronLendingRecorderTest {
    private static final Instant         NOW    = Instant.parse("2024-05-01T08:00:00Z");
    private static final LibraryBranchId BRANCH = LibraryBranchId.of("downtown");

    private TestClock                            clock;
    private InMemoryEventStore                   eventStore;
    private InterferingEventStore                interferingEventStore;
    private InMemorySubscriptionResumePointStore resumePointStore;
    private LibraryConfiguration                 configuration;
    private LibraryService                       libraryService;
    private PatronLendingRecorder                recorder;

    @BeforeEach
    void setup() {
        clock = new TestClock(NOW);
        eventStore = new InMemoryEventStore(new JacksonJSONSerializer(), clock);
        interferingEventStore = new InterferingEventStore(eventStore);
        resumePointStore = new InMemorySubscriptionResumePointStore();
        configuration = LibraryConfiguration.defaultConfiguration().withPollingInterval(Duration.ofMillis(20));
        libraryService = new LibraryService(eventStore, configuration, clock);
        recorder = new PatronLendingRecorder(interferingEventStore, resumePointStore, configuration, clock);
    }

    @AfterEach
    void cleanup() {
        recorder.stop();
    }

    private BookId addBook(String title) {
        return libraryService.addBook(BookId.random(), "isbn-" + title.hashCode(), title, BookType.CIRCULATING, BRANCH).value();
    }

    private PatronId createPatron(String name) {
        return libraryService.createPatron(PatronId.random(), PatronType.REGULAR, name, name + "@example.com").value();
    }

    /**
     * Appends an event the patron aggregate doesn't know, which moves the stream without changing the patron
     */
    private static void appendUnrelatedPatronEvent(EventStore concurrentEventStore, PatronId patronId) {
        concurrentEventStore.appendToStream(Patron.streamName(patronId),
                                            ExpectedRevision.any(),
                                            List.of(PersistableEvent.from(EventType.of("PatronNewsletterSubscribed"),
                                                                          EventRevision.FIRST,
                                                                          Map.of("patronId", patronId.value()),
                                                                          EventMetaData.empty())));
    }

    @Test
    void verify_holds_and_checkouts_are_recorded_on_the_patron() {
        // Given
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        libraryService.placeHold(bookId, patronId);

        // When
        recorder.catchUp();

        // Then
        var patron = libraryService.getPatron(patronId).value();
        assertThat(patron.holdsCount).isEqualTo(1);
        assertThat((Object) patron.holds.get(0).bookId).isEqualTo(bookId);
        assertThat(patron.holds.get(0).holdTill).isEqualTo(NOW.plus(configuration.holdDuration));

        // When
        libraryService.checkout(bookId, patronId);
        recorder.catchUp();

        // Then
        patron = libraryService.getPatron(patronId).value();
        assertThat(patron.holdsCount).isZero();
        assertThat(patron.checkoutsCount).isEqualTo(1);
        assertThat(patron.checkouts.get(0).dueDate).isEqualTo(NOW.plus(Book.MAX_CHECKOUT_DURATION));

        // When
        libraryService.returnBook(bookId, patronId);
        recorder.catchUp();

        // Then
        assertThat(libraryService.getPatron(patronId).value().checkoutsCount).isZero();
    }

    @Test
    void verify_canceled_hold_is_removed_from_the_patron() {
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        libraryService.placeHold(bookId, patronId);
        libraryService.cancelHold(bookId, patronId);

        recorder.catchUp();

        assertThat(libraryService.getPatron(patronId).value().holdsCount).isZero();
        var patronEvents = eventStore.readStream(Patron.streamName(patronId)).orElseThrow().eventList();
        assertThat(patronEvents).extracting(RecordedEvent::eventType)
                                .containsExactly(PatronEvent.PATRON_CREATED, PatronEvent.PATRON_HOLD_PLACED, PatronEvent.PATRON_HOLD_CANCELED);
    }

    @Test
    void verify_recorded_patron_events_are_caused_by_the_book_events() {
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        libraryService.placeHold(bookId, patronId);

        recorder.catchUp();

        var holdPlaced   = eventStore.readStream(Book.streamName(bookId)).orElseThrow().eventList().get(1);
        var holdRecorded = eventStore.readStream(Patron.streamName(patronId)).orElseThrow().eventList().get(1);
        assertThat(holdRecorded.metaData().causationId()).hasValue(holdPlaced.eventId());
        assertThat(holdRecorded.metaData().correlationId()).isEqualTo(holdPlaced.metaData().correlationId());
    }

    @Test
    void verify_redelivered_book_events_are_recorded_only_once() {
        // Given
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        libraryService.placeHold(bookId, patronId);
        recorder.catchUp();

        // When a new recorder, without the resume point, replays all book events
        var replayingRecorder = new PatronLendingRecorder(eventStore, new InMemorySubscriptionResumePointStore(), configuration, clock);
        var handled           = replayingRecorder.catchUp();

        // Then
        assertThat(handled).isEqualTo(2);
        assertThat(eventStore.readStream(Patron.streamName(patronId)).orElseThrow().eventList()).hasSize(2);
        assertThat(libraryService.getPatron(patronId).value().holdsCount).isEqualTo(1);
    }

    @Test
    void verify_concurrency_conflict_on_the_patron_stream_is_retried() {
        // Given
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        libraryService.placeHold(bookId, patronId);
        interferingEventStore.interfereWithNextAppends(Patron.streamName(patronId), 2, concurrentEventStore -> appendUnrelatedPatronEvent(concurrentEventStore, patronId));

        // When
        recorder.catchUp();

        // Then
        assertThat(libraryService.getPatron(patronId).value().holdsCount).isEqualTo(1);
        assertThat(eventStore.readStream(Patron.streamName(patronId)).orElseThrow().eventList()).hasSize(4);
    }

    @Test
    void verify_recorder_gives_up_after_the_configured_number_of_attempts() {
        // Given
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        libraryService.placeHold(bookId, patronId);
        interferingEventStore.interfereWithNextAppends(Patron.streamName(patronId),
                                                      configuration.recorderRetryAttempts,
                                                      concurrentEventStore -> appendUnrelatedPatronEvent(concurrentEventStore, patronId));
        var holdPlaced = eventStore.readStream(Book.streamName(bookId)).orElseThrow().eventList().get(1);

        // When
        var thrown = catchThrowable(() -> recorder.record(holdPlaced));

        // Then
        assertThat(thrown).isInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(libraryService.getPatron(patronId).value().holdsCount).isZero();
    }

    @Test
    void verify_book_event_is_recorded_by_a_later_catch_up_after_the_recorder_gave_up() {
        // Given
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        libraryService.placeHold(bookId, patronId);
        interferingEventStore.interfereWithNextAppends(Patron.streamName(patronId),
                                                      configuration.recorderRetryAttempts,
                                                      concurrentEventStore -> appendUnrelatedPatronEvent(concurrentEventStore, patronId));
        var gaveUp = catchThrowable(() -> recorder.catchUp());
        assertThat(gaveUp).isInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(libraryService.getPatron(patronId).value().holdsCount).isZero();

        // When
        var handled = recorder.catchUp();

        // Then
        assertThat(handled).isEqualTo(1);
        var patron = libraryService.getPatron(patronId).value();
        assertThat(patron.holdsCount).isEqualTo(1);
        assertThat((Object) patron.holds.get(0).bookId).isEqualTo(bookId);
        assertThat(resumePointStore.load(PatronLendingRecorder.SUBSCRIBER_ID).orElseThrow().getResumeFromAndIncluding())
                .isEqualTo(eventStore.readStream(Book.streamName(bookId)).orElseThrow().eventList().get(1).globalPosition().next());
    }

    @Test
    void verify_book_events_for_unknown_patrons_are_skipped() {
        var bookId = addBook("Refactoring");
        eventStore.appendToStream(Book.streamName(bookId),
                                  ExpectedRevision.exactly(0),
                                  List.of(PersistableEvent.from(BookEvent.BOOK_PLACED_ON_HOLD,
                                                                EventRevision.FIRST,
                                                                new BookEvent.BookPlacedOnHold(bookId,
                                                                                               PatronId.of("ghost"),
                                                                                               BRANCH,
                                                                                               HoldType.CLOSED_ENDED,
                                                                                               NOW.plus(Duration.ofDays(7)),
                                                                                               NOW),
                                                                EventMetaData.empty())));

        var handled = recorder.catchUp();

        assertThat(handled).isEqualTo(2);
        assertThat(eventStore.streamExists(Patron.streamName(PatronId.of("ghost")))).isFalse();
    }

    @Test
    void verify_started_recorder_records_in_the_background() {
        var bookId   = addBook("Refactoring");
        var patronId = createPatron("Alice");
        recorder.start();

        libraryService.placeHold(bookId, patronId);

        Awaitility.waitAtMost(Duration.ofSeconds(5))
                  .untilAsserted(() -> assertThat(libraryService.getPatron(patronId).value().holdsCount).isEqualTo(1));
        assertThat(recorder.isStarted()).isTrue();
    }
}
