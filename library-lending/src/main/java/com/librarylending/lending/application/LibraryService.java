package com.librarylending.lending.application;

import com.librarylending.common.types.CorrelationId;
import com.librarylending.eventsourced.aggregates.*;
import com.librarylending.eventstore.EventStore;
import com.librarylending.eventstore.eventstream.EventMetaData;
import com.librarylending.eventstore.persistence.OptimisticAppendToStreamException;
import com.librarylending.lending.application.LibraryResult.FailureKind;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.*;
import com.librarylending.lending.domain.patron.*;
import org.slf4j.*;

import java.time.*;
import java.util.Optional;
import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * The library's use cases.<br>
 * Every use case follows the same cycle: load the aggregate(s) by replaying their streams, ask the aggregate for a
 * {@link Decision} and, if it's accepted, append the event to the aggregate's stream guarded by the revision observed
 * when the aggregate was loaded.<br>
 * Business outcomes (not found, already exists, rejections, concurrency conflicts) are returned as a {@link LibraryResult};
 * the service never retries a conflicting use case, the caller must retry the whole cycle.
 * Infrastructure failures from the {@link EventStore} propagate as exceptions.
 * <p>
 * Placing a hold reads both the book and the patron, but only writes to the book's stream. The patron's own record of
 * its holds and checkouts is kept up to date asynchronously by the {@link PatronLendingRecorder}.
 */
public class LibraryService {
    private static final Logger log = LoggerFactory.getLogger(LibraryService.class);

    public static final String DEFAULT_CANCEL_REASON = "Canceled by patron";

    private final LibraryConfiguration                                        configuration;
    private final Clock                                                       clock;
    private final EventSourcedAggregateRepository<BookId, BookEvent, Book>     books;
    private final EventSourcedAggregateRepository<PatronId, PatronEvent, Patron> patrons;

    public LibraryService(EventStore eventStore, LibraryConfiguration configuration, Clock clock) {
        requireNonNull(eventStore, "No eventStore provided");
        this.configuration = requireNonNull(configuration, "No configuration provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.books = new EventSourcedAggregateRepository<>(eventStore,
                                                           BookEvent.eventTypeRegistry(),
                                                           Book.class,
                                                           Book::streamName,
                                                           Book::new);
        this.patrons = new EventSourcedAggregateRepository<>(eventStore,
                                                             PatronEvent.eventTypeRegistry(),
                                                             Patron.class,
                                                             Patron::streamName,
                                                             Patron::new);
    }

    public LibraryConfiguration configuration() {
        return configuration;
    }

    // ------------------------------------------------------------------------------------------------------------
    // Books and patrons
    // ------------------------------------------------------------------------------------------------------------

    public LibraryResult<BookId> addBook(BookId bookId, String isbn, String title, BookType bookType, LibraryBranchId libraryBranchId) {
        requireNonNull(bookId, "You must provide a bookId");
        if (books.exists(bookId)) {
            return LibraryResult.failure(FailureKind.ALREADY_EXISTS, "Book already exists");
        }
        var book = Book.addToLibrary(bookId, isbn, title, bookType, libraryBranchId, now());
        try {
            books.persist(book, newMetaData());
        } catch (OptimisticAppendToStreamException e) {
            log.debug("[{}] Book was added concurrently", e.streamName);
            return LibraryResult.failure(FailureKind.ALREADY_EXISTS, "Book already exists");
        }
        return LibraryResult.success(bookId, "Book \"" + title + "\" added to library branch " + libraryBranchId);
    }

    public LibraryResult<PatronId> createPatron(PatronId patronId, PatronType patronType, String name, String email) {
        requireNonNull(patronId, "You must provide a patronId");
        if (patrons.exists(patronId)) {
            return LibraryResult.failure(FailureKind.ALREADY_EXISTS, "Patron already exists");
        }
        var patron = Patron.create(patronId, patronType, name, email, now());
        try {
            patrons.persist(patron, newMetaData());
        } catch (OptimisticAppendToStreamException e) {
            log.debug("[{}] Patron was created concurrently", e.streamName);
            return LibraryResult.failure(FailureKind.ALREADY_EXISTS, "Patron already exists");
        }
        return LibraryResult.success(patronId, "Patron \"" + name + "\" created as " + patronType.label());
    }

    public LibraryResult<PatronType> upgradePatronToResearcher(PatronId patronId) {
        var patron = patrons.tryLoad(requireNonNull(patronId, "You must provide a patronId"));
        if (patron.isEmpty()) {
            return patronNotFound(patronId);
        }
        var decision = patron.get().upgradeToResearcher(now());
        return persistPatron(patron.get(),
                             decision,
                             p -> LibraryResult.success(p.patronType(), "Patron \"" + p.name() + "\" upgraded to Researcher"));
    }

    // ------------------------------------------------------------------------------------------------------------
    // Holds
    // ------------------------------------------------------------------------------------------------------------

    /**
     * Place a {@link HoldType#CLOSED_ENDED} hold lasting {@link LibraryConfiguration#holdDuration}
     */
    public LibraryResult<HoldPlacement> placeHold(BookId bookId, PatronId patronId) {
        return placeHold(bookId, patronId, HoldType.CLOSED_ENDED, configuration.holdDuration);
    }

    public LibraryResult<HoldPlacement> placeHold(BookId bookId, PatronId patronId, HoldType holdType) {
        return placeHold(bookId, patronId, holdType, configuration.holdDuration);
    }

    /**
     * Place a hold on a book. The patron's eligibility is checked before the book decides.
     *
     * @param holdDuration how long a {@link HoldType#CLOSED_ENDED} hold lasts. Ignored for {@link HoldType#OPEN_ENDED} holds
     */
    public LibraryResult<HoldPlacement> placeHold(BookId bookId, PatronId patronId, HoldType holdType, Duration holdDuration) {
        requireNonNull(bookId, "You must provide a bookId");
        requireNonNull(patronId, "You must provide a patronId");
        requireNonNull(holdType, "You must provide a holdType");
        requireNonNull(holdDuration, "You must provide a holdDuration");

        var book = books.tryLoad(bookId);
        if (book.isEmpty()) {
            return bookNotFound(bookId);
        }
        var patron = patrons.tryLoad(patronId);
        if (patron.isEmpty()) {
            return patronNotFound(patronId);
        }

        var eligibility = patron.get().canPlaceHoldAt(book.get().libraryBranchId(), book.get().bookType());
        if (!eligibility.isAllowed()) {
            log.debug("[{}] Patron '{}' isn't allowed to place a hold: {}", bookId, patronId, eligibility.reason().orElse(""));
            return LibraryResult.failure(FailureKind.POLICY_VIOLATION, eligibility.reason().orElseThrow());
        }

        var now      = now();
        var holdTill = holdType == HoldType.CLOSED_ENDED ? now.plus(holdDuration) : null;
        var decision = book.get().placeOnHold(patronId, patron.get().patronType(), holdType, holdTill, now);
        return persistBook(book.get(),
                           decision,
                           b -> LibraryResult.success(new HoldPlacement(holdType, holdTill),
                                                      "Hold placed on book \"" + b.title() + "\" by patron \"" + patron.get().name() + "\""));
    }

    public LibraryResult<String> cancelHold(BookId bookId, PatronId patronId) {
        return cancelHold(bookId, patronId, DEFAULT_CANCEL_REASON);
    }

    public LibraryResult<String> cancelHold(BookId bookId, PatronId patronId, String reason) {
        requireNonNull(patronId, "You must provide a patronId");
        requireNonNull(reason, "You must provide a reason");
        var book = books.tryLoad(requireNonNull(bookId, "You must provide a bookId"));
        if (book.isEmpty()) {
            return bookNotFound(bookId);
        }
        var decision = book.get().cancelHold(patronId, reason, now());
        return persistBook(book.get(),
                           decision,
                           b -> LibraryResult.success(reason, "Hold canceled on book \"" + b.title() + "\""));
    }

    /**
     * Release a closed-ended hold whose expiration has passed. Used by the {@link DailySheetSweeper}
     */
    public LibraryResult<BookId> expireHold(BookId bookId) {
        var book = books.tryLoad(requireNonNull(bookId, "You must provide a bookId"));
        if (book.isEmpty()) {
            return bookNotFound(bookId);
        }
        var decision = book.get().expireHold(now());
        return persistBook(book.get(),
                           decision,
                           b -> LibraryResult.success(bookId, "Hold expired on book \"" + b.title() + "\""));
    }

    // ------------------------------------------------------------------------------------------------------------
    // Checkouts
    // ------------------------------------------------------------------------------------------------------------

    /**
     * Check out a book that's on hold by the same patron
     *
     * @return the due date of the checkout
     */
    public LibraryResult<Instant> checkout(BookId bookId, PatronId patronId) {
        requireNonNull(patronId, "You must provide a patronId");
        var book = books.tryLoad(requireNonNull(bookId, "You must provide a bookId"));
        if (book.isEmpty()) {
            return bookNotFound(bookId);
        }
        var decision = book.get().checkout(patronId, now());
        return persistBook(book.get(),
                           decision,
                           b -> LibraryResult.success(b.dueDate().orElseThrow(), "Book \"" + b.title() + "\" checked out"));
    }

    public LibraryResult<BookId> returnBook(BookId bookId, PatronId patronId) {
        requireNonNull(patronId, "You must provide a patronId");
        var book = books.tryLoad(requireNonNull(bookId, "You must provide a bookId"));
        if (book.isEmpty()) {
            return bookNotFound(bookId);
        }
        var decision = book.get().returnBook(patronId, now());
        return persistBook(book.get(),
                           decision,
                           b -> LibraryResult.success(bookId, "Book \"" + b.title() + "\" returned"));
    }

    /**
     * Register on the patron that its checkout of the book is overdue. Used by the {@link DailySheetSweeper}
     *
     * @return the patron's overdue count at the book's branch after the registration
     */
    public LibraryResult<Integer> registerOverdueCheckout(PatronId patronId, BookId bookId) {
        requireNonNull(patronId, "You must provide a patronId");
        requireNonNull(bookId, "You must provide a bookId");
        var book = books.tryLoad(bookId);
        if (book.isEmpty()) {
            return bookNotFound(bookId);
        }
        var patron = patrons.tryLoad(patronId);
        if (patron.isEmpty()) {
            return patronNotFound(patronId);
        }

        var now = now();
        if (book.get().state() != BookState.CHECKED_OUT || !book.get().checkedOutBy().orElseThrow().equals(patronId)) {
            return LibraryResult.failure(FailureKind.POLICY_VIOLATION, "Book is not checked out by the patron");
        }
        var dueDate = book.get().dueDate().orElseThrow();
        if (!now.isAfter(dueDate)) {
            return LibraryResult.failure(FailureKind.POLICY_VIOLATION, "Checkout is not overdue");
        }
        var branch   = book.get().libraryBranchId();
        var decision = patron.get().registerOverdue(bookId, branch, dueDate, now);
        return persistPatron(patron.get(),
                             decision,
                             p -> LibraryResult.success(p.overdueCountAt(branch),
                                                        "Overdue checkout of book \"" + book.get().title() + "\" registered for patron \"" + p.name() + "\""));
    }

    // ------------------------------------------------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------------------------------------------------

    public LibraryResult<BookSnapshot> getBook(BookId bookId) {
        return books.tryLoad(requireNonNull(bookId, "You must provide a bookId"))
                    .map(book -> LibraryResult.success(BookSnapshot.of(book)))
                    .orElseGet(() -> bookNotFound(bookId));
    }

    public LibraryResult<PatronSnapshot> getPatron(PatronId patronId) {
        return patrons.tryLoad(requireNonNull(patronId, "You must provide a patronId"))
                      .map(patron -> LibraryResult.success(PatronSnapshot.of(patron)))
                      .orElseGet(() -> patronNotFound(patronId));
    }

    /**
     * Direct access to the book aggregate, e.g. for the eligibility checks of other components
     */
    public Optional<Book> loadBook(BookId bookId) {
        return books.tryLoad(bookId);
    }

    public Optional<Patron> loadPatron(PatronId patronId) {
        return patrons.tryLoad(patronId);
    }

    // ------------------------------------------------------------------------------------------------------------

    private <T> LibraryResult<T> persistBook(Book book, Decision<BookEvent> decision, Function<Book, LibraryResult<T>> onSuccess) {
        return persist(books, book, decision, onSuccess);
    }

    private <T> LibraryResult<T> persistPatron(Patron patron, Decision<PatronEvent> decision, Function<Patron, LibraryResult<T>> onSuccess) {
        return persist(patrons, patron, decision, onSuccess);
    }

    private <ID, EVENT, AGGREGATE extends AggregateRoot<ID, EVENT, AGGREGATE>, T> LibraryResult<T> persist(EventSourcedAggregateRepository<ID, EVENT, AGGREGATE> repository,
                                                                                                        AGGREGATE aggregate,
                                                                                                        Decision<EVENT> decision,
                                                                                                        Function<AGGREGATE, LibraryResult<T>> onSuccess) {
        if (decision.isRejected()) {
            log.debug("[{}] {} rejected the change: {}",
                      repository.streamNameFor(aggregate.aggregateId()),
                      aggregate.getClass().getSimpleName(),
                      decision.rejectionReason().orElse(""));
            return LibraryResult.rejected(decision);
        }
        try {
            repository.persist(aggregate, newMetaData());
        } catch (OptimisticAppendToStreamException e) {
            log.debug("[{}] Concurrency conflict: {}", e.streamName, e.getMessage());
            return LibraryResult.failure(FailureKind.CONCURRENCY_CONFLICT, OptimisticAppendToStreamException.CONCURRENCY_CONFLICT);
        }
        return onSuccess.apply(aggregate);
    }

    private static <T> LibraryResult<T> bookNotFound(BookId bookId) {
        return LibraryResult.failure(FailureKind.NOT_FOUND, "Book not found: " + bookId);
    }

    private static <T> LibraryResult<T> patronNotFound(PatronId patronId) {
        return LibraryResult.failure(FailureKind.NOT_FOUND, "Patron not found: " + patronId);
    }

    private static EventMetaData newMetaData() {
        return EventMetaData.correlatedBy(CorrelationId.random());
    }

    private Instant now() {
        return clock.instant();
    }
}
