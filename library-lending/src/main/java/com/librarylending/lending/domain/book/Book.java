package com.librarylending.lending.domain.book;

import com.librarylending.eventsourced.aggregates.*;
import com.librarylending.eventstore.types.StreamName;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.BookEvent.*;

import java.time.*;
import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * The book lifecycle: <code>Available -> OnHold -> CheckedOut -> Available</code>, plus <code>OnHold -> Available</code>
 * when a hold is canceled or expires.<br>
 * Only available books can be placed on hold and only the holding patron can check a book out.
 * Restricted books can only be held by researchers.
 */
public class Book extends AggregateRoot<BookId, BookEvent, Book> {
    public static final String   STREAM_CATEGORY       = "book";
    public static final Duration MAX_CHECKOUT_DURATION = Duration.ofDays(60);

    private final StateUpdater stateUpdater = new StateUpdater();

    private String          isbn;
    private String          title;
    private BookType        bookType;
    private LibraryBranchId libraryBranchId;
    private BookState       state;
    private PatronId        holdingPatronId;
    private HoldType        holdType;
    private Instant         holdTill;
    private PatronId        checkedOutBy;
    private Instant         dueDate;

    /**
     * Used for rehydration
     */
    public Book(BookId bookId) {
        super(bookId);
    }

    public static StreamName streamName(BookId bookId) {
        return StreamName.of(STREAM_CATEGORY, bookId);
    }

    public static Book addToLibrary(BookId bookId, String isbn, String title, BookType bookType, LibraryBranchId libraryBranchId, Instant now) {
        requireNonNull(isbn, "You must provide an isbn");
        requireTrue(!isbn.isBlank(), "You must provide an isbn");
        requireNonNull(title, "You must provide a title");
        requireTrue(!title.isBlank(), "You must provide a title");
        requireNonNull(bookType, "You must provide a bookType");
        requireNonNull(libraryBranchId, "You must provide a libraryBranchId");
        requireNonNull(now, "You must provide now");
        var book = new Book(bookId);
        book.apply(new BookAddedToLibrary(bookId, isbn, title, bookType, libraryBranchId, now));
        return book;
    }

    /**
     * @param holdTill when the hold expires; must be provided for {@link HoldType#CLOSED_ENDED} holds and must be null
     *                 for {@link HoldType#OPEN_ENDED} holds
     */
    public Decision<BookEvent> placeOnHold(PatronId patronId, PatronType patronType, HoldType holdType, Instant holdTill, Instant now) {
        requireNonNull(patronId, "You must provide a patronId");
        requireNonNull(patronType, "You must provide a patronType");
        requireNonNull(holdType, "You must provide a holdType");
        requireNonNull(now, "You must provide now");
        if (holdType == HoldType.CLOSED_ENDED) {
            requireNonNull(holdTill, "A closed-ended hold requires a holdTill");
        } else {
            requireTrue(holdTill == null, "An open-ended hold doesn't expire");
        }

        if (state != BookState.AVAILABLE) {
            return Decision.invalidState("Cannot place hold on book in state: " + state.label());
        }
        if (bookType == BookType.RESTRICTED && patronType != PatronType.RESEARCHER) {
            return Decision.policyViolation("Only researchers can hold restricted books");
        }
        if (holdType == HoldType.OPEN_ENDED && patronType != PatronType.RESEARCHER) {
            return Decision.policyViolation("Only researchers can request open-ended holds");
        }
        return accept(new BookPlacedOnHold(aggregateId(), patronId, libraryBranchId, holdType, holdTill, now));
    }

    public Decision<BookEvent> cancelHold(PatronId patronId, String reason, Instant now) {
        requireNonNull(patronId, "You must provide a patronId");
        requireNonNull(reason, "You must provide a reason");
        requireNonNull(now, "You must provide now");
        if (state != BookState.ON_HOLD) {
            return Decision.invalidState("Book is not on hold");
        }
        if (!holdingPatronId.equals(patronId)) {
            return Decision.policyViolation("Only the holding patron can cancel the hold");
        }
        return accept(new BookHoldCanceled(aggregateId(), patronId, libraryBranchId, reason, now));
    }

    /**
     * Check out the book to the patron holding it. The due date is always {@link #MAX_CHECKOUT_DURATION} after <code>now</code>.
     */
    public Decision<BookEvent> checkout(PatronId patronId, Instant now) {
        requireNonNull(patronId, "You must provide a patronId");
        requireNonNull(now, "You must provide now");
        if (state != BookState.ON_HOLD) {
            return Decision.invalidState("Book must be on hold to checkout");
        }
        if (!holdingPatronId.equals(patronId)) {
            return Decision.policyViolation("Book is on hold by another patron");
        }
        return accept(new BookCheckedOut(aggregateId(), patronId, libraryBranchId, now, now.plus(MAX_CHECKOUT_DURATION)));
    }

    public Decision<BookEvent> returnBook(PatronId patronId, Instant now) {
        requireNonNull(patronId, "You must provide a patronId");
        requireNonNull(now, "You must provide now");
        if (state != BookState.CHECKED_OUT) {
            return Decision.invalidState("Book is not checked out");
        }
        if (!checkedOutBy.equals(patronId)) {
            return Decision.policyViolation("Book was checked out by another patron");
        }
        return accept(new BookReturned(aggregateId(), patronId, libraryBranchId, now));
    }

    /**
     * Pure query: is the book on a closed-ended hold whose expiration is before <code>now</code>
     */
    public boolean isHoldExpired(Instant now) {
        requireNonNull(now, "You must provide now");
        return state == BookState.ON_HOLD && holdTill != null && now.isAfter(holdTill);
    }

    /**
     * Release an expired hold on behalf of the library (the book doesn't expire its own holds)
     */
    public Decision<BookEvent> expireHold(Instant now) {
        requireNonNull(now, "You must provide now");
        if (state != BookState.ON_HOLD) {
            return Decision.invalidState("Book is not on hold");
        }
        if (!isHoldExpired(now)) {
            return Decision.invalidState("Hold has not expired");
        }
        return accept(new BookHoldExpired(aggregateId(), holdingPatronId, libraryBranchId, now));
    }

    @Override
    protected void applyEventToTheAggregate(BookEvent event) {
        event.accept(stateUpdater);
    }

    public String isbn() {
        return isbn;
    }

    public String title() {
        return title;
    }

    public BookType bookType() {
        return bookType;
    }

    public LibraryBranchId libraryBranchId() {
        return libraryBranchId;
    }

    public BookState state() {
        return state;
    }

    public Optional<PatronId> holdingPatronId() {
        return Optional.ofNullable(holdingPatronId);
    }

    public Optional<HoldType> holdType() {
        return Optional.ofNullable(holdType);
    }

    public Optional<Instant> holdTill() {
        return Optional.ofNullable(holdTill);
    }

    public Optional<PatronId> checkedOutBy() {
        return Optional.ofNullable(checkedOutBy);
    }

    public Optional<Instant> dueDate() {
        return Optional.ofNullable(dueDate);
    }

    private void clearHold() {
        holdingPatronId = null;
        holdType = null;
        holdTill = null;
    }

    private class StateUpdater implements BookEvent.Visitor<Void> {
        @Override
        public Void visit(BookAddedToLibrary event) {
            isbn = event.isbn;
            title = event.title;
            bookType = event.bookType;
            libraryBranchId = event.libraryBranchId;
            state = BookState.AVAILABLE;
            return null;
        }

        @Override
        public Void visit(BookPlacedOnHold event) {
            state = BookState.ON_HOLD;
            holdingPatronId = event.patronId;
            holdType = event.holdType;
            holdTill = event.holdTill;
            return null;
        }

        @Override
        public Void visit(BookHoldCanceled event) {
            state = BookState.AVAILABLE;
            clearHold();
            return null;
        }

        @Override
        public Void visit(BookHoldExpired event) {
            state = BookState.AVAILABLE;
            clearHold();
            return null;
        }

        @Override
        public Void visit(BookCheckedOut event) {
            state = BookState.CHECKED_OUT;
            checkedOutBy = event.patronId;
            dueDate = event.dueDate;
            clearHold();
            return null;
        }

        @Override
        public Void visit(BookReturned event) {
            state = BookState.AVAILABLE;
            checkedOutBy = null;
            dueDate = null;
            return null;
        }

        @Override
        public Void visit(UnknownBookEvent event) {
            return null;
        }
    }
}
