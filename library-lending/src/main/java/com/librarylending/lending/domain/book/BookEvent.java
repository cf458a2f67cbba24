package com.librarylending.lending.domain.book;

import com.fasterxml.jackson.annotation.*;
import com.librarylending.eventsourced.aggregates.EventTypeRegistry;
import com.librarylending.eventstore.types.*;
import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The events of the <code>book-{id}</code> streams.<br>
 * The hierarchy is closed: every handler implements {@link Visitor}, so adding an event type forces every
 * handler to decide what to do with it. Events that this version can't read are represented by {@link UnknownBookEvent}.
 */
public abstract class BookEvent {
    public static final EventType BOOK_ADDED_TO_LIBRARY = EventType.of("BookAddedToLibrary");
    public static final EventType BOOK_PLACED_ON_HOLD   = EventType.of("BookPlacedOnHold");
    public static final EventType BOOK_HOLD_CANCELED    = EventType.of("BookHoldCanceled");
    public static final EventType BOOK_HOLD_EXPIRED     = EventType.of("BookHoldExpired");
    public static final EventType BOOK_CHECKED_OUT      = EventType.of("BookCheckedOut");
    public static final EventType BOOK_RETURNED         = EventType.of("BookReturned");

    public final BookId bookId;

    private BookEvent(BookId bookId) {
        this.bookId = requireNonNull(bookId, "No bookId provided");
    }

    public abstract <R> R accept(Visitor<R> visitor);

    /**
     * Create the {@link EventTypeRegistry} covering all persisted {@link BookEvent}'s
     */
    public static EventTypeRegistry<BookEvent> eventTypeRegistry() {
        return new EventTypeRegistry<>(BookEvent.class,
                                       recordedEvent -> new UnknownBookEvent(BookId.of(recordedEvent.streamName().id()),
                                                                             recordedEvent.eventType().value()))
                .register(BOOK_ADDED_TO_LIBRARY, EventRevision.FIRST, BookAddedToLibrary.class)
                .register(BOOK_PLACED_ON_HOLD, EventRevision.FIRST, BookPlacedOnHold.class)
                .register(BOOK_HOLD_CANCELED, EventRevision.FIRST, BookHoldCanceled.class)
                .register(BOOK_HOLD_EXPIRED, EventRevision.FIRST, BookHoldExpired.class)
                .register(BOOK_CHECKED_OUT, EventRevision.FIRST, BookCheckedOut.class)
                .register(BOOK_RETURNED, EventRevision.FIRST, BookReturned.class);
    }

    public interface Visitor<R> {
        R visit(BookAddedToLibrary event);

        R visit(BookPlacedOnHold event);

        R visit(BookHoldCanceled event);

        R visit(BookHoldExpired event);

        R visit(BookCheckedOut event);

        R visit(BookReturned event);

        R visit(UnknownBookEvent event);
    }

    public static final class BookAddedToLibrary extends BookEvent {
        public final String          isbn;
        public final String          title;
        public final BookType        bookType;
        public final LibraryBranchId libraryBranchId;
        public final Instant         occurredAt;

        @JsonCreator
        public BookAddedToLibrary(@JsonProperty("bookId") BookId bookId,
                                  @JsonProperty("isbn") String isbn,
                                  @JsonProperty("title") String title,
                                  @JsonProperty("bookType") BookType bookType,
                                  @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                  @JsonProperty("occurredAt") Instant occurredAt) {
            super(bookId);
            this.isbn = isbn;
            this.title = title;
            this.bookType = bookType;
            this.libraryBranchId = libraryBranchId;
            this.occurredAt = occurredAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BookAddedToLibrary)) return false;
            var that = (BookAddedToLibrary) o;
            return bookId.equals(that.bookId) && Objects.equals(isbn, that.isbn) && Objects.equals(title, that.title) &&
                    bookType == that.bookType && Objects.equals(libraryBranchId, that.libraryBranchId) && Objects.equals(occurredAt, that.occurredAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bookId, isbn, title, bookType, libraryBranchId, occurredAt);
        }

        @Override
        public String toString() {
            return "BookAddedToLibrary{" +
                    "bookId=" + bookId +
                    ", isbn='" + isbn + '\'' +
                    ", title='" + title + '\'' +
                    ", bookType=" + bookType +
                    ", libraryBranchId=" + libraryBranchId +
                    '}';
        }
    }

    public static final class BookPlacedOnHold extends BookEvent {
        public final PatronId        patronId;
        public final LibraryBranchId libraryBranchId;
        public final HoldType        holdType;
        /**
         * null for open-ended holds
         */
        public final Instant         holdTill;
        public final Instant         holdPlacedAt;

        @JsonCreator
        public BookPlacedOnHold(@JsonProperty("bookId") BookId bookId,
                                @JsonProperty("patronId") PatronId patronId,
                                @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                @JsonProperty("holdType") HoldType holdType,
                                @JsonProperty("holdTill") Instant holdTill,
                                @JsonProperty("holdPlacedAt") Instant holdPlacedAt) {
            super(bookId);
            this.patronId = patronId;
            this.libraryBranchId = libraryBranchId;
            this.holdType = holdType;
            this.holdTill = holdTill;
            this.holdPlacedAt = holdPlacedAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BookPlacedOnHold)) return false;
            var that = (BookPlacedOnHold) o;
            return bookId.equals(that.bookId) && Objects.equals(patronId, that.patronId) && Objects.equals(libraryBranchId, that.libraryBranchId) &&
                    holdType == that.holdType && Objects.equals(holdTill, that.holdTill) && Objects.equals(holdPlacedAt, that.holdPlacedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bookId, patronId, libraryBranchId, holdType, holdTill, holdPlacedAt);
        }

        @Override
        public String toString() {
            return "BookPlacedOnHold{" +
                    "bookId=" + bookId +
                    ", patronId=" + patronId +
                    ", holdType=" + holdType +
                    ", holdTill=" + holdTill +
                    '}';
        }
    }

    public static final class BookHoldCanceled extends BookEvent {
        public final PatronId        patronId;
        public final LibraryBranchId libraryBranchId;
        public final String          reason;
        public final Instant         canceledAt;

        @JsonCreator
        public BookHoldCanceled(@JsonProperty("bookId") BookId bookId,
                                @JsonProperty("patronId") PatronId patronId,
                                @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                @JsonProperty("reason") String reason,
                                @JsonProperty("canceledAt") Instant canceledAt) {
            super(bookId);
            this.patronId = patronId;
            this.libraryBranchId = libraryBranchId;
            this.reason = reason;
            this.canceledAt = canceledAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BookHoldCanceled)) return false;
            var that = (BookHoldCanceled) o;
            return bookId.equals(that.bookId) && Objects.equals(patronId, that.patronId) && Objects.equals(libraryBranchId, that.libraryBranchId) &&
                    Objects.equals(reason, that.reason) && Objects.equals(canceledAt, that.canceledAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bookId, patronId, libraryBranchId, reason, canceledAt);
        }

        @Override
        public String toString() {
            return "BookHoldCanceled{" +
                    "bookId=" + bookId +
                    ", patronId=" + patronId +
                    ", reason='" + reason + '\'' +
                    '}';
        }
    }

    public static final class BookHoldExpired extends BookEvent {
        public final PatronId        patronId;
        public final LibraryBranchId libraryBranchId;
        public final Instant         expiredAt;

        @JsonCreator
        public BookHoldExpired(@JsonProperty("bookId") BookId bookId,
                               @JsonProperty("patronId") PatronId patronId,
                               @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                               @JsonProperty("expiredAt") Instant expiredAt) {
            super(bookId);
            this.patronId = patronId;
            this.libraryBranchId = libraryBranchId;
            this.expiredAt = expiredAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BookHoldExpired)) return false;
            var that = (BookHoldExpired) o;
            return bookId.equals(that.bookId) && Objects.equals(patronId, that.patronId) && Objects.equals(libraryBranchId, that.libraryBranchId) &&
                    Objects.equals(expiredAt, that.expiredAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bookId, patronId, libraryBranchId, expiredAt);
        }

        @Override
        public String toString() {
            return "BookHoldExpired{" +
                    "bookId=" + bookId +
                    ", patronId=" + patronId +
                    ", expiredAt=" + expiredAt +
                    '}';
        }
    }

    public static final class BookCheckedOut extends BookEvent {
        public final PatronId        patronId;
        public final LibraryBranchId libraryBranchId;
        public final Instant         checkedOutAt;
        public final Instant         dueDate;

        @JsonCreator
        public BookCheckedOut(@JsonProperty("bookId") BookId bookId,
                              @JsonProperty("patronId") PatronId patronId,
                              @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                              @JsonProperty("checkedOutAt") Instant checkedOutAt,
                              @JsonProperty("dueDate") Instant dueDate) {
            super(bookId);
            this.patronId = patronId;
            this.libraryBranchId = libraryBranchId;
            this.checkedOutAt = checkedOutAt;
            this.dueDate = dueDate;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BookCheckedOut)) return false;
            var that = (BookCheckedOut) o;
            return bookId.equals(that.bookId) && Objects.equals(patronId, that.patronId) && Objects.equals(libraryBranchId, that.libraryBranchId) &&
                    Objects.equals(checkedOutAt, that.checkedOutAt) && Objects.equals(dueDate, that.dueDate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bookId, patronId, libraryBranchId, checkedOutAt, dueDate);
        }

        @Override
        public String toString() {
            return "BookCheckedOut{" +
                    "bookId=" + bookId +
                    ", patronId=" + patronId +
                    ", dueDate=" + dueDate +
                    '}';
        }
    }

    public static final class BookReturned extends BookEvent {
        public final PatronId        patronId;
        public final LibraryBranchId libraryBranchId;
        public final Instant         returnedAt;

        @JsonCreator
        public BookReturned(@JsonProperty("bookId") BookId bookId,
                            @JsonProperty("patronId") PatronId patronId,
                            @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                            @JsonProperty("returnedAt") Instant returnedAt) {
            super(bookId);
            this.patronId = patronId;
            this.libraryBranchId = libraryBranchId;
            this.returnedAt = returnedAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BookReturned)) return false;
            var that = (BookReturned) o;
            return bookId.equals(that.bookId) && Objects.equals(patronId, that.patronId) && Objects.equals(libraryBranchId, that.libraryBranchId) &&
                    Objects.equals(returnedAt, that.returnedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bookId, patronId, libraryBranchId, returnedAt);
        }

        @Override
        public String toString() {
            return "BookReturned{" +
                    "bookId=" + bookId +
                    ", patronId=" + patronId +
                    ", returnedAt=" + returnedAt +
                    '}';
        }
    }

    /**
     * An event of a type (or schema revision) this version of the application doesn't know. Never persisted.
     */
    public static final class UnknownBookEvent extends BookEvent {
        public final String eventType;

        public UnknownBookEvent(BookId bookId, String eventType) {
            super(bookId);
            this.eventType = requireNonNull(eventType, "No eventType provided");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public String toString() {
            return "UnknownBookEvent{" +
                    "bookId=" + bookId +
                    ", eventType='" + eventType + '\'' +
                    '}';
        }
    }
}
