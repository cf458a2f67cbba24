package com.librarylending.lending.domain.patron;

import com.fasterxml.jackson.annotation.*;
import com.librarylending.eventsourced.aggregates.EventTypeRegistry;
import com.librarylending.eventstore.types.*;
import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The events of the <code>patron-{id}</code> streams.<br>
 * The <code>Patron...Recorded</code>/<code>PatronHold...</code> events are the patron's own record of book events
 * (the book stream stays the source of truth) and carry the stream revision of the book event they record.
 */
public abstract class PatronEvent {
    public static final EventType PATRON_CREATED              = EventType.of("PatronCreated");
    public static final EventType PATRON_TYPE_UPGRADED        = EventType.of("PatronTypeUpgraded");
    public static final EventType PATRON_HOLD_PLACED          = EventType.of("PatronHoldPlaced");
    public static final EventType PATRON_HOLD_CANCELED        = EventType.of("PatronHoldCanceled");
    public static final EventType PATRON_CHECKOUT_RECORDED    = EventType.of("PatronCheckoutRecorded");
    public static final EventType PATRON_RETURN_RECORDED      = EventType.of("PatronReturnRecorded");
    public static final EventType OVERDUE_CHECKOUT_REGISTERED = EventType.of("OverdueCheckoutRegistered");

    public final PatronId patronId;

    private PatronEvent(PatronId patronId) {
        this.patronId = requireNonNull(patronId, "No patronId provided");
    }

    public abstract <R> R accept(Visitor<R> visitor);

    public static EventTypeRegistry<PatronEvent> eventTypeRegistry() {
        return new EventTypeRegistry<>(PatronEvent.class,
                                       recordedEvent -> new UnknownPatronEvent(PatronId.of(recordedEvent.streamName().id()),
                                                                               recordedEvent.eventType().value()))
                .register(PATRON_CREATED, EventRevision.FIRST, PatronCreated.class)
                .register(PATRON_TYPE_UPGRADED, EventRevision.FIRST, PatronTypeUpgraded.class)
                .register(PATRON_HOLD_PLACED, EventRevision.FIRST, PatronHoldPlaced.class)
                .register(PATRON_HOLD_CANCELED, EventRevision.FIRST, PatronHoldCanceled.class)
                .register(PATRON_CHECKOUT_RECORDED, EventRevision.FIRST, PatronCheckoutRecorded.class)
                .register(PATRON_RETURN_RECORDED, EventRevision.FIRST, PatronReturnRecorded.class)
                .register(OVERDUE_CHECKOUT_REGISTERED, EventRevision.FIRST, OverdueCheckoutRegistered.class);
    }

    public interface Visitor<R> {
        R visit(PatronCreated event);

        R visit(PatronTypeUpgraded event);

        R visit(PatronHoldPlaced event);

        R visit(PatronHoldCanceled event);

        R visit(PatronCheckoutRecorded event);

        R visit(PatronReturnRecorded event);

        R visit(OverdueCheckoutRegistered event);

        R visit(UnknownPatronEvent event);
    }

    public static final class PatronCreated extends PatronEvent {
        public final PatronType patronType;
        public final String     name;
        public final String     email;
        public final Instant    createdAt;

        @JsonCreator
        public PatronCreated(@JsonProperty("patronId") PatronId patronId,
                             @JsonProperty("patronType") PatronType patronType,
                             @JsonProperty("name") String name,
                             @JsonProperty("email") String email,
                             @JsonProperty("createdAt") Instant createdAt) {
            super(patronId);
            this.patronType = patronType;
            this.name = name;
            this.email = email;
            this.createdAt = createdAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PatronCreated)) return false;
            var that = (PatronCreated) o;
            return patronId.equals(that.patronId) && patronType == that.patronType && Objects.equals(name, that.name) &&
                    Objects.equals(email, that.email) && Objects.equals(createdAt, that.createdAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(patronId, patronType, name, email, createdAt);
        }
    }

    public static final class PatronTypeUpgraded extends PatronEvent {
        public final PatronType newType;
        public final Instant    upgradedAt;

        @JsonCreator
        public PatronTypeUpgraded(@JsonProperty("patronId") PatronId patronId,
                                  @JsonProperty("newType") PatronType newType,
                                  @JsonProperty("upgradedAt") Instant upgradedAt) {
            super(patronId);
            this.newType = newType;
            this.upgradedAt = upgradedAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PatronTypeUpgraded)) return false;
            var that = (PatronTypeUpgraded) o;
            return patronId.equals(that.patronId) && newType == that.newType && Objects.equals(upgradedAt, that.upgradedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(patronId, newType, upgradedAt);
        }
    }

    public static final class PatronHoldPlaced extends PatronEvent {
        public final BookId          bookId;
        public final LibraryBranchId libraryBranchId;
        public final HoldType        holdType;
        /**
         * null for open-ended holds
         */
        public final Instant         holdTill;
        public final long            bookStreamRevision;
        public final Instant         recordedAt;

        @JsonCreator
        public PatronHoldPlaced(@JsonProperty("patronId") PatronId patronId,
                                @JsonProperty("bookId") BookId bookId,
                                @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                @JsonProperty("holdType") HoldType holdType,
                                @JsonProperty("holdTill") Instant holdTill,
                                @JsonProperty("bookStreamRevision") long bookStreamRevision,
                                @JsonProperty("recordedAt") Instant recordedAt) {
            super(patronId);
            this.bookId = bookId;
            this.libraryBranchId = libraryBranchId;
            this.holdType = holdType;
            this.holdTill = holdTill;
            this.bookStreamRevision = bookStreamRevision;
            this.recordedAt = recordedAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PatronHoldPlaced)) return false;
            var that = (PatronHoldPlaced) o;
            return patronId.equals(that.patronId) && bookStreamRevision == that.bookStreamRevision && Objects.equals(bookId, that.bookId) &&
                    Objects.equals(libraryBranchId, that.libraryBranchId) && holdType == that.holdType && Objects.equals(holdTill, that.holdTill) &&
                    Objects.equals(recordedAt, that.recordedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(patronId, bookId, libraryBranchId, holdType, holdTill, bookStreamRevision, recordedAt);
        }
    }

    /**
     * Records that a hold ended without a checkout, i.e. it was canceled or it expired
     */
    public static final class PatronHoldCanceled extends PatronEvent {
        public final BookId          bookId;
        public final LibraryBranchId libraryBranchId;
        public final long            bookStreamRevision;
        public final Instant         recordedAt;

        @JsonCreator
        public PatronHoldCanceled(@JsonProperty("patronId") PatronId patronId,
                                  @JsonProperty("bookId") BookId bookId,
                                  @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                  @JsonProperty("bookStreamRevision") long bookStreamRevision,
                                  @JsonProperty("recordedAt") Instant recordedAt) {
            super(patronId);
            this.bookId = bookId;
            this.libraryBranchId = libraryBranchId;
            this.bookStreamRevision = bookStreamRevision;
            this.recordedAt = recordedAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PatronHoldCanceled)) return false;
            var that = (PatronHoldCanceled) o;
            return patronId.equals(that.patronId) && bookStreamRevision == that.bookStreamRevision && Objects.equals(bookId, that.bookId) &&
                    Objects.equals(libraryBranchId, that.libraryBranchId) && Objects.equals(recordedAt, that.recordedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(patronId, bookId, libraryBranchId, bookStreamRevision, recordedAt);
        }
    }

    public static final class PatronCheckoutRecorded extends PatronEvent {
        public final BookId          bookId;
        public final LibraryBranchId libraryBranchId;
        public final Instant         checkedOutAt;
        public final Instant         dueDate;
        public final long            bookStreamRevision;
        public final Instant         recordedAt;

        @JsonCreator
        public PatronCheckoutRecorded(@JsonProperty("patronId") PatronId patronId,
                                      @JsonProperty("bookId") BookId bookId,
                                      @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                      @JsonProperty("checkedOutAt") Instant checkedOutAt,
                                      @JsonProperty("dueDate") Instant dueDate,
                                      @JsonProperty("bookStreamRevision") long bookStreamRevision,
                                      @JsonProperty("recordedAt") Instant recordedAt) {
            super(patronId);
            this.bookId = bookId;
            this.libraryBranchId = libraryBranchId;
            this.checkedOutAt = checkedOutAt;
            this.dueDate = dueDate;
            this.bookStreamRevision = bookStreamRevision;
            this.recordedAt = recordedAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PatronCheckoutRecorded)) return false;
            var that = (PatronCheckoutRecorded) o;
            return patronId.equals(that.patronId) && bookStreamRevision == that.bookStreamRevision && Objects.equals(bookId, that.bookId) &&
                    Objects.equals(libraryBranchId, that.libraryBranchId) && Objects.equals(checkedOutAt, that.checkedOutAt) &&
                    Objects.equals(dueDate, that.dueDate) && Objects.equals(recordedAt, that.recordedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(patronId, bookId, libraryBranchId, checkedOutAt, dueDate, bookStreamRevision, recordedAt);
        }
    }

    public static final class PatronReturnRecorded extends PatronEvent {
        public final BookId          bookId;
        public final LibraryBranchId libraryBranchId;
        public final long            bookStreamRevision;
        public final Instant         recordedAt;

        @JsonCreator
        public PatronReturnRecorded(@JsonProperty("patronId") PatronId patronId,
                                    @JsonProperty("bookId") BookId bookId,
                                    @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                    @JsonProperty("bookStreamRevision") long bookStreamRevision,
                                    @JsonProperty("recordedAt") Instant recordedAt) {
            super(patronId);
            this.bookId = bookId;
            this.libraryBranchId = libraryBranchId;
            this.bookStreamRevision = bookStreamRevision;
            this.recordedAt = recordedAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof PatronReturnRecorded)) return false;
            var that = (PatronReturnRecorded) o;
            return patronId.equals(that.patronId) && bookStreamRevision == that.bookStreamRevision && Objects.equals(bookId, that.bookId) &&
                    Objects.equals(libraryBranchId, that.libraryBranchId) && Objects.equals(recordedAt, that.recordedAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(patronId, bookId, libraryBranchId, bookStreamRevision, recordedAt);
        }
    }

    public static final class OverdueCheckoutRegistered extends PatronEvent {
        public final BookId          bookId;
        public final LibraryBranchId libraryBranchId;
        public final Instant         dueDate;
        public final Instant         registeredAt;

        @JsonCreator
        public OverdueCheckoutRegistered(@JsonProperty("patronId") PatronId patronId,
                                         @JsonProperty("bookId") BookId bookId,
                                         @JsonProperty("libraryBranchId") LibraryBranchId libraryBranchId,
                                         @JsonProperty("dueDate") Instant dueDate,
                                         @JsonProperty("registeredAt") Instant registeredAt) {
            super(patronId);
            this.bookId = bookId;
            this.libraryBranchId = libraryBranchId;
            this.dueDate = dueDate;
            this.registeredAt = registeredAt;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof OverdueCheckoutRegistered)) return false;
            var that = (OverdueCheckoutRegistered) o;
            return patronId.equals(that.patronId) && Objects.equals(bookId, that.bookId) && Objects.equals(libraryBranchId, that.libraryBranchId) &&
                    Objects.equals(dueDate, that.dueDate) && Objects.equals(registeredAt, that.registeredAt);
        }

        @Override
        public int hashCode() {
            return Objects.hash(patronId, bookId, libraryBranchId, dueDate, registeredAt);
        }
    }

    public static final class UnknownPatronEvent extends PatronEvent {
        public final String eventType;

        public UnknownPatronEvent(PatronId patronId, String eventType) {
            super(patronId);
            this.eventType = requireNonNull(eventType, "No eventType provided");
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visit(this);
        }
    }
}
