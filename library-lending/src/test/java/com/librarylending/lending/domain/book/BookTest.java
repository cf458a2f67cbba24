package com.librarylending.lending.domain.book;

import com.librarylending.eventsourced.aggregates.Decision.RejectionKind;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.BookEvent.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BookTest {
    private static final Instant         NOW     = Instant.parse("2024-05-01T08:00:00Z");
    private static final LibraryBranchId BRANCH  = LibraryBranchId.of("branch-1");
    private static final PatronId        PATRON  = PatronId.of("patron-1");
    private static final PatronId        OTHER   = PatronId.of("patron-2");
    private static final Instant         IN_WEEK = NOW.plus(Duration.ofDays(7));

    private static Book circulatingBook() {
        return Book.addToLibrary(BookId.of("book-1"), "978-0134685991", "Effective Java", BookType.CIRCULATING, BRANCH, NOW);
    }

    private static Book restrictedBook() {
        return Book.addToLibrary(BookId.of("book-2"), "978-0201633610", "Design Patterns", BookType.RESTRICTED, BRANCH, NOW);
    }

    @Test
    void verify_added_book_is_available() {
        var book = circulatingBook();

        assertThat(book.state()).isEqualTo(BookState.AVAILABLE);
        assertThat(book.title()).isEqualTo("Effective Java");
        assertThat((Object) book.libraryBranchId()).isEqualTo(BRANCH);
        assertThat(book.uncommittedChanges()).hasSize(1).first().isInstanceOf(BookAddedToLibrary.class);
    }

    @Test
    void verify_full_lending_cycle() {
        // Given
        var book = circulatingBook();

        // When
        var hold     = book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        var checkout = book.checkout(PATRON, NOW.plusSeconds(60));
        var returned = book.returnBook(PATRON, NOW.plus(Duration.ofDays(3)));

        // Then
        assertThat(hold.isAccepted()).isTrue();
        assertThat(checkout.isAccepted()).isTrue();
        assertThat(returned.isAccepted()).isTrue();
        assertThat(book.state()).isEqualTo(BookState.AVAILABLE);
        assertThat(book.checkedOutBy()).isEmpty();
        assertThat(book.dueDate()).isEmpty();
        assertThat(book.uncommittedChanges()).extracting(Object::getClass)
                                             .containsExactly(BookAddedToLibrary.class,
                                                              BookPlacedOnHold.class,
                                                              BookCheckedOut.class,
                                                              BookReturned.class);
    }

    @Test
    void verify_placing_a_hold_records_holder_and_expiration() {
        var book = circulatingBook();

        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);

        assertThat(book.state()).isEqualTo(BookState.ON_HOLD);
        assertThat(book.holdingPatronId()).hasValue(PATRON);
        assertThat(book.holdType()).hasValue(HoldType.CLOSED_ENDED);
        assertThat(book.holdTill()).hasValue(IN_WEEK);
    }

    @Test
    void verify_hold_on_a_book_that_is_not_available_is_rejected_without_an_event() {
        // Given
        var book = circulatingBook();
        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        var eventsBefore = book.uncommittedChanges().size();

        // When
        var decision = book.placeOnHold(OTHER, PatronType.RESEARCHER, HoldType.CLOSED_ENDED, IN_WEEK, NOW);

        // Then
        assertThat(decision.isRejected()).isTrue();
        assertThat(decision.rejectionKind()).hasValue(RejectionKind.INVALID_STATE);
        assertThat(decision.rejectionReason()).hasValue("Cannot place hold on book in state: OnHold");
        assertThat(book.uncommittedChanges()).hasSize(eventsBefore);
        assertThat(book.holdingPatronId()).hasValue(PATRON);
    }

    @Test
    void verify_restricted_book_can_only_be_held_by_researchers() {
        var book = restrictedBook();

        var regular = book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        assertThat(regular.rejectionKind()).hasValue(RejectionKind.POLICY_VIOLATION);
        assertThat(regular.rejectionReason()).hasValue("Only researchers can hold restricted books");
        assertThat(book.state()).isEqualTo(BookState.AVAILABLE);

        var researcher = book.placeOnHold(PATRON, PatronType.RESEARCHER, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        assertThat(researcher.isAccepted()).isTrue();
    }

    @Test
    void verify_open_ended_hold_requires_a_researcher() {
        var book = circulatingBook();

        var regular = book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.OPEN_ENDED, null, NOW);
        assertThat(regular.rejectionReason()).hasValue("Only researchers can request open-ended holds");

        var researcher = book.placeOnHold(PATRON, PatronType.RESEARCHER, HoldType.OPEN_ENDED, null, NOW);
        assertThat(researcher.isAccepted()).isTrue();
        assertThat(book.holdTill()).isEmpty();
        assertThat(book.isHoldExpired(NOW.plus(Duration.ofDays(1000)))).isFalse();
    }

    @Test
    void verify_hold_type_and_expiration_must_match() {
        var book = circulatingBook();

        assertThatThrownBy(() -> book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, null, NOW))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> book.placeOnHold(PATRON, PatronType.RESEARCHER, HoldType.OPEN_ENDED, IN_WEEK, NOW))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void verify_only_the_holding_patron_can_cancel_the_hold() {
        var book = circulatingBook();
        assertThat(book.cancelHold(PATRON, "Changed my mind", NOW).rejectionReason()).hasValue("Book is not on hold");

        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        assertThat(book.cancelHold(OTHER, "Changed my mind", NOW).rejectionReason()).hasValue("Only the holding patron can cancel the hold");

        var canceled = book.cancelHold(PATRON, "Changed my mind", NOW);
        assertThat(canceled.isAccepted()).isTrue();
        assertThat(((BookHoldCanceled) canceled.event()).reason).isEqualTo("Changed my mind");
        assertThat(book.state()).isEqualTo(BookState.AVAILABLE);
        assertThat(book.holdingPatronId()).isEmpty();
    }

    @Test
    void verify_checkout_requires_the_holding_patron() {
        var book = circulatingBook();
        assertThat(book.checkout(PATRON, NOW).rejectionReason()).hasValue("Book must be on hold to checkout");

        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        assertThat(book.checkout(OTHER, NOW).rejectionReason()).hasValue("Book is on hold by another patron");
        assertThat(book.state()).isEqualTo(BookState.ON_HOLD);
    }

    @Test
    void verify_due_date_is_always_60_days_after_checkout() {
        var book = circulatingBook();
        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        var checkedOutAt = NOW.plus(Duration.ofHours(5));

        var decision = book.checkout(PATRON, checkedOutAt);

        var event = (BookCheckedOut) decision.event();
        assertThat(event.checkedOutAt).isEqualTo(checkedOutAt);
        assertThat(event.dueDate).isEqualTo(checkedOutAt.plus(Duration.ofDays(60)));
        assertThat(book.dueDate()).hasValue(checkedOutAt.plus(Book.MAX_CHECKOUT_DURATION));
        assertThat(book.checkedOutBy()).hasValue(PATRON);
        assertThat(book.holdingPatronId()).isEmpty();
    }

    @Test
    void verify_only_the_borrower_can_return_the_book() {
        var book = circulatingBook();
        assertThat(book.returnBook(PATRON, NOW).rejectionReason()).hasValue("Book is not checked out");

        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        book.checkout(PATRON, NOW);
        assertThat(book.returnBook(OTHER, NOW).rejectionReason()).hasValue("Book was checked out by another patron");
        assertThat(book.state()).isEqualTo(BookState.CHECKED_OUT);
    }

    @Test
    void verify_hold_expiration() {
        var book = circulatingBook();
        assertThat(book.isHoldExpired(NOW)).isFalse();
        assertThat(book.expireHold(NOW).rejectionReason()).hasValue("Book is not on hold");

        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        assertThat(book.isHoldExpired(IN_WEEK)).isFalse();
        assertThat(book.expireHold(IN_WEEK).rejectionReason()).hasValue("Hold has not expired");

        var afterExpiration = IN_WEEK.plusMillis(1);
        assertThat(book.isHoldExpired(afterExpiration)).isTrue();
        var expired = book.expireHold(afterExpiration);
        assertThat(expired.isAccepted()).isTrue();
        assertThat((Object) ((BookHoldExpired) expired.event()).patronId).isEqualTo(PATRON);
        assertThat(book.state()).isEqualTo(BookState.AVAILABLE);
    }

    @Test
    void verify_replaying_the_same_events_yields_the_same_state() {
        // Given
        var book = circulatingBook();
        book.placeOnHold(PATRON, PatronType.REGULAR, HoldType.CLOSED_ENDED, IN_WEEK, NOW);
        book.checkout(PATRON, NOW);
        var events = book.uncommittedChanges();

        // When
        var first  = new Book(book.aggregateId()).rehydrate(events.stream());
        var second = new Book(book.aggregateId()).rehydrate(events.stream());

        // Then
        for (var replayed : List.of(first, second)) {
            assertThat(replayed.state()).isEqualTo(BookState.CHECKED_OUT);
            assertThat(replayed.checkedOutBy()).hasValue(PATRON);
            assertThat(replayed.dueDate()).isEqualTo(book.dueDate());
            assertThat(replayed.eventOrderOfLastRehydratedEvent()).isEqualTo(2);
            assertThat(replayed.hasUncommittedChanges()).isFalse();
        }
    }

    @Test
    void verify_unknown_events_are_ignored_during_replay() {
        var bookId = BookId.of("book-1");
        var events = List.<BookEvent>of(new BookAddedToLibrary(bookId, "isbn", "Title", BookType.CIRCULATING, BRANCH, NOW),
                                                  new UnknownBookEvent(bookId, "BookRelabeled"));

        var book = new Book(bookId).rehydrate(events.stream());

        assertThat(book.state()).isEqualTo(BookState.AVAILABLE);
        assertThat(book.eventOrderOfLastRehydratedEvent()).isEqualTo(1);
    }
}
