package com.librarylending.lending.projections;

import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventstore.EventStore;
import com.librarylending.eventstore.eventstream.RecordedEvent;
import com.librarylending.lending.application.LibraryConfiguration;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.BookEvent;
import com.librarylending.lending.domain.book.BookEvent.*;

import java.time.*;
import java.util.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The librarian's daily sheet: which holds expire on a given (UTC) day and which patrons have overdue checkouts.<br>
 * A hold is listed as expiring until it ends, i.e. until it's canceled, expired or the book is checked out.
 * Overdue checkouts are detected by {@link #updateOverdueCheckouts(Instant)} and listed until the book is returned.
 */
public class DailySheetProjection extends BookEventProjection {
    public static final SubscriberId SUBSCRIBER_ID = SubscriberId.of("DailySheetProjection");

    private final Map<BookId, ActiveHold>                     activeHolds      = new LinkedHashMap<>();
    private final Map<BookId, ActiveCheckout>                 activeCheckouts  = new LinkedHashMap<>();
    private final Map<LocalDate, Map<BookId, ActiveHold>>     expiringHolds    = new TreeMap<>();
    private final Map<PatronId, Map<BookId, OverdueCheckout>> overdueCheckouts = new LinkedHashMap<>();
    private final Applier                                     applier          = new Applier();

    public DailySheetProjection(EventStore eventStore, LibraryConfiguration configuration, Clock clock) {
        super(SUBSCRIBER_ID, eventStore, configuration, clock);
    }

    @Override
    protected void apply(BookEvent event, RecordedEvent recordedEvent) {
        event.accept(applier);
    }

    @Override
    protected void clear() {
        activeHolds.clear();
        activeCheckouts.clear();
        expiringHolds.clear();
        overdueCheckouts.clear();
    }

    /**
     * Move every active checkout that's past its due date at <code>now</code> to the overdue list
     */
    public synchronized void updateOverdueCheckouts(Instant now) {
        requireNonNull(now, "No now provided");
        activeCheckouts.values()
                       .stream()
                       .filter(checkout -> checkout.isOverdueAt(now))
                       .forEach(checkout -> overdueCheckouts.computeIfAbsent(checkout.patronId, patronId -> new LinkedHashMap<>())
                                                            .putIfAbsent(checkout.bookId,
                                                                         new OverdueCheckout(checkout.bookId,
                                                                                             checkout.patronId,
                                                                                             checkout.libraryBranchId,
                                                                                             checkout.dueDate)));
    }

    public synchronized List<ActiveHold> getExpiringHoldsForDate(LocalDate date) {
        requireNonNull(date, "No date provided");
        return List.copyOf(expiringHolds.getOrDefault(date, Map.of()).values());
    }

    public List<ActiveHold> getExpiringHoldsToday() {
        return getExpiringHoldsForDate(LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC));
    }

    /**
     * @return the closed-ended holds whose expiration is before <code>now</code>
     */
    public synchronized List<ActiveHold> getHoldsExpiredAt(Instant now) {
        requireNonNull(now, "No now provided");
        return activeHolds.values()
                          .stream()
                          .filter(hold -> hold.holdTill != null && now.isAfter(hold.holdTill))
                          .collect(Collectors.toList());
    }

    public synchronized List<ActiveHold> getActiveHolds() {
        return List.copyOf(activeHolds.values());
    }

    public synchronized List<ActiveCheckout> getActiveCheckouts() {
        return List.copyOf(activeCheckouts.values());
    }

    /**
     * @return the overdue checkouts per patron, after detecting new overdue checkouts using the current time
     */
    public synchronized Map<PatronId, List<OverdueCheckout>> getOverdueCheckouts() {
        updateOverdueCheckouts(clock.instant());
        var result = new LinkedHashMap<PatronId, List<OverdueCheckout>>();
        overdueCheckouts.forEach((patronId, overdues) -> result.put(patronId, List.copyOf(overdues.values())));
        return result;
    }

    public synchronized int getOverdueCountForPatronAtBranch(PatronId patronId, LibraryBranchId libraryBranchId) {
        requireNonNull(patronId, "No patronId provided");
        requireNonNull(libraryBranchId, "No libraryBranchId provided");
        updateOverdueCheckouts(clock.instant());
        return (int) overdueCheckouts.getOrDefault(patronId, Map.of())
                                     .values()
                                     .stream()
                                     .filter(overdue -> overdue.libraryBranchId.equals(libraryBranchId))
                                     .count();
    }

    public synchronized DailySheetStatistics getStatistics() {
        return new DailySheetStatistics(activeHolds.size(),
                                        activeCheckouts.size(),
                                        getExpiringHoldsToday().size(),
                                        overdueCheckouts.size());
    }

    private void removeHold(BookId bookId) {
        var hold = activeHolds.remove(bookId);
        if (hold != null && hold.holdTill != null) {
            var expiryDate = LocalDate.ofInstant(hold.holdTill, ZoneOffset.UTC);
            var holdsExpiringThatDay = expiringHolds.get(expiryDate);
            if (holdsExpiringThatDay != null) {
                holdsExpiringThatDay.remove(bookId);
                if (holdsExpiringThatDay.isEmpty()) {
                    expiringHolds.remove(expiryDate);
                }
            }
        }
    }

    private class Applier implements BookEvent.Visitor<Void> {
        @Override
        public Void visit(BookAddedToLibrary event) {
            return null;
        }

        @Override
        public Void visit(BookPlacedOnHold event) {
            removeHold(event.bookId);
            var hold = new ActiveHold(event.bookId, event.patronId, event.libraryBranchId, event.holdType, event.holdTill);
            activeHolds.put(event.bookId, hold);
            if (event.holdTill != null) {
                expiringHolds.computeIfAbsent(LocalDate.ofInstant(event.holdTill, ZoneOffset.UTC), date -> new LinkedHashMap<>())
                             .put(event.bookId, hold);
            }
            return null;
        }

        @Override
        public Void visit(BookHoldCanceled event) {
            removeHold(event.bookId);
            return null;
        }

        @Override
        public Void visit(BookHoldExpired event) {
            removeHold(event.bookId);
            return null;
        }

        @Override
        public Void visit(BookCheckedOut event) {
            removeHold(event.bookId);
            activeCheckouts.put(event.bookId, new ActiveCheckout(event.bookId, event.patronId, event.libraryBranchId, event.checkedOutAt, event.dueDate));
            return null;
        }

        @Override
        public Void visit(BookReturned event) {
            activeCheckouts.remove(event.bookId);
            var overdues = overdueCheckouts.get(event.patronId);
            if (overdues != null) {
                overdues.remove(event.bookId);
                if (overdues.isEmpty()) {
                    overdueCheckouts.remove(event.patronId);
                }
            }
            return null;
        }

        @Override
        public Void visit(UnknownBookEvent event) {
            return null;
        }
    }
}
