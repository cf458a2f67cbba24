package com.librarylending.lending.domain.patron;

import com.librarylending.eventsourced.aggregates.*;
import com.librarylending.eventstore.types.StreamName;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.patron.PatronEvent.*;

import java.time.Instant;
import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * A library patron.<br>
 * Business rules:
 * <ul>
 *     <li>Regular patrons are limited to {@value #MAX_HOLDS_FOR_REGULAR} simultaneous holds</li>
 *     <li>Patrons with more than {@value #MAX_OVERDUES_FOR_HOLDS} overdue checkouts at a branch can't place holds there</li>
 *     <li>Only researchers can hold restricted books and request open-ended holds</li>
 * </ul>
 * The patron's holds and checkouts are its own record of the book events, kept up to date by the <code>record...</code>
 * decisions. They lag behind the book streams, which remain the source of truth.<br>
 * Overdue counts only ever grow: returning an overdue book doesn't decrement them.
 */
public class Patron extends AggregateRoot<PatronId, PatronEvent, Patron> {
    public static final String STREAM_CATEGORY        = "patron";
    public static final int    MAX_HOLDS_FOR_REGULAR  = 5;
    public static final int    MAX_OVERDUES_FOR_HOLDS = 2;

    public static final String BOOK_EVENT_ALREADY_RECORDED = "Book event already recorded";
    public static final String OVERDUE_ALREADY_REGISTERED  = "Overdue checkout already registered";

    private final StateUpdater stateUpdater = new StateUpdater();

    private       PatronType                    patronType;
    private       String                        name;
    private       String                        email;
    private final Map<BookId, PatronHold>       holds                     = new LinkedHashMap<>();
    private final Map<BookId, PatronCheckout>   checkouts                 = new LinkedHashMap<>();
    private final Map<LibraryBranchId, Integer> overduesByBranch          = new LinkedHashMap<>();
    private final Map<BookId, Long>             lastRecordedBookRevisions = new HashMap<>();
    private final Set<RegisteredOverdue>        registeredOverdues        = new HashSet<>();

    /**
     * Used for rehydration
     */
    public Patron(PatronId patronId) {
        super(patronId);
    }

    public static StreamName streamName(PatronId patronId) {
        return StreamName.of(STREAM_CATEGORY, patronId);
    }

    public static Patron create(PatronId patronId, PatronType patronType, String name, String email, Instant now) {
        requireNonNull(patronType, "You must provide a patronType");
        requireNonNull(name, "You must provide a name");
        requireTrue(!name.isBlank(), "You must provide a name");
        requireNonNull(email, "You must provide an email");
        requireNonNull(now, "You must provide now");
        var patron = new Patron(patronId);
        patron.apply(new PatronCreated(patronId, patronType, name, email, now));
        return patron;
    }

    /**
     * Side effect free eligibility check. The rules are evaluated in a fixed order and the first failing rule wins.
     */
    public HoldEligibility canPlaceHoldAt(LibraryBranchId libraryBranchId, BookType bookType) {
        requireNonNull(libraryBranchId, "You must provide a libraryBranchId");
        requireNonNull(bookType, "You must provide a bookType");
        var overduesAtBranch = overdueCountAt(libraryBranchId);
        if (overduesAtBranch > MAX_OVERDUES_FOR_HOLDS) {
            return HoldEligibility.notAllowed("Too many overdue checkouts (" + overduesAtBranch + ") at this branch");
        }
        if (patronType == PatronType.REGULAR && holds.size() >= MAX_HOLDS_FOR_REGULAR) {
            return HoldEligibility.notAllowed("Regular patrons limited to " + MAX_HOLDS_FOR_REGULAR + " holds");
        }
        if (bookType == BookType.RESTRICTED && patronType != PatronType.RESEARCHER) {
            return HoldEligibility.notAllowed("Only researchers can hold restricted books");
        }
        return HoldEligibility.allowed();
    }

    public List<HoldType> allowedHoldTypes() {
        if (patronType == PatronType.RESEARCHER) {
            return List.of(HoldType.OPEN_ENDED, HoldType.CLOSED_ENDED);
        }
        return List.of(HoldType.CLOSED_ENDED);
    }

    public Decision<PatronEvent> upgradeToResearcher(Instant now) {
        requireNonNull(now, "You must provide now");
        if (patronType == PatronType.RESEARCHER) {
            return Decision.invalidState("Patron is already a researcher");
        }
        return accept(new PatronTypeUpgraded(aggregateId(), PatronType.RESEARCHER, now));
    }

    public Decision<PatronEvent> recordHoldPlaced(BookId bookId, LibraryBranchId libraryBranchId, HoldType holdType, Instant holdTill, long bookStreamRevision, Instant now) {
        requireNonNull(bookId, "You must provide a bookId");
        requireNonNull(libraryBranchId, "You must provide a libraryBranchId");
        requireNonNull(holdType, "You must provide a holdType");
        requireNonNull(now, "You must provide now");
        if (isAlreadyRecorded(bookId, bookStreamRevision)) {
            return alreadyRecorded();
        }
        return accept(new PatronHoldPlaced(aggregateId(), bookId, libraryBranchId, holdType, holdTill, bookStreamRevision, now));
    }

    /**
     * Record that a hold was canceled or expired
     */
    public Decision<PatronEvent> recordHoldRemoved(BookId bookId, LibraryBranchId libraryBranchId, long bookStreamRevision, Instant now) {
        requireNonNull(bookId, "You must provide a bookId");
        requireNonNull(libraryBranchId, "You must provide a libraryBranchId");
        requireNonNull(now, "You must provide now");
        if (isAlreadyRecorded(bookId, bookStreamRevision)) {
            return alreadyRecorded();
        }
        return accept(new PatronHoldCanceled(aggregateId(), bookId, libraryBranchId, bookStreamRevision, now));
    }

    public Decision<PatronEvent> recordCheckout(BookId bookId, LibraryBranchId libraryBranchId, Instant checkedOutAt, Instant dueDate, long bookStreamRevision, Instant now) {
        requireNonNull(bookId, "You must provide a bookId");
        requireNonNull(libraryBranchId, "You must provide a libraryBranchId");
        requireNonNull(checkedOutAt, "You must provide a checkedOutAt");
        requireNonNull(dueDate, "You must provide a dueDate");
        requireNonNull(now, "You must provide now");
        if (isAlreadyRecorded(bookId, bookStreamRevision)) {
            return alreadyRecorded();
        }
        return accept(new PatronCheckoutRecorded(aggregateId(), bookId, libraryBranchId, checkedOutAt, dueDate, bookStreamRevision, now));
    }

    public Decision<PatronEvent> recordReturn(BookId bookId, LibraryBranchId libraryBranchId, long bookStreamRevision, Instant now) {
        requireNonNull(bookId, "You must provide a bookId");
        requireNonNull(libraryBranchId, "You must provide a libraryBranchId");
        requireNonNull(now, "You must provide now");
        if (isAlreadyRecorded(bookId, bookStreamRevision)) {
            return alreadyRecorded();
        }
        return accept(new PatronReturnRecorded(aggregateId(), bookId, libraryBranchId, bookStreamRevision, now));
    }

    /**
     * Register that the checkout of <code>bookId</code> due at <code>dueDate</code> is overdue. Each checkout is
     * registered at most once.
     */
    public Decision<PatronEvent> registerOverdue(BookId bookId, LibraryBranchId libraryBranchId, Instant dueDate, Instant now) {
        requireNonNull(bookId, "You must provide a bookId");
        requireNonNull(libraryBranchId, "You must provide a libraryBranchId");
        requireNonNull(dueDate, "You must provide a dueDate");
        requireNonNull(now, "You must provide now");
        if (registeredOverdues.contains(new RegisteredOverdue(bookId, dueDate))) {
            return Decision.invalidState(OVERDUE_ALREADY_REGISTERED);
        }
        return accept(new OverdueCheckoutRegistered(aggregateId(), bookId, libraryBranchId, dueDate, now));
    }

    private boolean isAlreadyRecorded(BookId bookId, long bookStreamRevision) {
        var lastRecorded = lastRecordedBookRevisions.get(bookId);
        return lastRecorded != null && bookStreamRevision <= lastRecorded;
    }

    private static Decision<PatronEvent> alreadyRecorded() {
        return Decision.invalidState(BOOK_EVENT_ALREADY_RECORDED);
    }

    @Override
    protected void applyEventToTheAggregate(PatronEvent event) {
        event.accept(stateUpdater);
    }

    public PatronType patronType() {
        return patronType;
    }

    public String name() {
        return name;
    }

    public String email() {
        return email;
    }

    public List<PatronHold> holds() {
        return List.copyOf(holds.values());
    }

    public List<PatronCheckout> checkouts() {
        return List.copyOf(checkouts.values());
    }

    public int overdueCountAt(LibraryBranchId libraryBranchId) {
        return overduesByBranch.getOrDefault(libraryBranchId, 0);
    }

    public Map<LibraryBranchId, Integer> overduesByBranch() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(overduesByBranch));
    }

    private void markRecorded(BookId bookId, long bookStreamRevision) {
        lastRecordedBookRevisions.merge(bookId, bookStreamRevision, Math::max);
    }

    private class StateUpdater implements PatronEvent.Visitor<Void> {
        @Override
        public Void visit(PatronCreated event) {
            patronType = event.patronType;
            name = event.name;
            email = event.email;
            return null;
        }

        @Override
        public Void visit(PatronTypeUpgraded event) {
            patronType = event.newType;
            return null;
        }

        @Override
        public Void visit(PatronHoldPlaced event) {
            holds.put(event.bookId, new PatronHold(event.bookId, event.libraryBranchId, event.holdType, event.holdTill));
            markRecorded(event.bookId, event.bookStreamRevision);
            return null;
        }

        @Override
        public Void visit(PatronHoldCanceled event) {
            holds.remove(event.bookId);
            markRecorded(event.bookId, event.bookStreamRevision);
            return null;
        }

        @Override
        public Void visit(PatronCheckoutRecorded event) {
            holds.remove(event.bookId);
            checkouts.put(event.bookId, new PatronCheckout(event.bookId, event.libraryBranchId, event.checkedOutAt, event.dueDate));
            markRecorded(event.bookId, event.bookStreamRevision);
            return null;
        }

        @Override
        public Void visit(PatronReturnRecorded event) {
            checkouts.remove(event.bookId);
            markRecorded(event.bookId, event.bookStreamRevision);
            return null;
        }

        @Override
        public Void visit(OverdueCheckoutRegistered event) {
            overduesByBranch.merge(event.libraryBranchId, 1, Integer::sum);
            registeredOverdues.add(new RegisteredOverdue(event.bookId, event.dueDate));
            return null;
        }

        @Override
        public Void visit(UnknownPatronEvent event) {
            return null;
        }
    }

    private static final class RegisteredOverdue {
        private final BookId  bookId;
        private final Instant dueDate;

        private RegisteredOverdue(BookId bookId, Instant dueDate) {
            this.bookId = bookId;
            this.dueDate = dueDate;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof RegisteredOverdue)) return false;
            var that = (RegisteredOverdue) o;
            return bookId.equals(that.bookId) && dueDate.equals(that.dueDate);
        }

        @Override
        public int hashCode() {
            return Objects.hash(bookId, dueDate);
        }
    }
}
