package com.librarylending.lending.projections;

import com.librarylending.common.types.SubscriberId;
import com.librarylending.eventstore.EventStore;
import com.librarylending.eventstore.eventstream.RecordedEvent;
import com.librarylending.lending.application.LibraryConfiguration;
import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.BookEvent;
import com.librarylending.lending.domain.book.BookEvent.*;

import java.time.Clock;
import java.util.*;
import java.util.function.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Searchable directory of all books in the library
 */
public class CatalogProjection extends BookEventProjection {
    public static final SubscriberId SUBSCRIBER_ID = SubscriberId.of("CatalogProjection");

    private final Map<BookId, CatalogEntry> books   = new LinkedHashMap<>();
    private final Applier                   applier = new Applier();

    public CatalogProjection(EventStore eventStore, LibraryConfiguration configuration, Clock clock) {
        super(SUBSCRIBER_ID, eventStore, configuration, clock);
    }

    @Override
    protected void apply(BookEvent event, RecordedEvent recordedEvent) {
        event.accept(applier);
    }

    @Override
    protected void clear() {
        books.clear();
    }

    public synchronized Optional<CatalogEntry> getBook(BookId bookId) {
        return Optional.ofNullable(books.get(requireNonNull(bookId, "No bookId provided")));
    }

    public List<CatalogEntry> getBooksByState(BookState state) {
        requireNonNull(state, "No state provided");
        return select(entry -> entry.state == state);
    }

    public List<CatalogEntry> getAvailableBooks() {
        return getBooksByState(BookState.AVAILABLE);
    }

    public List<CatalogEntry> getBooksByBranch(LibraryBranchId libraryBranchId) {
        requireNonNull(libraryBranchId, "No libraryBranchId provided");
        return select(entry -> entry.libraryBranchId.equals(libraryBranchId));
    }

    /**
     * Case-insensitive substring search on the title
     */
    public List<CatalogEntry> searchByTitle(String query) {
        requireNonNull(query, "No query provided");
        var lowerCaseQuery = query.toLowerCase(Locale.ROOT);
        return select(entry -> entry.title.toLowerCase(Locale.ROOT).contains(lowerCaseQuery));
    }

    public synchronized CatalogStatistics getStatistics() {
        return new CatalogStatistics(books.size(),
                                     count(BookState.AVAILABLE),
                                     count(BookState.ON_HOLD),
                                     count(BookState.CHECKED_OUT));
    }

    private synchronized List<CatalogEntry> select(Predicate<CatalogEntry> predicate) {
        return books.values()
                    .stream()
                    .filter(predicate)
                    .collect(Collectors.toList());
    }

    private int count(BookState state) {
        return (int) books.values().stream().filter(entry -> entry.state == state).count();
    }

    private void update(BookId bookId, UnaryOperator<CatalogEntry> change) {
        books.computeIfPresent(bookId, (id, entry) -> change.apply(entry));
    }

    private class Applier implements BookEvent.Visitor<Void> {
        @Override
        public Void visit(BookAddedToLibrary event) {
            books.put(event.bookId, new CatalogEntry(event.bookId,
                                                     event.isbn,
                                                     event.title,
                                                     event.bookType,
                                                     event.libraryBranchId,
                                                     BookState.AVAILABLE,
                                                     event.occurredAt,
                                                     null,
                                                     null,
                                                     null));
            return null;
        }

        @Override
        public Void visit(BookPlacedOnHold event) {
            update(event.bookId, entry -> entry.onHoldBy(event.patronId));
            return null;
        }

        @Override
        public Void visit(BookHoldCanceled event) {
            update(event.bookId, CatalogEntry::available);
            return null;
        }

        @Override
        public Void visit(BookHoldExpired event) {
            update(event.bookId, CatalogEntry::available);
            return null;
        }

        @Override
        public Void visit(BookCheckedOut event) {
            update(event.bookId, entry -> entry.checkedOutBy(event.patronId, event.dueDate));
            return null;
        }

        @Override
        public Void visit(BookReturned event) {
            update(event.bookId, CatalogEntry::available);
            return null;
        }

        @Override
        public Void visit(UnknownBookEvent event) {
            return null;
        }
    }
}
