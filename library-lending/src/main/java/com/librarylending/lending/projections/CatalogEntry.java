package com.librarylending.lending.projections;

import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable catalog view of a book. Every state change produces a new entry.
 */
public final class CatalogEntry {
    public final BookId          bookId;
    public final String          isbn;
    public final String          title;
    public final BookType        bookType;
    public final LibraryBranchId libraryBranchId;
    public final BookState       state;
    public final Instant         addedAt;
    public final PatronId        holdingPatronId;
    public final PatronId        checkedOutBy;
    public final Instant         dueDate;

    public CatalogEntry(BookId bookId,
                        String isbn,
                        String title,
                        BookType bookType,
                        LibraryBranchId libraryBranchId,
                        BookState state,
                        Instant addedAt,
                        PatronId holdingPatronId,
                        PatronId checkedOutBy,
                        Instant dueDate) {
        this.bookId = bookId;
        this.isbn = isbn;
        this.title = title;
        this.bookType = bookType;
        this.libraryBranchId = libraryBranchId;
        this.state = state;
        this.addedAt = addedAt;
        this.holdingPatronId = holdingPatronId;
        this.checkedOutBy = checkedOutBy;
        this.dueDate = dueDate;
    }

    CatalogEntry onHoldBy(PatronId patronId) {
        return new CatalogEntry(bookId, isbn, title, bookType, libraryBranchId, BookState.ON_HOLD, addedAt, patronId, null, null);
    }

    CatalogEntry checkedOutBy(PatronId patronId, Instant dueDate) {
        return new CatalogEntry(bookId, isbn, title, bookType, libraryBranchId, BookState.CHECKED_OUT, addedAt, null, patronId, dueDate);
    }

    CatalogEntry available() {
        return new CatalogEntry(bookId, isbn, title, bookType, libraryBranchId, BookState.AVAILABLE, addedAt, null, null, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CatalogEntry)) return false;
        var that = (CatalogEntry) o;
        return bookId.equals(that.bookId) && Objects.equals(isbn, that.isbn) && Objects.equals(title, that.title) &&
                bookType == that.bookType && Objects.equals(libraryBranchId, that.libraryBranchId) && state == that.state &&
                Objects.equals(addedAt, that.addedAt) && Objects.equals(holdingPatronId, that.holdingPatronId) &&
                Objects.equals(checkedOutBy, that.checkedOutBy) && Objects.equals(dueDate, that.dueDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, isbn, title, bookType, libraryBranchId, state, addedAt, holdingPatronId, checkedOutBy, dueDate);
    }

    @Override
    public String toString() {
        return "CatalogEntry{" +
                "bookId=" + bookId +
                ", title='" + title + '\'' +
                ", libraryBranchId=" + libraryBranchId +
                ", state=" + state +
                '}';
    }
}
