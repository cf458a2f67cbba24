package com.librarylending.lending.application;

import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.book.Book;

import java.time.Instant;
import java.util.Objects;

/**
 * Flattened, immutable, view of a {@link Book}. Fields that don't apply to the current {@link #state} are null.
 */
public final class BookSnapshot {
    public final BookId          bookId;
    public final String          isbn;
    public final String          title;
    public final BookType        bookType;
    public final LibraryBranchId libraryBranchId;
    public final BookState       state;
    public final PatronId        holdingPatronId;
    public final HoldType        holdType;
    public final Instant         holdTill;
    public final PatronId        checkedOutBy;
    public final Instant         dueDate;

    public BookSnapshot(BookId bookId,
                        String isbn,
                        String title,
                        BookType bookType,
                        LibraryBranchId libraryBranchId,
                        BookState state,
                        PatronId holdingPatronId,
                        HoldType holdType,
                        Instant holdTill,
                        PatronId checkedOutBy,
                        Instant dueDate) {
        this.bookId = bookId;
        this.isbn = isbn;
        this.title = title;
        this.bookType = bookType;
        this.libraryBranchId = libraryBranchId;
        this.state = state;
        this.holdingPatronId = holdingPatronId;
        this.holdType = holdType;
        this.holdTill = holdTill;
        this.checkedOutBy = checkedOutBy;
        this.dueDate = dueDate;
    }

    public static BookSnapshot of(Book book) {
        return new BookSnapshot(book.aggregateId(),
                                book.isbn(),
                                book.title(),
                                book.bookType(),
                                book.libraryBranchId(),
                                book.state(),
                                book.holdingPatronId().orElse(null),
                                book.holdType().orElse(null),
                                book.holdTill().orElse(null),
                                book.checkedOutBy().orElse(null),
                                book.dueDate().orElse(null));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BookSnapshot)) return false;
        var that = (BookSnapshot) o;
        return Objects.equals(bookId, that.bookId) && Objects.equals(isbn, that.isbn) && Objects.equals(title, that.title) &&
                bookType == that.bookType && Objects.equals(libraryBranchId, that.libraryBranchId) && state == that.state &&
                Objects.equals(holdingPatronId, that.holdingPatronId) && holdType == that.holdType && Objects.equals(holdTill, that.holdTill) &&
                Objects.equals(checkedOutBy, that.checkedOutBy) && Objects.equals(dueDate, that.dueDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, isbn, title, bookType, libraryBranchId, state, holdingPatronId, holdType, holdTill, checkedOutBy, dueDate);
    }

    @Override
    public String toString() {
        return "BookSnapshot{" +
                "bookId=" + bookId +
                ", title='" + title + '\'' +
                ", state=" + state +
                ", holdingPatronId=" + holdingPatronId +
                ", checkedOutBy=" + checkedOutBy +
                '}';
    }
}
