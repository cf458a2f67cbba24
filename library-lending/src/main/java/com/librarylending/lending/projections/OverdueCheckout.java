package com.librarylending.lending.projections;

import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

/**
 * A checkout that wasn't returned before its due date
 */
public final class OverdueCheckout {
    public final BookId          bookId;
    public final PatronId        patronId;
    public final LibraryBranchId libraryBranchId;
    public final Instant         dueDate;

    public OverdueCheckout(BookId bookId, PatronId patronId, LibraryBranchId libraryBranchId, Instant dueDate) {
        this.bookId = bookId;
        this.patronId = patronId;
        this.libraryBranchId = libraryBranchId;
        this.dueDate = dueDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OverdueCheckout)) return false;
        var that = (OverdueCheckout) o;
        return bookId.equals(that.bookId) && patronId.equals(that.patronId) && libraryBranchId.equals(that.libraryBranchId) &&
                dueDate.equals(that.dueDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, patronId, libraryBranchId, dueDate);
    }

    @Override
    public String toString() {
        return "OverdueCheckout{" +
                "bookId=" + bookId +
                ", patronId=" + patronId +
                ", libraryBranchId=" + libraryBranchId +
                ", dueDate=" + dueDate +
                '}';
    }
}
