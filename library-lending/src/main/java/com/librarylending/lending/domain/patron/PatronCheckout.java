package com.librarylending.lending.domain.patron;

import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

public final class PatronCheckout {
    public final BookId          bookId;
    public final LibraryBranchId libraryBranchId;
    public final Instant         checkedOutAt;
    public final Instant         dueDate;

    public PatronCheckout(BookId bookId, LibraryBranchId libraryBranchId, Instant checkedOutAt, Instant dueDate) {
        this.bookId = bookId;
        this.libraryBranchId = libraryBranchId;
        this.checkedOutAt = checkedOutAt;
        this.dueDate = dueDate;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatronCheckout)) return false;
        var that = (PatronCheckout) o;
        return Objects.equals(bookId, that.bookId) && Objects.equals(libraryBranchId, that.libraryBranchId) &&
                Objects.equals(checkedOutAt, that.checkedOutAt) && Objects.equals(dueDate, that.dueDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, libraryBranchId, checkedOutAt, dueDate);
    }

    @Override
    public String toString() {
        return "PatronCheckout{" +
                "bookId=" + bookId +
                ", libraryBranchId=" + libraryBranchId +
                ", dueDate=" + dueDate +
                '}';
    }
}
