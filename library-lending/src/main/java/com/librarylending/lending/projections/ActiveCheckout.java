package com.librarylending.lending.projections;

import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

public final class ActiveCheckout {
    public final BookId          bookId;
    public final PatronId        patronId;
    public final LibraryBranchId libraryBranchId;
    public final Instant         checkedOutAt;
    public final Instant         dueDate;

    public ActiveCheckout(BookId bookId, PatronId patronId, LibraryBranchId libraryBranchId, Instant checkedOutAt, Instant dueDate) {
        this.bookId = bookId;
        this.patronId = patronId;
        this.libraryBranchId = libraryBranchId;
        this.checkedOutAt = checkedOutAt;
        this.dueDate = dueDate;
    }

    public boolean isOverdueAt(Instant now) {
        return now.isAfter(dueDate);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveCheckout)) return false;
        var that = (ActiveCheckout) o;
        return bookId.equals(that.bookId) && patronId.equals(that.patronId) && libraryBranchId.equals(that.libraryBranchId) &&
                checkedOutAt.equals(that.checkedOutAt) && dueDate.equals(that.dueDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, patronId, libraryBranchId, checkedOutAt, dueDate);
    }

    @Override
    public String toString() {
        return "ActiveCheckout{" +
                "bookId=" + bookId +
                ", patronId=" + patronId +
                ", libraryBranchId=" + libraryBranchId +
                ", dueDate=" + dueDate +
                '}';
    }
}
