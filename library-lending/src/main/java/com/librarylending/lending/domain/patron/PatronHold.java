package com.librarylending.lending.domain.patron;

import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

/**
 * A hold as seen from the patron
 */
public final class PatronHold {
    public final BookId          bookId;
    public final LibraryBranchId libraryBranchId;
    public final HoldType        holdType;
    /**
     * null for open-ended holds
     */
    public final Instant         holdTill;

    public PatronHold(BookId bookId, LibraryBranchId libraryBranchId, HoldType holdType, Instant holdTill) {
        this.bookId = bookId;
        this.libraryBranchId = libraryBranchId;
        this.holdType = holdType;
        this.holdTill = holdTill;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatronHold)) return false;
        var that = (PatronHold) o;
        return Objects.equals(bookId, that.bookId) && Objects.equals(libraryBranchId, that.libraryBranchId) && holdType == that.holdType &&
                Objects.equals(holdTill, that.holdTill);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, libraryBranchId, holdType, holdTill);
    }

    @Override
    public String toString() {
        return "PatronHold{" +
                "bookId=" + bookId +
                ", libraryBranchId=" + libraryBranchId +
                ", holdType=" + holdType +
                ", holdTill=" + holdTill +
                '}';
    }
}
