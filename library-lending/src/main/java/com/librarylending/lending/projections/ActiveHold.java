package com.librarylending.lending.projections;

import com.librarylending.lending.domain.*;

import java.time.Instant;
import java.util.Objects;

public final class ActiveHold {
    public final BookId          bookId;
    public final PatronId        patronId;
    public final LibraryBranchId libraryBranchId;
    public final HoldType        holdType;
    /**
     * null for open-ended holds
     */
    public final Instant         holdTill;

    public ActiveHold(BookId bookId, PatronId patronId, LibraryBranchId libraryBranchId, HoldType holdType, Instant holdTill) {
        this.bookId = bookId;
        this.patronId = patronId;
        this.libraryBranchId = libraryBranchId;
        this.holdType = holdType;
        this.holdTill = holdTill;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ActiveHold)) return false;
        var that = (ActiveHold) o;
        return bookId.equals(that.bookId) && patronId.equals(that.patronId) && libraryBranchId.equals(that.libraryBranchId) &&
                holdType == that.holdType && Objects.equals(holdTill, that.holdTill);
    }

    @Override
    public int hashCode() {
        return Objects.hash(bookId, patronId, libraryBranchId, holdType, holdTill);
    }

    @Override
    public String toString() {
        return "ActiveHold{" +
                "bookId=" + bookId +
                ", patronId=" + patronId +
                ", libraryBranchId=" + libraryBranchId +
                ", holdType=" + holdType +
                ", holdTill=" + holdTill +
                '}';
    }
}
