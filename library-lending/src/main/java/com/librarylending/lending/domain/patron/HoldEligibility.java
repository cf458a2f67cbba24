package com.librarylending.lending.domain.patron;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Outcome of {@link Patron#canPlaceHoldAt(com.librarylending.lending.domain.LibraryBranchId, com.librarylending.lending.domain.BookType)}
 */
public final class HoldEligibility {
    private static final HoldEligibility ALLOWED = new HoldEligibility(null);

    private final String reason;

    private HoldEligibility(String reason) {
        this.reason = reason;
    }

    public static HoldEligibility allowed() {
        return ALLOWED;
    }

    public static HoldEligibility notAllowed(String reason) {
        requireNonNull(reason, "No reason provided");
        requireTrue(!reason.isBlank(), "No reason provided");
        return new HoldEligibility(reason);
    }

    public boolean isAllowed() {
        return reason == null;
    }

    /**
     * @return the reason why the patron can't place the hold, empty if the hold is allowed
     */
    public Optional<String> reason() {
        return Optional.ofNullable(reason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof HoldEligibility)) return false;
        return Objects.equals(reason, ((HoldEligibility) o).reason);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(reason);
    }

    @Override
    public String toString() {
        return isAllowed() ? "Allowed" : "NotAllowed{" + reason + '}';
    }
}
