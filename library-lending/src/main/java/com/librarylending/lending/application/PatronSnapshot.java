package com.librarylending.lending.application;

import com.librarylending.lending.domain.*;
import com.librarylending.lending.domain.patron.*;

import java.util.*;

/**
 * Flattened, immutable, summary of a {@link Patron}
 */
public final class PatronSnapshot {
    public final PatronId                      patronId;
    public final PatronType                    patronType;
    public final String                        name;
    public final String                        email;
    public final int                           holdsCount;
    public final int                           checkoutsCount;
    public final List<PatronHold>              holds;
    public final List<PatronCheckout>          checkouts;
    public final Map<LibraryBranchId, Integer> overduesByBranch;

    public PatronSnapshot(PatronId patronId,
                          PatronType patronType,
                          String name,
                          String email,
                          List<PatronHold> holds,
                          List<PatronCheckout> checkouts,
                          Map<LibraryBranchId, Integer> overduesByBranch) {
        this.patronId = patronId;
        this.patronType = patronType;
        this.name = name;
        this.email = email;
        this.holds = List.copyOf(holds);
        this.checkouts = List.copyOf(checkouts);
        this.overduesByBranch = Collections.unmodifiableMap(new LinkedHashMap<>(overduesByBranch));
        this.holdsCount = this.holds.size();
        this.checkoutsCount = this.checkouts.size();
    }

    public static PatronSnapshot of(Patron patron) {
        return new PatronSnapshot(patron.aggregateId(),
                                  patron.patronType(),
                                  patron.name(),
                                  patron.email(),
                                  patron.holds(),
                                  patron.checkouts(),
                                  patron.overduesByBranch());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PatronSnapshot)) return false;
        var that = (PatronSnapshot) o;
        return Objects.equals(patronId, that.patronId) && patronType == that.patronType && Objects.equals(name, that.name) &&
                Objects.equals(email, that.email) && holds.equals(that.holds) && checkouts.equals(that.checkouts) &&
                overduesByBranch.equals(that.overduesByBranch);
    }

    @Override
    public int hashCode() {
        return Objects.hash(patronId, patronType, name, email, holds, checkouts, overduesByBranch);
    }

    @Override
    public String toString() {
        return "PatronSnapshot{" +
                "patronId=" + patronId +
                ", patronType=" + patronType +
                ", name='" + name + '\'' +
                ", holdsCount=" + holdsCount +
                ", checkoutsCount=" + checkoutsCount +
                ", overduesByBranch=" + overduesByBranch +
                '}';
    }
}
