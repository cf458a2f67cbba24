package com.librarylending.eventsourced.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Result of an aggregate decision method: either the accepted event or the reason why the
 * requested change was rejected.<br>
 * Expected business rejections are returned as values, they are never thrown.
 *
 * @param <EVENT> the event type
 */
public final class Decision<EVENT> {
    public enum RejectionKind {
        /**
         * The aggregate isn't in a state where the change is possible (e.g. placing a hold on a book that's checked out)
         */
        INVALID_STATE,
        /**
         * A business rule rejected the change (wrong actor, ineligibility, ...)
         */
        POLICY_VIOLATION
    }

    private final EVENT         event;
    private final RejectionKind rejectionKind;
    private final String        rejectionReason;

    private Decision(EVENT event, RejectionKind rejectionKind, String rejectionReason) {
        this.event = event;
        this.rejectionKind = rejectionKind;
        this.rejectionReason = rejectionReason;
    }

    public static <EVENT> Decision<EVENT> accepted(EVENT event) {
        return new Decision<>(requireNonNull(event, "No event provided"), null, null);
    }

    public static <EVENT> Decision<EVENT> rejected(RejectionKind rejectionKind, String reason) {
        requireNonNull(reason, "No reason provided");
        requireTrue(!reason.isBlank(), "No reason provided");
        return new Decision<>(null, requireNonNull(rejectionKind, "No rejectionKind provided"), reason);
    }

    public static <EVENT> Decision<EVENT> invalidState(String reason) {
        return rejected(RejectionKind.INVALID_STATE, reason);
    }

    public static <EVENT> Decision<EVENT> policyViolation(String reason) {
        return rejected(RejectionKind.POLICY_VIOLATION, reason);
    }

    public boolean isAccepted() {
        return event != null;
    }

    public boolean isRejected() {
        return event == null;
    }

    /**
     * @return the accepted event
     * @throws IllegalStateException if the decision was rejected
     */
    public EVENT event() {
        if (isRejected()) {
            throw new IllegalStateException(msg("Decision was rejected ({}): {}", rejectionKind, rejectionReason));
        }
        return event;
    }

    public Optional<RejectionKind> rejectionKind() {
        return Optional.ofNullable(rejectionKind);
    }

    public Optional<String> rejectionReason() {
        return Optional.ofNullable(rejectionReason);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Decision)) return false;
        var that = (Decision<?>) o;
        return Objects.equals(event, that.event) && rejectionKind == that.rejectionKind && Objects.equals(rejectionReason, that.rejectionReason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(event, rejectionKind, rejectionReason);
    }

    @Override
    public String toString() {
        return isAccepted() ?
               "Accepted{" + event + '}' :
               "Rejected{" + rejectionKind + ": " + rejectionReason + '}';
    }
}
