package com.librarylending.eventstore.types;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The optimistic concurrency guard supplied when appending to a stream
 */
public final class ExpectedRevision {
    public enum Kind {
        /**
         * The stream must be at exactly {@link #revision()}
         */
        EXACT,
        /**
         * The stream must not exist
         */
        NO_STREAM,
        /**
         * The stream must exist, at any revision
         */
        STREAM_EXISTS,
        /**
         * No concurrency check
         */
        ANY
    }

    private static final ExpectedRevision NO_STREAM     = new ExpectedRevision(Kind.NO_STREAM, null);
    private static final ExpectedRevision STREAM_EXISTS = new ExpectedRevision(Kind.STREAM_EXISTS, null);
    private static final ExpectedRevision ANY           = new ExpectedRevision(Kind.ANY, null);

    public final  Kind           kind;
    private final StreamRevision revision;

    private ExpectedRevision(Kind kind, StreamRevision revision) {
        this.kind = kind;
        this.revision = revision;
    }

    public static ExpectedRevision exactly(StreamRevision revision) {
        return new ExpectedRevision(Kind.EXACT, requireNonNull(revision, "No revision provided"));
    }

    public static ExpectedRevision exactly(long revision) {
        return exactly(StreamRevision.of(revision));
    }

    public static ExpectedRevision noStream() {
        return NO_STREAM;
    }

    public static ExpectedRevision streamExists() {
        return STREAM_EXISTS;
    }

    public static ExpectedRevision any() {
        return ANY;
    }

    /**
     * @return the exact revision, only present for {@link Kind#EXACT}
     */
    public Optional<StreamRevision> revision() {
        return Optional.ofNullable(revision);
    }

    /**
     * Check the guard against the current state of a stream
     *
     * @param currentRevision the revision of the last event in the stream or {@link Optional#empty()} if the stream doesn't exist
     * @return true if an append is allowed
     */
    public boolean isSatisfiedBy(Optional<StreamRevision> currentRevision) {
        requireNonNull(currentRevision, "No currentRevision option provided");
        switch (kind) {
            case EXACT:
                return currentRevision.isPresent() && currentRevision.get().equals(revision);
            case NO_STREAM:
                return currentRevision.isEmpty();
            case STREAM_EXISTS:
                return currentRevision.isPresent();
            case ANY:
                return true;
            default:
                throw new IllegalStateException("Unsupported ExpectedRevision kind " + kind);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpectedRevision)) return false;
        var that = (ExpectedRevision) o;
        return kind == that.kind && Objects.equals(revision, that.revision);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, revision);
    }

    @Override
    public String toString() {
        return kind == Kind.EXACT ? String.valueOf(revision) : kind.name();
    }
}
