package com.librarylending.eventstore.eventstream;

import com.librarylending.eventstore.types.*;

import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The outcome of a successful append
 */
public final class AppendResult {
    public final StreamName     streamName;
    /**
     * The revision of the last event appended, i.e. the expected revision for the next append
     */
    public final StreamRevision nextExpectedRevision;
    /**
     * The global position of the last event appended
     */
    public final GlobalPosition globalPosition;

    public AppendResult(StreamName streamName, StreamRevision nextExpectedRevision, GlobalPosition globalPosition) {
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.nextExpectedRevision = requireNonNull(nextExpectedRevision, "No nextExpectedRevision provided");
        this.globalPosition = requireNonNull(globalPosition, "No globalPosition provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AppendResult)) return false;
        var that = (AppendResult) o;
        return streamName.equals(that.streamName) && nextExpectedRevision.equals(that.nextExpectedRevision) && globalPosition.equals(that.globalPosition);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamName, nextExpectedRevision, globalPosition);
    }

    @Override
    public String toString() {
        return "AppendResult{" +
                "streamName=" + streamName +
                ", nextExpectedRevision=" + nextExpectedRevision +
                ", globalPosition=" + globalPosition +
                '}';
    }
}
