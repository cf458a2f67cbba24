package com.librarylending.eventstore.eventstream;

import com.librarylending.eventstore.types.StreamName;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.*;

/**
 * Selects which streams a reader or subscription receives events from
 */
public final class EventStreamFilter {
    private static final EventStreamFilter ALL_STREAMS = new EventStreamFilter(List.of());

    private final List<String> streamNamePrefixes;

    private EventStreamFilter(List<String> streamNamePrefixes) {
        this.streamNamePrefixes = List.copyOf(streamNamePrefixes);
    }

    public static EventStreamFilter allStreams() {
        return ALL_STREAMS;
    }

    /**
     * Only include streams whose name starts with one of the <code>prefixes</code>, e.g. <code>book-</code>
     */
    public static EventStreamFilter streamNamePrefixes(String... prefixes) {
        requireNonNull(prefixes, "No prefixes provided");
        requireTrue(prefixes.length > 0, "At least one prefix must be provided");
        Arrays.stream(prefixes).forEach(prefix -> requireTrue(prefix != null && !prefix.isBlank(), "Stream name prefixes must not be blank"));
        return new EventStreamFilter(Arrays.asList(prefixes));
    }

    public boolean isAllStreams() {
        return streamNamePrefixes.isEmpty();
    }

    public List<String> streamNamePrefixes() {
        return streamNamePrefixes;
    }

    public boolean matches(StreamName streamName) {
        requireNonNull(streamName, "No streamName provided");
        return isAllStreams() || streamNamePrefixes.stream().anyMatch(streamName::hasPrefix);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventStreamFilter)) return false;
        return streamNamePrefixes.equals(((EventStreamFilter) o).streamNamePrefixes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamNamePrefixes);
    }

    @Override
    public String toString() {
        return isAllStreams() ? "AllStreams" : "StreamNamePrefixes" + streamNamePrefixes;
    }
}
