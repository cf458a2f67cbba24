package com.librarylending.eventstore.persistence;

import com.librarylending.eventstore.types.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when the {@link ExpectedRevision} supplied to an append didn't match the stream, i.e. another writer
 * appended to the stream after it was read.<br>
 * The caller must reload, decide again and retry.
 */
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public static final String CONCURRENCY_CONFLICT = "Concurrency conflict: stream was modified";

    public final StreamName               streamName;
    public final ExpectedRevision         expectedRevision;
    public final Optional<StreamRevision> actualRevision;

    public OptimisticAppendToStreamException(StreamName streamName, ExpectedRevision expectedRevision, Optional<StreamRevision> actualRevision) {
        super(generateMessage(streamName, expectedRevision, actualRevision));
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.expectedRevision = requireNonNull(expectedRevision, "No expectedRevision provided");
        this.actualRevision = requireNonNull(actualRevision, "No actualRevision option provided");
    }

    public OptimisticAppendToStreamException(StreamName streamName, ExpectedRevision expectedRevision, Optional<StreamRevision> actualRevision, Throwable cause) {
        super(generateMessage(streamName, expectedRevision, actualRevision), cause);
        this.streamName = requireNonNull(streamName, "No streamName provided");
        this.expectedRevision = requireNonNull(expectedRevision, "No expectedRevision provided");
        this.actualRevision = requireNonNull(actualRevision, "No actualRevision option provided");
    }

    private static String generateMessage(StreamName streamName, ExpectedRevision expectedRevision, Optional<StreamRevision> actualRevision) {
        return msg("{}. Stream '{}' expected revision '{}' but actual revision was '{}'",
                   CONCURRENCY_CONFLICT,
                   streamName,
                   expectedRevision,
                   actualRevision.map(String::valueOf).orElse("NO_STREAM"));
    }
}
