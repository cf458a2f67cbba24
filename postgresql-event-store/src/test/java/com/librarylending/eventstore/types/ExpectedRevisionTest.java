package com.librarylending.eventstore.types;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

class ExpectedRevisionTest {
    private static final Optional<StreamRevision> NO_STREAM = Optional.empty();

    @Test
    void verify_exact_revision_only_matches_the_same_revision() {
        var expected = ExpectedRevision.exactly(2);

        assertThat(expected.isSatisfiedBy(Optional.of(StreamRevision.of(2)))).isTrue();
        assertThat(expected.isSatisfiedBy(Optional.of(StreamRevision.of(3)))).isFalse();
        assertThat(expected.isSatisfiedBy(NO_STREAM)).isFalse();
        assertThat(expected.revision()).hasValue(StreamRevision.of(2));
    }

    @Test
    void verify_no_stream_stream_exists_and_any() {
        var existing = Optional.of(StreamRevision.FIRST);

        assertThat(ExpectedRevision.noStream().isSatisfiedBy(NO_STREAM)).isTrue();
        assertThat(ExpectedRevision.noStream().isSatisfiedBy(existing)).isFalse();
        assertThat(ExpectedRevision.streamExists().isSatisfiedBy(NO_STREAM)).isFalse();
        assertThat(ExpectedRevision.streamExists().isSatisfiedBy(existing)).isTrue();
        assertThat(ExpectedRevision.any().isSatisfiedBy(NO_STREAM)).isTrue();
        assertThat(ExpectedRevision.any().isSatisfiedBy(existing)).isTrue();
        assertThat(ExpectedRevision.any().revision()).isEmpty();
    }

    @Test
    void verify_negative_revisions_are_rejected() {
        assertThatThrownBy(() -> ExpectedRevision.exactly(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
