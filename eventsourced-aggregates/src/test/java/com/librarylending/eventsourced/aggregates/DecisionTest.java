package com.librarylending.eventsourced.aggregates;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DecisionTest {
    @Test
    void verify_accepted_decision() {
        var decision = Decision.accepted("event");

        assertThat(decision.isAccepted()).isTrue();
        assertThat(decision.isRejected()).isFalse();
        assertThat(decision.event()).isEqualTo("event");
        assertThat(decision.rejectionKind()).isEmpty();
        assertThat(decision.rejectionReason()).isEmpty();
    }

    @Test
    void verify_rejected_decision_has_no_event() {
        Decision<String> decision = Decision.policyViolation("Only researchers can hold restricted books");

        assertThat(decision.isRejected()).isTrue();
        assertThat(decision.rejectionKind()).contains(Decision.RejectionKind.POLICY_VIOLATION);
        assertThat(decision.rejectionReason()).contains("Only researchers can hold restricted books");
        assertThatThrownBy(decision::event)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Only researchers can hold restricted books");
    }

    @Test
    void verify_a_rejection_requires_a_reason() {
        assertThatThrownBy(() -> Decision.invalidState(" "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
