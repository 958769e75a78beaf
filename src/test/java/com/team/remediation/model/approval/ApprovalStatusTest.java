package com.team.remediation.model.approval;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApprovalStatusTest {

    @Test
    void reviewStatesFollowTheLifecycle() {
        assertThat(ApprovalStatus.PROPOSED.successors()).containsExactly(ApprovalStatus.PENDING_REVIEW);
        assertThat(ApprovalStatus.PENDING_REVIEW.canTransitionTo(ApprovalStatus.APPROVED)).isTrue();
        assertThat(ApprovalStatus.PENDING_REVIEW.canTransitionTo(ApprovalStatus.EXECUTING)).isFalse();
        assertThat(ApprovalStatus.APPROVED.canTransitionTo(ApprovalStatus.EXECUTING)).isTrue();
        assertThat(ApprovalStatus.APPROVED.canTransitionTo(ApprovalStatus.PENDING_REVIEW)).isFalse();
        assertThat(ApprovalStatus.EXECUTING.successors())
                .containsExactlyInAnyOrder(ApprovalStatus.COMPLETED, ApprovalStatus.FAILED);
    }

    @ParameterizedTest
    @EnumSource(value = ApprovalStatus.class, names = {"REJECTED", "NEEDS_MORE_INFO", "COMPLETED", "FAILED", "EXPIRED"})
    void terminalStatesHaveNoSuccessor(ApprovalStatus status) {
        assertThat(status.isTerminal()).isTrue();
        for (ApprovalStatus next : ApprovalStatus.values()) {
            assertThat(status.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void wireNamesParseInEitherForm() {
        assertThat(ApprovalStatus.fromValue("needs_more_info")).isEqualTo(ApprovalStatus.NEEDS_MORE_INFO);
        assertThat(ApprovalStatus.fromValue("PENDING_REVIEW")).isEqualTo(ApprovalStatus.PENDING_REVIEW);
        assertThatThrownBy(() -> ApprovalStatus.fromValue("done")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void decisionsAcceptVerbAndParticiple() {
        assertThat(Decision.fromValue("approve")).isEqualTo(Decision.APPROVED);
        assertThat(Decision.fromValue("Rejected")).isEqualTo(Decision.REJECTED);
        assertThat(Decision.fromValue("needs-more-info")).isEqualTo(Decision.NEEDS_MORE_INFO);
        assertThatThrownBy(() -> Decision.fromValue(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void closeReasonsMapOnlyOpenStates() {
        assertThat(CloseReason.WORKFLOW_REJECTED.targetFor(ApprovalStatus.PENDING_REVIEW)).isEqualTo(ApprovalStatus.EXPIRED);
        assertThat(CloseReason.WORKFLOW_REJECTED.targetFor(ApprovalStatus.APPROVED)).isEqualTo(ApprovalStatus.REJECTED);
        assertThat(CloseReason.CANCELLED.targetFor(ApprovalStatus.EXECUTING)).isNull();
        assertThat(CloseReason.APPROVAL_TIMEOUT.targetFor(ApprovalStatus.COMPLETED)).isNull();
    }
}
