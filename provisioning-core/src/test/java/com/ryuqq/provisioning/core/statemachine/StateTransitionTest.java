package com.ryuqq.provisioning.core.statemachine;

import com.ryuqq.provisioning.core.error.ErrorCode;
import com.ryuqq.provisioning.core.error.LifecycleException;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.Set;

import static com.ryuqq.provisioning.core.statemachine.RequestStatus.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * StateTransition 테스트.
 *
 * <ul>
 *   <li>허용 전이: PENDING_APPROVAL → APPROVED/REJECTED, APPROVED → DEPLOYING, DEPLOYING → COMPLETED/FAILED</li>
 *   <li>종료 상태에서는 어떤 전이도 불가</li>
 *   <li>PENDING_APPROVAL에서 도달 가능한 상태 집합은 전체 상태</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class StateTransitionTest {

    // ========== 정상 전이 ==========

    @Test
    void transition_ApprovalFlowToCompleted_Succeeds() {
        // Given
        RequestStatus state = PENDING_APPROVAL;

        // When
        state = StateTransition.transition(state, APPROVED);
        state = StateTransition.transition(state, DEPLOYING);
        state = StateTransition.transition(state, COMPLETED);

        // Then
        assertEquals(COMPLETED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void validate_PendingToRejected_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(PENDING_APPROVAL, REJECTED));
    }

    @Test
    void validate_DeployingToFailed_Succeeds() {
        assertDoesNotThrow(() -> StateTransition.validate(DEPLOYING, FAILED));
    }

    // ========== 금지 전이 ==========

    @Test
    void validate_TerminalStates_RejectEveryTarget() {
        for (RequestStatus terminal : EnumSet.of(REJECTED, COMPLETED, FAILED)) {
            for (RequestStatus target : RequestStatus.values()) {
                LifecycleException e = assertThrows(LifecycleException.class,
                    () -> StateTransition.validate(terminal, target));
                assertEquals(ErrorCode.INVALID_STATE, e.getErrorCode());
            }
        }
    }

    @Test
    void validate_PendingToDeploying_ThrowsInvalidState() {
        // Approval cannot be skipped
        LifecycleException e = assertThrows(LifecycleException.class,
            () -> StateTransition.validate(PENDING_APPROVAL, DEPLOYING));
        assertTrue(e.isGuardViolation());
    }

    @Test
    void validate_ApprovedToCompleted_ThrowsInvalidState() {
        assertThrows(LifecycleException.class, () -> StateTransition.validate(APPROVED, COMPLETED));
    }

    @Test
    void validate_SelfTransition_ThrowsInvalidState() {
        for (RequestStatus status : RequestStatus.values()) {
            assertFalse(StateTransition.isAllowed(status, status), status + " -> " + status);
        }
    }

    @Test
    void validate_NullArgument_ThrowsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(null, APPROVED));
        assertThrows(IllegalArgumentException.class, () -> StateTransition.validate(APPROVED, null));
    }

    // ========== 도달 가능성 ==========

    @Test
    void reachableStates_FromPending_CoverEveryStatus() {
        // Given
        Set<RequestStatus> reached = EnumSet.of(PENDING_APPROVAL);
        Deque<RequestStatus> frontier = new ArrayDeque<>(reached);

        // When
        while (!frontier.isEmpty()) {
            for (RequestStatus next : StateTransition.allowedTargets(frontier.poll())) {
                if (reached.add(next)) {
                    frontier.add(next);
                }
            }
        }

        // Then
        assertEquals(EnumSet.allOf(RequestStatus.class), reached);
    }

    @Test
    void allowedTargets_OfTerminalStates_AreEmpty() {
        assertTrue(StateTransition.allowedTargets(REJECTED).isEmpty());
        assertTrue(StateTransition.allowedTargets(COMPLETED).isEmpty());
        assertTrue(StateTransition.allowedTargets(FAILED).isEmpty());
    }
}
