package com.ryuqq.provisioning.core.statemachine;

import com.ryuqq.provisioning.core.error.ErrorCode;
import com.ryuqq.provisioning.core.error.LifecycleException;

import java.util.EnumSet;
import java.util.Set;

/**
 * 상태 전이 검증 및 실행.
 *
 * <p>이 클래스는 배포 요청의 상태 전이가 허용된 규칙을 따르는지
 * 검증하고, 불변식을 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>PENDING_APPROVAL → APPROVED</li>
 *   <li>PENDING_APPROVAL → REJECTED</li>
 *   <li>APPROVED → DEPLOYING</li>
 *   <li>DEPLOYING → COMPLETED</li>
 *   <li>DEPLOYING → FAILED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>종료 상태(REJECTED, COMPLETED, FAILED)에서는 어떤 상태로도 전이 불가</li>
 *   <li>역방향 전이 불가 (예: APPROVED → PENDING_APPROVAL)</li>
 *   <li>자기 자신으로의 전이 불가</li>
 * </ul>
 *
 * <p>허용되지 않은 전이는 {@link ErrorCode#INVALID_STATE} 가드 위반으로 보고됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class StateTransition {

    // Utility class - prevent instantiation
    private StateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 현재 상태에서 도달 가능한 다음 상태 집합.
     *
     * @param from 현재 상태
     * @return 허용된 다음 상태 (종료 상태이면 빈 집합)
     * @throws IllegalArgumentException from이 null인 경우
     */
    public static Set<RequestStatus> allowedTargets(RequestStatus from) {
        if (from == null) {
            throw new IllegalArgumentException("from cannot be null");
        }
        return switch (from) {
            case PENDING_APPROVAL -> EnumSet.of(RequestStatus.APPROVED, RequestStatus.REJECTED);
            case APPROVED -> EnumSet.of(RequestStatus.DEPLOYING);
            case DEPLOYING -> EnumSet.of(RequestStatus.COMPLETED, RequestStatus.FAILED);
            case REJECTED, COMPLETED, FAILED -> EnumSet.noneOf(RequestStatus.class);
        };
    }

    /**
     * 상태 전이가 유효한지 확인 (예외 없이).
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용된 전이이면 true
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     */
    public static boolean isAllowed(RequestStatus from, RequestStatus to) {
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null");
        }
        return allowedTargets(from).contains(to);
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws LifecycleException 유효하지 않은 전이인 경우 (INVALID_STATE)
     */
    public static void validate(RequestStatus from, RequestStatus to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 종료 상태에서는 어디로도 전이 불가
        if (from.isTerminal()) {
            throw new LifecycleException(
                ErrorCode.INVALID_STATE,
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        if (!isAllowed(from, to)) {
            throw new LifecycleException(
                ErrorCode.INVALID_STATE,
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws LifecycleException 유효하지 않은 전이인 경우
     */
    public static RequestStatus transition(RequestStatus current, RequestStatus next) {
        validate(current, next);
        return next;
    }
}
