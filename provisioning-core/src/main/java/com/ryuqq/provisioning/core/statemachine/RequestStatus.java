package com.ryuqq.provisioning.core.statemachine;

/**
 * 배포 요청의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>PENDING_APPROVAL → APPROVED (승인)</li>
 *   <li>PENDING_APPROVAL → REJECTED (반려)</li>
 *   <li>APPROVED → DEPLOYING (파이프라인 트리거 성공)</li>
 *   <li>DEPLOYING → COMPLETED (파이프라인 성공)</li>
 *   <li>DEPLOYING → FAILED (파이프라인 실패)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * PENDING_APPROVAL
 *    │
 *    ├─► REJECTED (반려, 종료)
 *    │
 *    ▼ (승인)
 * APPROVED ◄─┐ (트리거 실패 시 유지, 수동 재시도 대상)
 *    │       │
 *    ▼ (트리거 성공)
 * DEPLOYING
 *    │
 *    ├─► COMPLETED (성공)
 *    │
 *    └─► FAILED (실패)
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum RequestStatus {

    /**
     * 승인 대기 (초기 상태).
     */
    PENDING_APPROVAL,

    /**
     * 승인됨, 파이프라인 미시작.
     */
    APPROVED,

    /**
     * 반려됨 (종료).
     */
    REJECTED,

    /**
     * 파이프라인 실행 중.
     */
    DEPLOYING,

    /**
     * 파이프라인 성공 (종료).
     */
    COMPLETED,

    /**
     * 파이프라인 실패 (종료).
     */
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * <p>종료 상태(REJECTED, COMPLETED, FAILED)에서는 더 이상 다른 상태로 전이할 수 없습니다.</p>
     *
     * @return REJECTED, COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == REJECTED || this == COMPLETED || this == FAILED;
    }
}
