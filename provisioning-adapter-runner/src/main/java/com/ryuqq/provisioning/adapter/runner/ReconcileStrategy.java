package com.ryuqq.provisioning.adapter.runner;

/**
 * 오래 끝나지 않는 DEPLOYING 요청 처리 전략.
 *
 * <p>파이프라인은 멱등성을 보장하지 않으므로 재트리거 전략은 없습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum ReconcileStrategy {

    /**
     * 경고 로그만 남기고 계속 폴링.
     */
    WAIT,

    /**
     * 파이프라인 실패로 기록 (DEPLOYING → FAILED).
     *
     * <p>외부 실행이 실제로는 계속 진행 중일 수 있어 수동 확인이 필요합니다.</p>
     */
    FAIL
}
