package com.ryuqq.provisioning.adapter.runner;

/**
 * PipelineReconciler 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 한 번에 폴링할 DEPLOYING 요청 수 (기본 50)</li>
 *   <li>stuckThresholdMs: 마지막 변경 후 이 시간이 지나면 정체로 판단 (기본 3600000ms = 1시간)</li>
 *   <li>strategy: 정체 요청 처리 전략 (기본 WAIT)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상)
 * @param stuckThresholdMs 정체 임계값 (밀리초, 양수)
 * @param strategy 정체 처리 전략
 */
public record ReconcilerConfig(
    int batchSize,
    long stuckThresholdMs,
    ReconcileStrategy strategy
) {

    /**
     * 기본 설정 생성자.
     */
    public ReconcilerConfig() {
        this(50, 3600000, ReconcileStrategy.WAIT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReconcilerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (stuckThresholdMs <= 0) {
            throw new IllegalArgumentException(
                "stuckThresholdMs must be positive (current: " + stuckThresholdMs + ")"
            );
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
    }

    public ReconcilerConfig withBatchSize(int batchSize) {
        return new ReconcilerConfig(batchSize, stuckThresholdMs, strategy);
    }

    public ReconcilerConfig withStuckThresholdMs(long stuckThresholdMs) {
        return new ReconcilerConfig(batchSize, stuckThresholdMs, strategy);
    }

    public ReconcilerConfig withStrategy(ReconcileStrategy strategy) {
        return new ReconcilerConfig(batchSize, stuckThresholdMs, strategy);
    }
}
