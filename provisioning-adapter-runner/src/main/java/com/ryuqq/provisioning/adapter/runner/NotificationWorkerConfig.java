package com.ryuqq.provisioning.adapter.runner;

/**
 * NotificationWorker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>batchSize: 한 번에 dequeue할 메시지 수 (기본 10)</li>
 *   <li>concurrency: 동시 발송 스레드 수 (기본 4)</li>
 *   <li>maxAttempts: 최대 발송 시도 횟수 (기본 5)</li>
 *   <li>dlqEnabled: 시도 소진 시 DLQ 보관 여부 (기본 true, false면 로그 후 폐기)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param batchSize 배치 크기 (1 이상)
 * @param concurrency 동시 발송 스레드 수 (1 이상)
 * @param maxAttempts 최대 발송 시도 횟수 (1 이상)
 * @param dlqEnabled DLQ 보관 여부
 */
public record NotificationWorkerConfig(
    int batchSize,
    int concurrency,
    int maxAttempts,
    boolean dlqEnabled
) {

    /**
     * 기본 설정 생성자.
     */
    public NotificationWorkerConfig() {
        this(10, 4, 5, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public NotificationWorkerConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
    }

    public NotificationWorkerConfig withBatchSize(int batchSize) {
        return new NotificationWorkerConfig(batchSize, concurrency, maxAttempts, dlqEnabled);
    }

    public NotificationWorkerConfig withConcurrency(int concurrency) {
        return new NotificationWorkerConfig(batchSize, concurrency, maxAttempts, dlqEnabled);
    }

    public NotificationWorkerConfig withMaxAttempts(int maxAttempts) {
        return new NotificationWorkerConfig(batchSize, concurrency, maxAttempts, dlqEnabled);
    }

    public NotificationWorkerConfig withDlqEnabled(boolean dlqEnabled) {
        return new NotificationWorkerConfig(batchSize, concurrency, maxAttempts, dlqEnabled);
    }
}
