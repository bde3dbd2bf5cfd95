package com.ryuqq.provisioning.adapter.runner;

import java.time.Duration;

/**
 * ExpirationSweeper 설정 (불변 record).
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param warningWindow 만료 몇 시간 전부터 경고할지 (기본 3일)
 * @param batchSize 배치 크기 (기본 50)
 */
public record ExpirationConfig(
    Duration warningWindow,
    int batchSize
) {

    public ExpirationConfig() {
        this(Duration.ofDays(3), 50);
    }

    public ExpirationConfig {
        if (warningWindow == null || warningWindow.isNegative()) {
            throw new IllegalArgumentException("warningWindow must be non-negative (current: " + warningWindow + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    public ExpirationConfig withWarningWindow(Duration warningWindow) {
        return new ExpirationConfig(warningWindow, batchSize);
    }

    public ExpirationConfig withBatchSize(int batchSize) {
        return new ExpirationConfig(warningWindow, batchSize);
    }
}
