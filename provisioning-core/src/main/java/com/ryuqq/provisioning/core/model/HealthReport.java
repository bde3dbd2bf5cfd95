package com.ryuqq.provisioning.core.model;

import java.time.Instant;

/**
 * 마지막 헬스 체크 결과.
 *
 * @param health 헬스 상태
 * @param details 상세 설명 (null 가능)
 * @param checkedAt 체크 시각 (UNKNOWN 초기 상태에서는 null)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record HealthReport(ResourceHealth health, String details, Instant checkedAt) {

    private static final HealthReport UNCHECKED = new HealthReport(ResourceHealth.UNKNOWN, null, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException health가 null인 경우
     */
    public HealthReport {
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
    }

    /**
     * 아직 체크되지 않은 초기 상태.
     *
     * @return UNKNOWN HealthReport
     */
    public static HealthReport unchecked() {
        return UNCHECKED;
    }
}
