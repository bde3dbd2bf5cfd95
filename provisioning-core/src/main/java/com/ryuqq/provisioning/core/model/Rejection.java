package com.ryuqq.provisioning.core.model;

import java.time.Instant;

/**
 * 반려 결정.
 *
 * @param rejector 반려자
 * @param decidedAt 반려 시각
 * @param reason 반려 사유 (빈 문자열 불가)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Rejection(Requester rejector, Instant decidedAt, String reason) implements Decision {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 reason이 비어있는 경우
     */
    public Rejection {
        if (rejector == null) {
            throw new IllegalArgumentException("rejector cannot be null");
        }
        if (decidedAt == null) {
            throw new IllegalArgumentException("decidedAt cannot be null");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
    }

    @Override
    public Requester decidedBy() {
        return rejector;
    }
}
