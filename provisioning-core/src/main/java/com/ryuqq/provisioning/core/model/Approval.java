package com.ryuqq.provisioning.core.model;

import java.time.Instant;

/**
 * 승인 결정.
 *
 * @param approver 승인자
 * @param decidedAt 승인 시각
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Approval(Requester approver, Instant decidedAt) implements Decision {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null인 경우
     */
    public Approval {
        if (approver == null) {
            throw new IllegalArgumentException("approver cannot be null");
        }
        if (decidedAt == null) {
            throw new IllegalArgumentException("decidedAt cannot be null");
        }
    }

    @Override
    public Requester decidedBy() {
        return approver;
    }
}
