package com.ryuqq.provisioning.core.model;

import java.time.Instant;

/**
 * DEPLOY 요청의 리소스가 해제되었음을 나타내는 기록.
 *
 * <p>해당 DEPLOY를 부모로 하는 DESTROY 요청이 COMPLETED 될 때 부모에 한 번만 기록됩니다.</p>
 *
 * @param releasedBy 해제를 수행한 DESTROY 요청 ID
 * @param releasedAt 해제 시각
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ResourceRelease(RequestId releasedBy, Instant releasedAt) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null인 경우
     */
    public ResourceRelease {
        if (releasedBy == null) {
            throw new IllegalArgumentException("releasedBy cannot be null");
        }
        if (releasedAt == null) {
            throw new IllegalArgumentException("releasedAt cannot be null");
        }
    }
}
