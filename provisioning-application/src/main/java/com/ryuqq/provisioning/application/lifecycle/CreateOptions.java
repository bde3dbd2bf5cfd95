package com.ryuqq.provisioning.application.lifecycle;

import com.ryuqq.provisioning.core.model.CostTags;

import java.time.Instant;

/**
 * 요청 생성 부가 옵션.
 *
 * @param costTags 비용 태그 (DEPLOY만 사용, DESTROY/SCALE은 부모에서 복사)
 * @param expiresAt 만료 시각 (DEPLOY만 사용, null 가능)
 * @param reason 사유 (DESTROY/SCALE, null 가능)
 * @param newSize 목표 크기 (SCALE, null이면 파라미터의 size 사용)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record CreateOptions(
    CostTags costTags,
    Instant expiresAt,
    String reason,
    String newSize
) {

    private static final CreateOptions NONE = new CreateOptions(null, null, null, null);

    public static CreateOptions none() {
        return NONE;
    }

    public CreateOptions withCostTags(CostTags costTags) {
        return new CreateOptions(costTags, expiresAt, reason, newSize);
    }

    public CreateOptions withExpiresAt(Instant expiresAt) {
        return new CreateOptions(costTags, expiresAt, reason, newSize);
    }

    public CreateOptions withReason(String reason) {
        return new CreateOptions(costTags, expiresAt, reason, newSize);
    }

    public CreateOptions withNewSize(String newSize) {
        return new CreateOptions(costTags, expiresAt, reason, newSize);
    }
}
