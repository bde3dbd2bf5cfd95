package com.ryuqq.provisioning.core.model;

import java.time.Instant;

/**
 * 승인 게이트의 최종 결정.
 *
 * <p>Decision은 두 가지 경우 중 하나입니다:</p>
 * <ul>
 *   <li>{@link Approval}: 승인됨 (승인자, 승인 시각)</li>
 *   <li>{@link Rejection}: 반려됨 (반려자, 반려 시각, 사유)</li>
 * </ul>
 *
 * <p>하나의 요청에는 최대 하나의 Decision만 기록되며, 한 번 기록되면 변경되지 않습니다.
 * 승인자와 반려자는 서로 다른 필드로 구분됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public sealed interface Decision permits Approval, Rejection {

    /**
     * 결정을 내린 사람.
     *
     * @return 결정자
     */
    Requester decidedBy();

    /**
     * 결정 시각.
     *
     * @return 결정 시각
     */
    Instant decidedAt();

    /**
     * 승인 결정인지 확인.
     *
     * @return 승인이면 true
     */
    default boolean isApproval() {
        return this instanceof Approval;
    }

    /**
     * 반려 결정인지 확인.
     *
     * @return 반려이면 true
     */
    default boolean isRejection() {
        return this instanceof Rejection;
    }
}
