package com.ryuqq.provisioning.core.model;

import com.ryuqq.provisioning.core.notification.Channel;

import java.time.Instant;

/**
 * 승인 대기 요청에 대해 발송된 리마인더 기록 (append-only).
 *
 * @param id 리마인더 ID
 * @param requestId 대상 요청 ID
 * @param channel 발송 채널
 * @param sentAt 발송 시각
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ApprovalReminder(
    String id,
    RequestId requestId,
    Channel channel,
    Instant sentAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public ApprovalReminder {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (sentAt == null) {
            throw new IllegalArgumentException("sentAt cannot be null");
        }
    }
}
