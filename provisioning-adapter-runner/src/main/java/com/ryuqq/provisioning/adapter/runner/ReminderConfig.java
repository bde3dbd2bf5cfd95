package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.core.notification.Channel;

import java.time.Duration;

/**
 * ApprovalReminderSweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>reminderAfter: 생성 후 첫 리마인더까지 대기 시간 (기본 4시간)</li>
 *   <li>cooldown: 리마인더 간 최소 간격 (기본 4시간)</li>
 *   <li>batchSize: 한 번에 검사할 승인 대기 요청 수 (기본 50)</li>
 *   <li>channel: 발송 채널 (기본 CHAT)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param reminderAfter 첫 리마인더 대기 시간
 * @param cooldown 리마인더 간격
 * @param batchSize 배치 크기 (1 이상)
 * @param channel 발송 채널
 */
public record ReminderConfig(
    Duration reminderAfter,
    Duration cooldown,
    int batchSize,
    Channel channel
) {

    /**
     * 기본 설정 생성자.
     */
    public ReminderConfig() {
        this(Duration.ofHours(4), Duration.ofHours(4), 50, Channel.CHAT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ReminderConfig {
        if (reminderAfter == null || reminderAfter.isNegative()) {
            throw new IllegalArgumentException("reminderAfter must be non-negative (current: " + reminderAfter + ")");
        }
        if (cooldown == null || cooldown.isNegative() || cooldown.isZero()) {
            throw new IllegalArgumentException("cooldown must be positive (current: " + cooldown + ")");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
    }

    public ReminderConfig withReminderAfter(Duration reminderAfter) {
        return new ReminderConfig(reminderAfter, cooldown, batchSize, channel);
    }

    public ReminderConfig withCooldown(Duration cooldown) {
        return new ReminderConfig(reminderAfter, cooldown, batchSize, channel);
    }

    public ReminderConfig withBatchSize(int batchSize) {
        return new ReminderConfig(reminderAfter, cooldown, batchSize, channel);
    }

    public ReminderConfig withChannel(Channel channel) {
        return new ReminderConfig(reminderAfter, cooldown, batchSize, channel);
    }
}
