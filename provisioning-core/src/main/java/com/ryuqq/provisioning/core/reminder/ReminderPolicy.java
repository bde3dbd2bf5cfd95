package com.ryuqq.provisioning.core.reminder;

import com.ryuqq.provisioning.core.model.ApprovalReminder;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * 승인 리마인더 발송 자격 판단 (순수 함수).
 *
 * <p><strong>조건:</strong></p>
 * <ul>
 *   <li>요청이 PENDING_APPROVAL</li>
 *   <li>생성 후 {@code reminderAfter} 이상 경과</li>
 *   <li>마지막 리마인더가 없거나 {@code cooldown} 이상 경과</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ReminderPolicy {

    private final Duration reminderAfter;
    private final Duration cooldown;

    /**
     * 생성자.
     *
     * @param reminderAfter 생성 후 첫 리마인더까지 대기 시간
     * @param cooldown 리마인더 간 최소 간격
     * @throws IllegalArgumentException 값이 null이거나 음수인 경우
     */
    public ReminderPolicy(Duration reminderAfter, Duration cooldown) {
        if (reminderAfter == null || reminderAfter.isNegative()) {
            throw new IllegalArgumentException("reminderAfter must be non-negative");
        }
        if (cooldown == null || cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be non-negative");
        }
        this.reminderAfter = reminderAfter;
        this.cooldown = cooldown;
    }

    /**
     * 리마인더를 보낼 수 있는지 확인.
     *
     * @param request 대상 요청
     * @param lastReminder 마지막 리마인더 (없으면 empty)
     * @param now 현재 시각
     * @return 발송 가능하면 true
     */
    public boolean isEligible(DeploymentRequest request, Optional<ApprovalReminder> lastReminder, Instant now) {
        if (request == null || now == null) {
            throw new IllegalArgumentException("request and now cannot be null");
        }
        if (request.getStatus() != RequestStatus.PENDING_APPROVAL) {
            return false;
        }
        if (request.getCreatedAt().plus(reminderAfter).isAfter(now)) {
            return false;
        }
        return lastReminder
            .map(last -> !last.sentAt().plus(cooldown).isAfter(now))
            .orElse(true);
    }

    public Duration reminderAfter() {
        return reminderAfter;
    }

    public Duration cooldown() {
        return cooldown;
    }
}
