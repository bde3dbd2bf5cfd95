package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.sweep.Sweep;
import com.ryuqq.provisioning.core.model.ApprovalReminder;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.reminder.ReminderPolicy;
import com.ryuqq.provisioning.core.spi.ReminderLog;
import com.ryuqq.provisioning.core.spi.RequestStore;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 승인 대기 요청 리마인더 스위퍼.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. findByStatus(PENDING_APPROVAL, batchSize) → 오래된 순
 * 2. For each request:
 *    a. ReminderPolicy.isEligible(request, reminderLog.latest(id), now)
 *    b. APPROVAL_REMINDER_SENT 감사 커밋 (커밋 시점에 여전히 PENDING_APPROVAL인지 확인)
 *    c. reminderLog.append(ApprovalReminder)
 *    d. APPROVAL_REMINDER 알림 발행
 * 3. 발송 건수 로깅
 * </pre>
 *
 * <p>커밋이 실패하면(이미 승인/반려됨) 리마인더를 남기지 않고 다음 요청으로 넘어갑니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ApprovalReminderSweeper implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(ApprovalReminderSweeper.class);

    private final LifecycleEngine engine;
    private final RequestStore store;
    private final ReminderLog reminderLog;
    private final ReminderConfig config;
    private final ReminderPolicy policy;

    /**
     * 생성자.
     *
     * @param engine 생명주기 엔진 (감사 커밋과 알림 발행에 사용)
     * @param store 요청 저장소 (조회 전용)
     * @param reminderLog 리마인더 로그
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ApprovalReminderSweeper(LifecycleEngine engine, RequestStore store, ReminderLog reminderLog, ReminderConfig config) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (reminderLog == null) {
            throw new IllegalArgumentException("reminderLog cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.engine = engine;
        this.store = store;
        this.reminderLog = reminderLog;
        this.config = config;
        this.policy = new ReminderPolicy(config.reminderAfter(), config.cooldown());
    }

    @Override
    public int scan() {
        log.info("Approval reminder scan started");

        List<DeploymentRequest> pending = store.findByStatus(RequestStatus.PENDING_APPROVAL, config.batchSize());
        Instant now = engine.clock().instant();

        int sent = 0;
        for (DeploymentRequest request : pending) {
            if (tryRemind(request, now)) {
                sent++;
            }
        }

        log.info("Approval reminder scan completed: {} reminders out of {} pending", sent, pending.size());
        return sent;
    }

    private boolean tryRemind(DeploymentRequest request, Instant now) {
        try {
            Optional<ApprovalReminder> last = reminderLog.latest(request.getId());
            if (!policy.isEligible(request, last, now)) {
                return false;
            }

            Duration pending = Duration.between(request.getCreatedAt(), now);
            engine.recordReminderSent(request, config.channel(), pending);
            reminderLog.append(new ApprovalReminder(UUID.randomUUID().toString(), request.getId(), config.channel(), now));

            String templateName = engine.templateNameOf(request);
            engine.notifications()
                .approvalReminder(request, templateName, pending, config.channel())
                .forEach(engine::publishNotification);

            log.debug("Approval reminder sent for {} (pending {}h)", request.getId(), pending.toHours());
            return true;

        } catch (Exception e) {
            log.error("Failed to send approval reminder for {}", request.getId(), e);
            return false;
        }
    }
}
