package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.core.audit.AuditAction;
import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.model.ApprovalReminder;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.notification.Channel;
import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.notification.NotificationKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static com.ryuqq.provisioning.adapter.runner.EngineFixture.LEAD;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * ApprovalReminderSweeper 테스트.
 *
 * <ul>
 *   <li>reminderAfter 이전에는 발송하지 않음</li>
 *   <li>발송 시 감사 기록, 리마인더 로그, 알림</li>
 *   <li>cooldown 동안 재발송하지 않음</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class ApprovalReminderSweeperTest {

    private EngineFixture fx;
    private ApprovalReminderSweeper sweeper;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        sweeper = new ApprovalReminderSweeper(fx.engine, fx.store, fx.reminderLog, new ReminderConfig());
    }

    @Test
    void 대기_시간이_4시간_미만이면_발송하지_않음() {
        // given
        RequestId id = fx.deploy("small");
        fx.drainNotifications();
        fx.clock.advance(Duration.ofHours(3).plusMinutes(59));

        // when
        int sent = sweeper.scan();

        // then
        assertThat(sent).isZero();
        assertThat(fx.reminderLog.findByRequest(id)).isEmpty();
        assertThat(fx.drainNotifications()).isEmpty();
    }

    @Test
    void 대기_4시간이_되면_감사_로그_CHAT_알림이_남음() {
        // given
        RequestId id = fx.deploy("small");
        fx.drainNotifications();
        fx.clock.advance(Duration.ofHours(4));

        // when
        int sent = sweeper.scan();

        // then
        assertThat(sent).isEqualTo(1);

        List<AuditEntry> trail = fx.engine.auditTrail(id);
        AuditEntry reminder = trail.get(trail.size() - 1);
        assertThat(reminder.action()).isEqualTo(AuditAction.APPROVAL_REMINDER_SENT);
        assertThat(reminder.actorEmail()).isEqualTo("scheduler@system.local");
        assertThat(reminder.details()).containsEntry("channel", "CHAT").containsEntry("pending_hours", "4");

        assertThat(fx.reminderLog.findByRequest(id)).singleElement()
            .satisfies(r -> {
                assertThat(r.channel()).isEqualTo(Channel.CHAT);
                assertThat(r.sentAt()).isEqualTo(fx.clock.instant());
            });

        List<Notification> notifications = fx.drainNotifications(NotificationKind.APPROVAL_REMINDER);
        assertThat(notifications).singleElement().satisfies(n -> {
            assertThat(n.channel()).isEqualTo(Channel.CHAT);
            assertThat(n.recipient()).isNull();
            assertThat(n.facts()).containsEntry("pending_hours", "4");
        });
    }

    @Test
    void cooldown_동안은_다시_발송하지_않고_지나면_다시_발송() {
        // given
        RequestId id = fx.deploy("small");
        fx.clock.advance(Duration.ofHours(4));
        sweeper.scan();

        // when
        fx.clock.advance(Duration.ofHours(3));
        int duringCooldown = sweeper.scan();
        fx.clock.advance(Duration.ofHours(1));
        int afterCooldown = sweeper.scan();

        // then
        assertThat(duringCooldown).isZero();
        assertThat(afterCooldown).isEqualTo(1);
        assertThat(fx.reminderLog.findByRequest(id)).extracting(ApprovalReminder::sentAt).hasSize(2);
        assertThat(fx.engine.auditTrail(id)).filteredOn(e -> e.action() == AuditAction.APPROVAL_REMINDER_SENT).hasSize(2);
    }

    @Test
    void 승인된_요청에는_발송하지_않음() {
        // given
        RequestId id = fx.deploy("small");
        fx.engine.approve(id, LEAD);
        fx.clock.advance(Duration.ofHours(8));

        // when
        int sent = sweeper.scan();

        // then
        assertThat(sent).isZero();
        assertThat(fx.reminderLog.findByRequest(id)).isEmpty();
    }

    @Test
    void EMAIL_채널이면_승인자마다_한_통씩() {
        // given
        ApprovalReminderSweeper emailSweeper = new ApprovalReminderSweeper(fx.engine, fx.store, fx.reminderLog,
            new ReminderConfig().withChannel(Channel.EMAIL));
        fx.deploy("small");
        fx.drainNotifications();
        fx.clock.advance(Duration.ofHours(5));

        // when
        emailSweeper.scan();

        // then
        assertThat(fx.drainNotifications(NotificationKind.APPROVAL_REMINDER))
            .extracting(Notification::recipient)
            .containsExactly("lead@example.com", "ops@example.com");
    }

    @Test
    void 감사_기록이_실패하면_로그와_알림을_남기지_않고_다음_스캔에서_다시_시도() {
        // given
        RequestId id = fx.deploy("small");
        fx.drainNotifications();
        fx.clock.advance(Duration.ofHours(4));
        fx.auditSink.setFailing(true);

        // when
        int failed = sweeper.scan();
        fx.auditSink.setFailing(false);
        int retried = sweeper.scan();

        // then
        assertThat(failed).isZero();
        assertThat(retried).isEqualTo(1);
        assertThat(fx.reminderLog.findByRequest(id)).hasSize(1);
        assertThat(fx.drainNotifications(NotificationKind.APPROVAL_REMINDER)).hasSize(1);
    }
}
