package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.core.audit.AuditAction;
import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.error.ErrorCode;
import com.ryuqq.provisioning.core.error.ErrorKind;
import com.ryuqq.provisioning.core.error.LifecycleException;
import com.ryuqq.provisioning.core.model.Actor;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.spi.NotificationOutbox;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.ryuqq.provisioning.adapter.runner.EngineFixture.LEAD;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * 장애 주입 및 동시성 테스트.
 *
 * <ul>
 *   <li>알림 발행 실패는 이미 커밋된 전이를 되돌리지 않음</li>
 *   <li>감사 기록 실패 시 DURABILITY_FAILURE, 레코드 변경 없음</li>
 *   <li>같은 요청에 대한 동시 승인은 정확히 하나만 성공</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class LifecycleFailureTest {

    @Mock
    private NotificationOutbox brokenOutbox;

    // ============================================================
    // 1. 알림 실패 격리
    // ============================================================

    @Test
    void 알림_발행이_실패해도_승인과_감사_기록은_유지됨() {
        // given
        doThrow(new IllegalStateException("outbox unavailable"))
            .when(brokenOutbox).publish(any(Notification.class), anyLong());
        EngineFixture fx = new EngineFixture(brokenOutbox);
        RequestId id = fx.deploy("small");

        // when
        fx.engine.approve(id, LEAD);

        // then
        assertThat(fx.engine.find(id).getStatus()).isEqualTo(RequestStatus.DEPLOYING);
        assertThat(fx.engine.auditTrail(id)).extracting(AuditEntry::action)
            .contains(AuditAction.REQUEST_APPROVED, AuditAction.DEPLOYMENT_STARTED);
        verify(brokenOutbox, atLeastOnce()).publish(any(Notification.class), anyLong());
    }

    @Test
    void 알림은_커밋_이후_outbox에_지연_없이_발행됨() {
        // given
        EngineFixture fx = new EngineFixture(brokenOutbox);
        ArgumentCaptor<Notification> captor = ArgumentCaptor.forClass(Notification.class);

        // when
        RequestId id = fx.deploy("small");

        // then
        verify(brokenOutbox, times(2)).publish(captor.capture(), eq(0L));
        assertThat(captor.getAllValues())
            .allSatisfy(n -> assertThat(n.requestId()).isEqualTo(id))
            .extracting(Notification::recipient)
            .containsExactly("lead@example.com", "ops@example.com");
        assertThat(fx.engine.auditTrail(id)).hasSize(1);
    }

    // ============================================================
    // 2. 감사 기록 실패
    // ============================================================

    @Test
    void 감사_기록이_실패하면_DURABILITY_FAILURE이고_아무것도_바뀌지_않음() {
        // given
        EngineFixture fx = new EngineFixture();
        RequestId id = fx.deploy("small");
        DeploymentRequest before = fx.engine.find(id);
        fx.drainNotifications();
        fx.auditSink.setFailing(true);

        // when / then
        assertThatThrownBy(() -> fx.engine.approve(id, LEAD))
            .isInstanceOf(LifecycleException.class)
            .satisfies(e -> {
                LifecycleException le = (LifecycleException) e;
                assertThat(le.getErrorCode()).isEqualTo(ErrorCode.DURABILITY_FAILURE);
                assertThat(le.getKind()).isEqualTo(ErrorKind.DURABILITY_FAILURE);
            });

        fx.auditSink.setFailing(false);
        assertThat(fx.engine.find(id)).isEqualTo(before);
        assertThat(fx.engine.auditTrail(id)).hasSize(1);
        assertThat(fx.pipeline.triggers()).isEmpty();
        assertThat(fx.drainNotifications()).isEmpty();
    }

    @Test
    void 감사_기록이_실패하면_생성도_남지_않음() {
        EngineFixture fx = new EngineFixture();
        fx.auditSink.setFailing(true);

        assertThatThrownBy(() -> fx.deploy("small"))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.DURABILITY_FAILURE);
        assertThat(fx.store.size()).isZero();
    }

    // ============================================================
    // 3. 동시 승인
    // ============================================================

    @Test
    void 동시_승인은_정확히_하나만_성공() throws Exception {
        // given
        EngineFixture fx = new EngineFixture();
        RequestId id = fx.deploy("small");
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger successes = new AtomicInteger();
        Queue<ErrorCode> failures = new ConcurrentLinkedQueue<>();

        // when
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            Actor approver = Actor.approver("approver" + i + "@example.com", "Approver " + i);
            futures.add(pool.submit(() -> {
                start.await();
                try {
                    fx.engine.approve(id, approver);
                    successes.incrementAndGet();
                } catch (LifecycleException e) {
                    failures.add(e.getErrorCode());
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();

        // then
        assertThat(successes.get()).isEqualTo(1);
        assertThat(failures).hasSize(threads - 1).containsOnly(ErrorCode.INVALID_STATE);
        assertThat(fx.engine.auditTrail(id)).filteredOn(e -> e.action() == AuditAction.REQUEST_APPROVED).hasSize(1);
        assertThat(fx.pipeline.triggers()).hasSize(1);
    }
}
