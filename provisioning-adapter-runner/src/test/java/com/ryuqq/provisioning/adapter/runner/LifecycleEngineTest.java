package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.lifecycle.AuditStatistics;
import com.ryuqq.provisioning.application.lifecycle.CreateOptions;
import com.ryuqq.provisioning.core.audit.AuditAction;
import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.error.ErrorCode;
import com.ryuqq.provisioning.core.error.LifecycleException;
import com.ryuqq.provisioning.core.model.CostTags;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.Parameters;
import com.ryuqq.provisioning.core.model.Provenance;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.model.RequestType;
import com.ryuqq.provisioning.core.model.ResourceHealth;
import com.ryuqq.provisioning.core.notification.Channel;
import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.notification.NotificationKind;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;
import com.ryuqq.provisioning.testkit.fake.ScriptedPipelineClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.ryuqq.provisioning.adapter.runner.EngineFixture.DEV;
import static com.ryuqq.provisioning.adapter.runner.EngineFixture.LEAD;
import static com.ryuqq.provisioning.adapter.runner.EngineFixture.MANUAL;
import static com.ryuqq.provisioning.adapter.runner.EngineFixture.POSTGRES;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * LifecycleEngine 통합 테스트 (in-memory 어댑터 사용).
 *
 * <ul>
 *   <li>생성 / 승인 / 반려 / 파이프라인 결과 반영</li>
 *   <li>가드 위반 시 변경 없음</li>
 *   <li>전이당 감사 항목 하나, 시간 비감소</li>
 *   <li>트리거 실패 시 APPROVED 유지 후 재트리거</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
class LifecycleEngineTest {

    private EngineFixture fx;
    private LifecycleEngine engine;

    @BeforeEach
    void setUp() {
        fx = new EngineFixture();
        engine = fx.engine;
    }

    // ============================================================
    // 1. 생성
    // ============================================================

    @Test
    void 생성하면_PENDING_APPROVAL_상태와_REQUEST_CREATED_감사가_남음() {
        // when
        RequestId id = fx.deploy("small");

        // then
        DeploymentRequest request = engine.find(id);
        assertThat(request.getStatus()).isEqualTo(RequestStatus.PENDING_APPROVAL);
        assertThat(request.getRequester().email()).isEqualTo("dev@example.com");
        assertThat(request.getParameters().get("version")).contains("16");

        List<AuditEntry> trail = engine.auditTrail(id);
        assertThat(trail).hasSize(1);
        assertThat(trail.get(0).action()).isEqualTo(AuditAction.REQUEST_CREATED);
        assertThat(trail.get(0).details()).containsEntry("request_type", "DEPLOY");
    }

    @Test
    void 생성하면_승인자마다_APPROVAL_REQUESTED_알림이_발행됨() {
        // when
        RequestId id = fx.deploy("small");

        // then
        List<Notification> sent = fx.drainNotifications(NotificationKind.APPROVAL_REQUESTED);
        assertThat(sent).extracting(Notification::recipient).containsExactly("lead@example.com", "ops@example.com");
        assertThat(sent).allSatisfy(n -> {
            assertThat(n.channel()).isEqualTo(Channel.EMAIL);
            assertThat(n.facts()).containsEntry("template_name", "PostgreSQL Database");
            assertThat(n.facts()).containsEntry("link", "https://portal.example.com/requests/" + id.getValue());
        });
    }

    @Test
    void 승인_요청_알림에_카탈로그의_예상_월_비용이_포함됨() {
        // when
        fx.deploy("small");
        RequestId manual = engine.createRequest(MANUAL, DEV, RequestType.DEPLOY, Parameters.empty(), null);

        // then
        List<Notification> sent = fx.drainNotifications(NotificationKind.APPROVAL_REQUESTED);
        assertThat(sent).filteredOn(n -> !n.requestId().equals(manual))
            .hasSize(2)
            .allSatisfy(n -> assertThat(n.facts()).containsEntry("estimated_monthly_cost", "120.00"));
        assertThat(sent).filteredOn(n -> n.requestId().equals(manual))
            .hasSize(2)
            .allSatisfy(n -> assertThat(n.facts()).doesNotContainKey("estimated_monthly_cost"));
    }

    @Test
    void 호출자_출처가_붙은_행위자의_출처가_감사_기록에_남음() {
        // given
        Provenance fromProxy = Provenance.fromHeaders("203.0.113.7, 10.0.0.1", "10.0.0.1", "curl/8.4.0");
        Provenance fromConsole = Provenance.fromHeaders(null, "198.51.100.20", "Mozilla/5.0");

        // when
        RequestId id = fx.deploy(DEV.from(fromProxy), "small");
        engine.approve(id, LEAD.from(fromConsole));

        // then
        List<AuditEntry> trail = engine.auditTrail(id);
        assertThat(trail.get(0).action()).isEqualTo(AuditAction.REQUEST_CREATED);
        assertThat(trail.get(0).provenance()).isEqualTo(new Provenance("203.0.113.7", "curl/8.4.0"));
        assertThat(trail).filteredOn(e -> e.action() == AuditAction.REQUEST_APPROVED)
            .singleElement()
            .satisfies(e -> assertThat(e.provenance()).isEqualTo(fromConsole));
    }

    @Test
    void 필수_파라미터가_없으면_MISSING_PARAMETER이고_레코드가_생기지_않음() {
        assertThatThrownBy(() -> engine.createRequest(POSTGRES, DEV, RequestType.DEPLOY, Parameters.empty(), null))
            .isInstanceOf(LifecycleException.class)
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.MISSING_PARAMETER);

        assertThat(fx.store.size()).isZero();
    }

    @Test
    void 카탈로그에_없는_항목도_파라미터_그대로_생성됨() {
        RequestId id = engine.createRequest("legacy-item", DEV, RequestType.DEPLOY, Parameters.of(Map.of("size", "tiny")), null);

        assertThat(engine.find(id).getParameters().asMap()).containsExactly(Map.entry("size", "tiny"));
        assertThat(fx.drainNotifications(NotificationKind.APPROVAL_REQUESTED))
            .allSatisfy(n -> assertThat(n.facts()).containsEntry("template_name", "legacy-item"));
    }

    @Test
    void DEPLOY에_부모를_지정하면_INVALID_LINEAGE() {
        RequestId parent = fx.completedDeploy("small");

        assertThatThrownBy(() -> engine.createRequest(POSTGRES, DEV, RequestType.DEPLOY, Parameters.of(Map.of("size", "large")), parent))
            .isInstanceOf(LifecycleException.class)
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_LINEAGE);
    }

    @Test
    void 생성_옵션의_비용태그와_만료시각이_저장됨() {
        Instant expiresAt = fx.clock.instant().plus(Duration.ofDays(30));
        CostTags tags = new CostTags("CC-100", "dev", "PRJ-7");

        RequestId id = engine.createRequest(POSTGRES, DEV, RequestType.DEPLOY, Parameters.of(Map.of("size", "small")), null,
            CreateOptions.none().withCostTags(tags).withExpiresAt(expiresAt));

        DeploymentRequest request = engine.find(id);
        assertThat(request.getCostTags()).isEqualTo(tags);
        assertThat(request.getExpiresAt()).contains(expiresAt);
    }

    // ============================================================
    // 2. 승인 / 반려
    // ============================================================

    @Test
    void 승인하면_파이프라인이_트리거되어_DEPLOYING이_됨() {
        // given
        RequestId id = fx.deploy("small");

        // when
        engine.approve(id, LEAD);

        // then
        DeploymentRequest request = engine.find(id);
        assertThat(request.getStatus()).isEqualTo(RequestStatus.DEPLOYING);
        assertThat(request.getPipelineRun()).isPresent();

        ScriptedPipelineClient.Trigger trigger = fx.pipeline.triggers().get(0);
        assertThat(trigger.parameters().asMap())
            .containsEntry("size", "small")
            .containsEntry("version", "16")
            .containsEntry("module_name", "postgres");

        assertThat(engine.auditTrail(id)).extracting(AuditEntry::action)
            .containsExactly(AuditAction.REQUEST_CREATED, AuditAction.REQUEST_APPROVED, AuditAction.DEPLOYMENT_STARTED);
        assertThat(fx.drainNotifications()).extracting(Notification::kind)
            .contains(NotificationKind.REQUEST_APPROVED, NotificationKind.DEPLOYMENT_STARTED);
    }

    @Test
    void 승인자가_아니면_FORBIDDEN이고_변경이_없음() {
        RequestId id = fx.deploy("small");
        DeploymentRequest before = engine.find(id);

        assertThatThrownBy(() -> engine.approve(id, DEV))
            .isInstanceOf(LifecycleException.class)
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.FORBIDDEN);

        assertThat(engine.find(id)).isEqualTo(before);
        assertThat(engine.auditTrail(id)).hasSize(1);
    }

    @Test
    void 없는_요청_승인은_NOT_FOUND_권한_확인이_먼저() {
        RequestId missing = RequestId.of("missing-1");

        assertThatThrownBy(() -> engine.approve(missing, LEAD))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> engine.approve(missing, DEV))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.FORBIDDEN);
    }

    @Test
    void 대기_상태가_아닌_요청의_승인과_반려는_INVALID_STATE이고_레코드가_그대로임() {
        // given
        RequestId id = fx.deploy("small");
        engine.approve(id, LEAD);
        DeploymentRequest before = engine.find(id);
        int auditCount = engine.auditTrail(id).size();

        // when / then
        assertThatThrownBy(() -> engine.approve(id, LEAD))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_STATE);
        assertThatThrownBy(() -> engine.reject(id, LEAD, "late"))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_STATE);

        assertThat(engine.find(id)).isEqualTo(before);
        assertThat(engine.auditTrail(id)).hasSize(auditCount);
    }

    @Test
    void 반려하면_REJECTED와_사유가_기록되고_요청자에게_알림() {
        // given
        RequestId id = fx.deploy("small");
        fx.drainNotifications();

        // when
        engine.reject(id, LEAD, "  budget exceeded ");

        // then
        assertThat(engine.find(id).getStatus()).isEqualTo(RequestStatus.REJECTED);
        AuditEntry last = lastEntry(id);
        assertThat(last.action()).isEqualTo(AuditAction.REQUEST_REJECTED);
        assertThat(last.details()).containsEntry("reason", "budget exceeded");

        List<Notification> sent = fx.drainNotifications(NotificationKind.REQUEST_REJECTED);
        assertThat(sent).singleElement().satisfies(n -> {
            assertThat(n.recipient()).isEqualTo("dev@example.com");
            assertThat(n.facts()).containsEntry("reason", "budget exceeded");
        });
        assertThat(fx.pipeline.triggers()).isEmpty();
    }

    @Test
    void 빈_사유로_반려하면_EMPTY_REASON() {
        RequestId id = fx.deploy("small");

        assertThatThrownBy(() -> engine.reject(id, LEAD, "   "))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.EMPTY_REASON);
        assertThat(engine.find(id).getStatus()).isEqualTo(RequestStatus.PENDING_APPROVAL);
    }

    // ============================================================
    // 3. 트리거 실패 / 재트리거
    // ============================================================

    @Test
    void 트리거가_실패하면_APPROVED로_남고_재트리거하면_DEPLOYING이_됨() {
        // given
        RequestId id = fx.deploy("small");
        fx.pipeline.failNextTriggers(1);

        // when
        engine.approve(id, LEAD);

        // then
        assertThat(engine.find(id).getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(lastEntry(id).action()).isEqualTo(AuditAction.REQUEST_APPROVED);

        // when
        DeploymentRequest retriggered = engine.retriggerPipeline(id, LEAD);

        // then
        assertThat(retriggered.getStatus()).isEqualTo(RequestStatus.DEPLOYING);
        assertThat(engine.find(id).getStatus()).isEqualTo(RequestStatus.DEPLOYING);
        assertThat(lastEntry(id).action()).isEqualTo(AuditAction.DEPLOYMENT_STARTED);
    }

    @Test
    void 재트리거는_APPROVED_상태와_승인자만_허용() {
        RequestId id = fx.deploy("small");

        assertThatThrownBy(() -> engine.retriggerPipeline(id, LEAD))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_STATE);
        assertThatThrownBy(() -> engine.retriggerPipeline(id, DEV))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.FORBIDDEN);
    }

    @Test
    void 파이프라인_대상이_없는_카탈로그는_APPROVED로_남음() {
        RequestId id = engine.createRequest(MANUAL, DEV, RequestType.DEPLOY, Parameters.empty(), null);

        engine.approve(id, LEAD);

        assertThat(engine.find(id).getStatus()).isEqualTo(RequestStatus.APPROVED);
        assertThat(fx.pipeline.triggers()).isEmpty();
    }

    // ============================================================
    // 4. 파이프라인 결과
    // ============================================================

    @Test
    void 파이프라인_성공이면_COMPLETED_실패면_FAILED() {
        // given
        RequestId ok = fx.deploy("small");
        RequestId broken = fx.deploy("large");
        engine.approve(ok, LEAD);
        engine.approve(broken, LEAD);

        // when
        engine.recordPipelineResult(ok, true, "https://ci.example.com/run-1");
        engine.recordPipelineResult(broken, false, "terraform apply failed");

        // then
        assertThat(engine.find(ok).getStatus()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(engine.find(broken).getStatus()).isEqualTo(RequestStatus.FAILED);
        assertThat(engine.find(broken).getDeploymentOutput()).contains("terraform apply failed");
        assertThat(lastEntry(ok).actorEmail()).isEqualTo("pipeline@system.local");
        assertThat(lastEntry(broken).action()).isEqualTo(AuditAction.DEPLOYMENT_FAILED);
        assertThat(fx.drainNotifications()).extracting(Notification::kind)
            .contains(NotificationKind.DEPLOYMENT_COMPLETED, NotificationKind.DEPLOYMENT_FAILED);
    }

    @Test
    void DEPLOYING이_아닌_요청에_결과를_기록하면_INVALID_STATE() {
        RequestId id = fx.deploy("small");

        assertThatThrownBy(() -> engine.recordPipelineResult(id, true, null))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.INVALID_STATE);
        assertThat(engine.auditTrail(id)).hasSize(1);
    }

    @Test
    void 전이마다_감사_항목이_정확히_하나씩_추가되고_시간은_감소하지_않음() {
        // given
        RequestId id = fx.deploy("small");
        fx.clock.advance(Duration.ofMinutes(5));
        engine.approve(id, LEAD);
        fx.clock.set(fx.clock.instant().minus(Duration.ofMinutes(1)));
        engine.recordPipelineResult(id, true, null);

        // when
        List<AuditEntry> trail = engine.auditTrail(id);

        // then
        assertThat(trail).extracting(AuditEntry::action).containsExactly(
            AuditAction.REQUEST_CREATED, AuditAction.REQUEST_APPROVED,
            AuditAction.DEPLOYMENT_STARTED, AuditAction.DEPLOYMENT_COMPLETED);
        assertThat(trail).extracting(AuditEntry::requestSequence).containsExactly(1L, 2L, 3L, 4L);
        for (int i = 1; i < trail.size(); i++) {
            assertThat(trail.get(i).timestamp()).isAfterOrEqualTo(trail.get(i - 1).timestamp());
        }
    }

    // ============================================================
    // 5. 만료 / 헬스
    // ============================================================

    @Test
    void 만료_경고_표시는_한_번만_감사에_남음() {
        RequestId id = fx.completedDeploy("small");

        engine.markExpirationWarned(id);
        engine.markExpirationWarned(id);

        assertThat(engine.find(id).isExpirationWarningSent()).isTrue();
        assertThat(countActions(id, AuditAction.EXPIRATION_WARNED)).isEqualTo(1);
    }

    @Test
    void 만료_경고_대상이_없으면_NOT_FOUND() {
        assertThatThrownBy(() -> engine.markExpirationWarned(RequestId.of("missing-2")))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void 헬스는_COMPLETED에만_기록되고_값이_바뀔_때만_감사에_남음() {
        // given
        RequestId pending = fx.deploy("small");
        RequestId id = fx.completedDeploy("small");

        // when / then
        assertThatThrownBy(() -> engine.recordHealth(pending, ResourceHealth.HEALTHY, null))
            .extracting(e -> ((LifecycleException) e).getErrorCode())
            .isEqualTo(ErrorCode.NOT_COMPLETED);

        engine.recordHealth(id, ResourceHealth.HEALTHY, "ok");
        fx.clock.advance(Duration.ofMinutes(10));
        engine.recordHealth(id, ResourceHealth.HEALTHY, "ok");
        engine.recordHealth(id, ResourceHealth.UNHEALTHY, "connection refused");

        DeploymentRequest checked = engine.find(id);
        assertThat(checked.getStatus()).isEqualTo(RequestStatus.COMPLETED);
        assertThat(checked.getHealth().health()).isEqualTo(ResourceHealth.UNHEALTHY);
        assertThat(checked.getHealth().checkedAt()).isEqualTo(fx.clock.instant());
        assertThat(countActions(id, AuditAction.HEALTH_RECORDED)).isEqualTo(2);
    }

    // ============================================================
    // 6. 조회
    // ============================================================

    @Test
    void 승인_대기_목록은_오래된_순() {
        RequestId first = fx.deploy("small");
        fx.clock.advance(Duration.ofMinutes(1));
        RequestId second = fx.deploy("large");
        fx.clock.advance(Duration.ofMinutes(1));
        RequestId approved = fx.deploy("medium");
        engine.approve(approved, LEAD);

        assertThat(engine.pendingApprovals()).extracting(DeploymentRequest::getId).containsExactly(first, second);
    }

    @Test
    void 감사_통계는_액션별_건수와_상위_행위자를_집계() {
        // given
        fx.completedDeploy("small");
        RequestId rejected = fx.deploy("large");
        engine.reject(rejected, LEAD, "no budget");

        // when
        AuditStatistics stats = engine.auditStatistics(Duration.ofDays(1));

        // then
        assertThat(stats.count(AuditAction.REQUEST_CREATED)).isEqualTo(2);
        assertThat(stats.count(AuditAction.REQUEST_REJECTED)).isEqualTo(1);
        assertThat(stats.count(AuditAction.RESOURCES_RELEASED)).isZero();
        assertThat(stats.total()).isEqualTo(6);
        assertThat(stats.topActors().get(0).actorEmail()).isIn("dev@example.com", "lead@example.com");
        Map<String, Long> byActor = stats.topActors().stream()
            .collect(Collectors.toMap(AuditStatistics.ActorCount::actorEmail, AuditStatistics.ActorCount::count));
        assertThat(byActor).containsEntry("lead@example.com", 3L).containsEntry("pipeline@system.local", 1L);
    }

    @Test
    void 감사_통계는_기간_밖_항목을_제외() {
        fx.deploy("small");
        fx.clock.advance(Duration.ofDays(2));
        fx.deploy("large");

        assertThat(engine.auditStatistics(Duration.ofDays(1)).total()).isEqualTo(1);
    }

    private AuditEntry lastEntry(RequestId id) {
        List<AuditEntry> trail = engine.auditTrail(id);
        return trail.get(trail.size() - 1);
    }

    private long countActions(RequestId id, AuditAction action) {
        return engine.auditTrail(id).stream().filter(e -> e.action() == action).count();
    }
}
