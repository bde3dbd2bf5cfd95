package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.lifecycle.AuditStatistics;
import com.ryuqq.provisioning.application.lifecycle.CreateOptions;
import com.ryuqq.provisioning.application.lifecycle.RequestLifecycle;
import com.ryuqq.provisioning.core.audit.AuditAction;
import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.catalog.CatalogEntry;
import com.ryuqq.provisioning.core.catalog.ParameterSpec;
import com.ryuqq.provisioning.core.error.ErrorCode;
import com.ryuqq.provisioning.core.error.LifecycleException;
import com.ryuqq.provisioning.core.model.Actor;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.Lineage;
import com.ryuqq.provisioning.core.model.Parameters;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.model.RequestType;
import com.ryuqq.provisioning.core.model.ResourceHealth;
import com.ryuqq.provisioning.core.model.SizeChange;
import com.ryuqq.provisioning.core.notification.Channel;
import com.ryuqq.provisioning.core.notification.Notification;
import com.ryuqq.provisioning.core.pipeline.PipelineRun;
import com.ryuqq.provisioning.core.pipeline.PipelineTarget;
import com.ryuqq.provisioning.core.spi.AuditSink;
import com.ryuqq.provisioning.core.spi.CatalogLookup;
import com.ryuqq.provisioning.core.spi.NotificationOutbox;
import com.ryuqq.provisioning.core.spi.PipelineClient;
import com.ryuqq.provisioning.core.spi.RequestStore;
import com.ryuqq.provisioning.core.spi.StaleWriteException;
import com.ryuqq.provisioning.core.spi.TransitionCommit;
import com.ryuqq.provisioning.core.spi.TransitionCommit.RecordWrite;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 배포 요청 생명주기 엔진.
 *
 * <p><strong>연산 구조 (commit-then-dispatch):</strong></p>
 * <pre>
 * 1. 가드: 권한 → 조회 → 상태 (실패 시 어떤 변경도 없음)
 * 2. store.commit(레코드 CAS + 감사 로그)   ← 원자적, 실패 시 DURABILITY_FAILURE
 * 3. 부수 효과 (best-effort):
 *    - 승인 시 파이프라인 트리거 → 성공하면 두 번째 커밋 (APPROVED → DEPLOYING)
 *    - 알림을 outbox에 발행
 * </pre>
 *
 * <p><strong>격리 원칙:</strong></p>
 * <ul>
 *   <li>외부 I/O(트리거, 알림)는 커밋 이후에만 수행하며, 실패해도 커밋을 되돌리지 않습니다</li>
 *   <li>트리거 실패 시 요청은 APPROVED로 남고, {@link #retriggerPipeline}으로만 다시 시도합니다</li>
 *   <li>동시 커밋 충돌(CAS 실패)은 INVALID_STATE로 보고됩니다</li>
 * </ul>
 *
 * <p>엔진 자체는 스레드를 만들지 않습니다. 요청당 하나의 호출 스레드에서 실행됩니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class LifecycleEngine implements RequestLifecycle {

    private static final Logger log = LoggerFactory.getLogger(LifecycleEngine.class);

    private static final Actor PIPELINE_ACTOR = Actor.system("pipeline");
    private static final Actor SCHEDULER_ACTOR = Actor.system("scheduler");
    private static final Actor HEALTH_ACTOR = Actor.system("health-check");
    private static final int TOP_ACTOR_LIMIT = 10;

    private final RequestStore store;
    private final AuditSink auditSink;
    private final CatalogLookup catalog;
    private final PipelineClient pipelineClient;
    private final NotificationOutbox outbox;
    private final EngineConfig config;
    private final Clock clock;
    private final NotificationFactory notifications;

    /**
     * 생성자.
     *
     * @param store 요청 저장소
     * @param auditSink 감사 로그 (조회용, 기록은 store.commit 안에서 수행)
     * @param catalog 카탈로그
     * @param pipelineClient 파이프라인 클라이언트
     * @param outbox 알림 outbox
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LifecycleEngine(
        RequestStore store,
        AuditSink auditSink,
        CatalogLookup catalog,
        PipelineClient pipelineClient,
        NotificationOutbox outbox,
        EngineConfig config,
        Clock clock
    ) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (auditSink == null) {
            throw new IllegalArgumentException("auditSink cannot be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (pipelineClient == null) {
            throw new IllegalArgumentException("pipelineClient cannot be null");
        }
        if (outbox == null) {
            throw new IllegalArgumentException("outbox cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.auditSink = auditSink;
        this.catalog = catalog;
        this.pipelineClient = pipelineClient;
        this.outbox = outbox;
        this.config = config;
        this.clock = clock;
        this.notifications = new NotificationFactory(config);
    }

    // ================================================================ 생성

    @Override
    public RequestId createRequest(
        String catalogItemId,
        Actor requester,
        RequestType requestType,
        Parameters parameters,
        RequestId parentRequestId
    ) {
        return createRequest(catalogItemId, requester, requestType, parameters, parentRequestId, CreateOptions.none());
    }

    @Override
    public RequestId createRequest(
        String catalogItemId,
        Actor requester,
        RequestType requestType,
        Parameters parameters,
        RequestId parentRequestId,
        CreateOptions options
    ) {
        if (catalogItemId == null || catalogItemId.isBlank()) {
            throw new IllegalArgumentException("catalogItemId cannot be null or blank");
        }
        if (requester == null) {
            throw new IllegalArgumentException("requester cannot be null");
        }
        if (requestType == null) {
            throw new IllegalArgumentException("requestType cannot be null");
        }
        CreateOptions opts = options == null ? CreateOptions.none() : options;
        Parameters params = parameters == null ? Parameters.empty() : parameters;

        if (!requestType.isDerivative()) {
            if (parentRequestId != null) {
                throw new LifecycleException(ErrorCode.INVALID_LINEAGE, "DEPLOY request cannot reference a parent");
            }
            return createDeploy(catalogItemId, requester, params, opts);
        }

        if (parentRequestId == null) {
            throw new LifecycleException(ErrorCode.INVALID_LINEAGE, requestType + " request requires a parent DEPLOY request");
        }
        String newSize = opts.newSize() != null ? opts.newSize() : params.get(Parameters.SIZE).orElse(null);
        return createDerivative(requestType, parentRequestId, requester, opts.reason(), newSize, catalogItemId);
    }

    @Override
    public RequestId requestDestroy(RequestId parentRequestId, Actor requester, String reason) {
        return createDerivative(RequestType.DESTROY, parentRequestId, requester, reason, null, null);
    }

    @Override
    public RequestId requestScale(RequestId parentRequestId, Actor requester, String newSize, String reason) {
        return createDerivative(RequestType.SCALE, parentRequestId, requester, reason, newSize, null);
    }

    private RequestId createDeploy(String catalogItemId, Actor requester, Parameters parameters, CreateOptions options) {
        Optional<CatalogEntry> entry = lookupCatalog(catalogItemId);
        Parameters resolved = entry.map(e -> applySchema(e, parameters)).orElse(parameters);

        Instant now = clock.instant();
        DeploymentRequest request = DeploymentRequest.newDeploy(
            RequestId.generate(), catalogItemId, resolved, requester.asRequester(),
            options.costTags(), options.expiresAt(), now
        );

        Map<String, String> details = new LinkedHashMap<>();
        details.put("request_type", RequestType.DEPLOY.name());
        details.put("parameters", resolved.asMap().toString());
        AuditEntry audit = AuditEntry.draft(requester, AuditAction.REQUEST_CREATED, request.getId(), catalogItemId, details);

        commit(new TransitionCommit(List.of(RecordWrite.insert(request)), List.of(audit), TransitionCommit.NONE));
        log.info("Request {} created by {} for catalog item {}", request.getId(), requester.email(), catalogItemId);

        publish(notifications.approvalRequested(request, templateName(entry, catalogItemId), monthlyCost(entry)));
        return request.getId();
    }

    private RequestId createDerivative(
        RequestType type,
        RequestId parentRequestId,
        Actor requester,
        String reason,
        String newSize,
        String expectedCatalogItemId
    ) {
        if (parentRequestId == null) {
            throw new IllegalArgumentException("parentRequestId cannot be null");
        }
        if (requester == null) {
            throw new IllegalArgumentException("requester cannot be null");
        }

        DeploymentRequest parent = load(parentRequestId);
        if (!requester.isSamePersonAs(parent.getRequester())) {
            throw new LifecycleException(
                ErrorCode.FORBIDDEN,
                requester.email() + " is not the requester of " + parentRequestId.getValue()
            );
        }
        if (expectedCatalogItemId != null && !expectedCatalogItemId.equals(parent.getCatalogItemId())) {
            throw new LifecycleException(
                ErrorCode.INVALID_LINEAGE,
                "Catalog item " + expectedCatalogItemId + " does not match parent catalog item " + parent.getCatalogItemId()
            );
        }

        List<DeploymentRequest> children = store.findChildren(parentRequestId);
        DeploymentRequest.checkDerivableParent(parent);
        checkNoPendingDerivative(parentRequestId, children);

        Instant now = clock.instant();
        DeploymentRequest request;
        AuditEntry audit;
        Map<String, String> details = new LinkedHashMap<>();
        details.put("parent_request_id", parentRequestId.getValue());
        if (type == RequestType.DESTROY) {
            request = DeploymentRequest.newDestroy(RequestId.generate(), parent, requester.asRequester(), reason, now);
            putIfPresent(details, "reason", reason);
            audit = AuditEntry.draft(requester, AuditAction.DESTROY_REQUESTED, request.getId(), parent.getCatalogItemId(), details);
        } else {
            String currentSize = Lineage.currentSize(parent, children);
            request = DeploymentRequest.newScale(RequestId.generate(), parent, requester.asRequester(), newSize, currentSize, now);
            details.put("previous_size", currentSize);
            details.put("new_size", newSize);
            putIfPresent(details, "reason", reason);
            audit = AuditEntry.draft(requester, AuditAction.SCALE_REQUESTED, request.getId(), parent.getCatalogItemId(), details);
        }

        Optional<SizeChange> sizeChange = request.getSizeChange();
        TransitionCommit.Precondition lineageUnchanged = reader -> {
            DeploymentRequest fresh = reader.find(parentRequestId)
                .orElseThrow(() -> notFound(parentRequestId));
            DeploymentRequest.checkDerivableParent(fresh);
            List<DeploymentRequest> freshChildren = reader.findChildren(parentRequestId);
            checkNoPendingDerivative(parentRequestId, freshChildren);
            sizeChange.ifPresent(change -> {
                if (!change.previousSize().equals(Lineage.currentSize(fresh, freshChildren))) {
                    throw new LifecycleException(
                        ErrorCode.INVALID_STATE,
                        "Lineage size of " + parentRequestId.getValue() + " changed concurrently"
                    );
                }
            });
        };

        commit(new TransitionCommit(List.of(RecordWrite.insert(request)), List.of(audit), lineageUnchanged));
        log.info("{} request {} created by {} for parent {}", type, request.getId(), requester.email(), parentRequestId);

        Optional<CatalogEntry> entry = lookupCatalog(request.getCatalogItemId());
        publish(notifications.approvalRequested(request, templateName(entry, request.getCatalogItemId()), monthlyCost(entry)));
        return request.getId();
    }

    // ================================================================ 승인

    @Override
    public void approve(RequestId requestId, Actor approver) {
        requireApprover(approver, "approve");
        DeploymentRequest current = load(requestId);
        DeploymentRequest approved = current.approve(approver, clock.instant());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("request_type", current.getRequestType().name());
        AuditEntry audit = AuditEntry.draft(approver, AuditAction.REQUEST_APPROVED, requestId, current.getCatalogItemId(), details);
        commit(TransitionCommit.update(current, approved, audit));
        log.info("Request {} approved by {}", requestId, approver.email());

        Optional<CatalogEntry> entry = lookupCatalog(approved.getCatalogItemId());
        String templateName = templateName(entry, approved.getCatalogItemId());
        publish(notifications.approved(approved, templateName, approver.displayName()));

        attemptTrigger(approved, approver, entry);
    }

    @Override
    public void reject(RequestId requestId, Actor approver, String reason) {
        requireApprover(approver, "reject");
        DeploymentRequest current = load(requestId);
        DeploymentRequest rejected = current.reject(approver, reason, clock.instant());

        Map<String, String> details = new LinkedHashMap<>();
        details.put("request_type", current.getRequestType().name());
        details.put("reason", reason.trim());
        AuditEntry audit = AuditEntry.draft(approver, AuditAction.REQUEST_REJECTED, requestId, current.getCatalogItemId(), details);
        commit(TransitionCommit.update(current, rejected, audit));
        log.info("Request {} rejected by {}", requestId, approver.email());

        String templateName = templateName(lookupCatalog(rejected.getCatalogItemId()), rejected.getCatalogItemId());
        publish(notifications.rejected(rejected, templateName, approver.displayName(), reason.trim()));
    }

    @Override
    public DeploymentRequest retriggerPipeline(RequestId requestId, Actor operator) {
        requireApprover(operator, "retrigger pipeline");
        DeploymentRequest current = load(requestId);
        if (current.getStatus() != RequestStatus.APPROVED) {
            throw new LifecycleException(
                ErrorCode.INVALID_STATE,
                "Pipeline can only be retriggered for APPROVED requests (current: " + current.getStatus() + ")"
            );
        }
        log.info("Pipeline retrigger for {} requested by {}", requestId, operator.email());
        return attemptTrigger(current, operator, lookupCatalog(current.getCatalogItemId()));
    }

    /**
     * 파이프라인 트리거 시도 (best-effort).
     *
     * <p>대상 해석 실패, 트리거 실패, DEPLOYING 커밋 실패 모두 로깅 후 삼키며
     * 요청은 APPROVED로 남습니다.</p>
     */
    private DeploymentRequest attemptTrigger(DeploymentRequest approved, Actor actor, Optional<CatalogEntry> entry) {
        RequestId requestId = approved.getId();
        Optional<PipelineTarget> target = entry.flatMap(CatalogEntry::target);
        if (target.isEmpty()) {
            log.warn("No pipeline target for catalog item {}; request {} stays APPROVED",
                approved.getCatalogItemId(), requestId);
            return approved;
        }

        PipelineRun run;
        try {
            run = pipelineClient.trigger(target.get(), target.get().effectiveParameters(approved.getParameters()));
        } catch (RuntimeException e) {
            log.warn("Pipeline trigger failed for {}; request stays APPROVED for manual retry", requestId, e);
            return approved;
        }

        DeploymentRequest deploying;
        try {
            deploying = approved.startDeployment(run, clock.instant());
            Map<String, String> details = new LinkedHashMap<>();
            details.put("external_id", run.externalId());
            putIfPresent(details, "url", run.url());
            AuditEntry audit = AuditEntry.draft(actor, AuditAction.DEPLOYMENT_STARTED, requestId, approved.getCatalogItemId(), details);
            commit(TransitionCommit.update(approved, deploying, audit));
        } catch (LifecycleException e) {
            log.error("Pipeline run {} started for {} but DEPLOYING could not be recorded",
                run.externalId(), requestId, e);
            return approved;
        }
        log.info("Request {} deploying via pipeline run {}", requestId, run.externalId());

        publish(notifications.deploymentStarted(deploying, templateName(entry, deploying.getCatalogItemId()), actor.displayName()));
        return deploying;
    }

    // ================================================================ 파이프라인 결과

    @Override
    public void recordPipelineResult(RequestId requestId, boolean success, String diagnosticText) {
        // DESTROY 완료는 부모도 함께 쓰므로, 부모에 대한 동시 쓰기(헬스 기록 등)는 다시 읽어 재시도
        for (int attempt = 1; attempt <= config.staleRetryLimit(); attempt++) {
            DeploymentRequest current = load(requestId);
            Instant now = clock.instant();
            DeploymentRequest finished = success ? current.complete(diagnosticText, now) : current.fail(diagnosticText, now);

            List<RecordWrite> writes = new ArrayList<>();
            List<AuditEntry> audits = new ArrayList<>();
            writes.add(RecordWrite.update(current, finished));

            Map<String, String> details = new LinkedHashMap<>();
            current.getPipelineRun().ifPresent(run -> details.put("external_id", run.externalId()));
            putIfPresent(details, "diagnostic", diagnosticText);
            AuditAction action = success ? AuditAction.DEPLOYMENT_COMPLETED : AuditAction.DEPLOYMENT_FAILED;
            audits.add(AuditEntry.draft(PIPELINE_ACTOR, action, requestId, current.getCatalogItemId(), details));

            if (success && current.getRequestType() == RequestType.DESTROY) {
                releaseParent(finished, now, writes, audits);
            }

            try {
                commitOrStale(new TransitionCommit(writes, audits, TransitionCommit.NONE));
            } catch (StaleWriteException e) {
                log.debug("Concurrent update while recording pipeline result of {} (attempt {})", requestId, attempt);
                continue;
            }
            if (success && current.getRequestType() == RequestType.SCALE) {
                log.info("Request {} completed; lineage size is now {}", requestId,
                    finished.getSizeChange().map(SizeChange::newSize).orElse(Lineage.UNKNOWN_SIZE));
            } else {
                log.info("Request {} finished with status {}", requestId, finished.getStatus());
            }

            String templateName = templateName(lookupCatalog(finished.getCatalogItemId()), finished.getCatalogItemId());
            publish(notifications.deploymentFinished(finished, templateName, success));
            return;
        }
        throw new LifecycleException(ErrorCode.INVALID_STATE,
            "Could not record pipeline result for " + requestId.getValue() + " after concurrent updates");
    }

    private void releaseParent(DeploymentRequest destroy, Instant now, List<RecordWrite> writes, List<AuditEntry> audits) {
        RequestId parentId = destroy.getParentRequestId().orElseThrow();
        Optional<DeploymentRequest> parent = store.find(parentId);
        if (parent.isEmpty() || !parent.get().isActiveDeployment()) {
            log.warn("Parent {} of destroy request {} is missing or already released; skipping release",
                parentId, destroy.getId());
            return;
        }
        DeploymentRequest released = parent.get().release(destroy.getId(), now);
        writes.add(RecordWrite.update(parent.get(), released));

        Map<String, String> details = new LinkedHashMap<>();
        details.put("destroy_request_id", destroy.getId().getValue());
        audits.add(AuditEntry.draft(PIPELINE_ACTOR, AuditAction.RESOURCES_RELEASED, parentId, released.getCatalogItemId(), details));
    }

    // ================================================================ 스윕 연산

    @Override
    public void markExpirationWarned(RequestId requestId) {
        flipExpirationWarned(requestId);
    }

    /**
     * 만료 경고 플래그를 false → true로 전환합니다.
     *
     * <p>버전 CAS로 커밋하므로 같은 요청에 대해 여러 호출이 겹쳐도 {@code true}는 한 번만 반환됩니다.
     * 스위퍼는 {@code true}를 받은 경우에만 경고 알림을 발행합니다.</p>
     *
     * @param requestId 요청 ID
     * @return 이 호출이 플래그를 전환했으면 true, 이미 설정되어 있었으면 false
     */
    boolean flipExpirationWarned(RequestId requestId) {
        for (int attempt = 1; attempt <= config.staleRetryLimit(); attempt++) {
            DeploymentRequest current = load(requestId);
            if (current.isExpirationWarningSent()) {
                log.debug("Expiration warning already recorded for {}", requestId);
                return false;
            }
            DeploymentRequest warned = current.markExpirationWarned(clock.instant());
            Map<String, String> details = new LinkedHashMap<>();
            current.getExpiresAt().ifPresent(expiresAt -> details.put("expires_at", expiresAt.toString()));
            AuditEntry audit = AuditEntry.draft(SCHEDULER_ACTOR, AuditAction.EXPIRATION_WARNED, requestId, current.getCatalogItemId(), details);
            try {
                commitOrStale(TransitionCommit.update(current, warned, audit));
                return true;
            } catch (StaleWriteException e) {
                log.debug("Concurrent update on {} while marking expiration warned (attempt {})", requestId, attempt);
            }
        }
        throw new LifecycleException(ErrorCode.INVALID_STATE,
            "Could not mark expiration warned for " + requestId.getValue() + " after concurrent updates");
    }

    @Override
    public void recordHealth(RequestId requestId, ResourceHealth health, String details) {
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        for (int attempt = 1; attempt <= config.staleRetryLimit(); attempt++) {
            DeploymentRequest current = load(requestId);
            DeploymentRequest checked = current.recordHealth(health, details, clock.instant());

            List<AuditEntry> audits = new ArrayList<>();
            ResourceHealth previous = current.getHealth().health();
            if (previous != health) {
                Map<String, String> auditDetails = new LinkedHashMap<>();
                auditDetails.put("previous", previous.name());
                auditDetails.put("health", health.name());
                putIfPresent(auditDetails, "details", details);
                audits.add(AuditEntry.draft(HEALTH_ACTOR, AuditAction.HEALTH_RECORDED, requestId, current.getCatalogItemId(), auditDetails));
            }
            try {
                commitOrStale(new TransitionCommit(List.of(RecordWrite.update(current, checked)), audits, TransitionCommit.NONE));
                if (previous != health) {
                    log.info("Health of {} changed {} -> {}", requestId, previous, health);
                }
                return;
            } catch (StaleWriteException e) {
                log.debug("Concurrent update on {} while recording health (attempt {})", requestId, attempt);
            }
        }
        throw new LifecycleException(ErrorCode.INVALID_STATE,
            "Could not record health for " + requestId.getValue() + " after concurrent updates");
    }

    // ================================================================ 조회

    @Override
    public DeploymentRequest find(RequestId requestId) {
        return load(requestId);
    }

    @Override
    public List<DeploymentRequest> pendingApprovals() {
        return store.findByStatus(RequestStatus.PENDING_APPROVAL, Integer.MAX_VALUE);
    }

    @Override
    public List<DeploymentRequest> activeDeployments(String requesterEmail) {
        return store.findByRequester(requesterEmail).stream()
            .filter(DeploymentRequest::isActiveDeployment)
            .sorted(Comparator.comparing(DeploymentRequest::getCreatedAt).reversed())
            .collect(Collectors.toList());
    }

    @Override
    public String currentSize(RequestId lineageRootId) {
        DeploymentRequest root = load(lineageRootId);
        return Lineage.currentSize(root, store.findChildren(lineageRootId));
    }

    @Override
    public List<AuditEntry> auditTrail(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return auditSink.findByRequest(requestId);
    }

    @Override
    public AuditStatistics auditStatistics(Duration window) {
        if (window == null || window.isNegative()) {
            throw new IllegalArgumentException("window must be non-negative");
        }
        Instant since = clock.instant().minus(window);
        List<AuditEntry> entries = auditSink.findSince(since);

        Map<AuditAction, Long> byAction = new EnumMap<>(AuditAction.class);
        entries.forEach(entry -> byAction.merge(entry.action(), 1L, Long::sum));

        List<AuditStatistics.ActorCount> topActors = entries.stream()
            .collect(Collectors.groupingBy(AuditEntry::actorEmail, Collectors.counting()))
            .entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue().reversed().thenComparing(Map.Entry.<String, Long>comparingByKey()))
            .limit(TOP_ACTOR_LIMIT)
            .map(e -> new AuditStatistics.ActorCount(e.getKey(), e.getValue()))
            .collect(Collectors.toList());

        return new AuditStatistics(since, entries.size(), byAction, topActors);
    }

    // ================================================================ 내부

    private DeploymentRequest load(RequestId requestId) {
        if (requestId == null) {
            throw new IllegalArgumentException("requestId cannot be null");
        }
        return store.find(requestId).orElseThrow(() -> notFound(requestId));
    }

    private static LifecycleException notFound(RequestId requestId) {
        return new LifecycleException(ErrorCode.NOT_FOUND, "Request not found: " + requestId.getValue());
    }

    private static void requireApprover(Actor actor, String operation) {
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (!actor.approver()) {
            throw new LifecycleException(ErrorCode.FORBIDDEN, "Approvers only: " + actor.email() + " cannot " + operation);
        }
    }

    private static void checkNoPendingDerivative(RequestId parentId, List<DeploymentRequest> children) {
        Lineage.pendingDerivative(children).ifPresent(pending -> {
            throw new LifecycleException(
                ErrorCode.DERIVATIVE_PENDING,
                String.format("Parent %s already has %s request %s in %s",
                    parentId.getValue(), pending.getRequestType(), pending.getId().getValue(), pending.getStatus())
            );
        });
    }

    private List<AuditEntry> commit(TransitionCommit commit) {
        try {
            return commitOrStale(commit);
        } catch (StaleWriteException e) {
            throw new LifecycleException(ErrorCode.INVALID_STATE, "Request was modified concurrently: " + e.getMessage(), e);
        }
    }

    private List<AuditEntry> commitOrStale(TransitionCommit commit) {
        try {
            return store.commit(commit);
        } catch (LifecycleException | StaleWriteException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Transition commit failed; nothing was applied", e);
            throw new LifecycleException(ErrorCode.DURABILITY_FAILURE, "Transition could not be committed: " + e.getMessage(), e);
        }
    }

    private Parameters applySchema(CatalogEntry entry, Parameters parameters) {
        Parameters resolved = parameters;
        for (ParameterSpec spec : entry.parameterSchema()) {
            if (resolved.get(spec.name()).isPresent()) {
                continue;
            }
            if (spec.defaultValue() != null) {
                resolved = resolved.with(spec.name(), spec.defaultValue());
            } else if (spec.required()) {
                throw new LifecycleException(
                    ErrorCode.MISSING_PARAMETER,
                    "Required parameter '" + spec.name() + "' is missing for " + entry.id()
                );
            }
        }
        return resolved;
    }

    private Optional<CatalogEntry> lookupCatalog(String catalogItemId) {
        try {
            return catalog.find(catalogItemId);
        } catch (RuntimeException e) {
            log.warn("Catalog lookup failed for {}", catalogItemId, e);
            return Optional.empty();
        }
    }

    private static String templateName(Optional<CatalogEntry> entry, String catalogItemId) {
        return entry.map(CatalogEntry::name).orElse(catalogItemId);
    }

    private static BigDecimal monthlyCost(Optional<CatalogEntry> entry) {
        return entry.map(CatalogEntry::estimatedMonthlyCost).orElse(null);
    }

    private void publish(Notification notification) {
        try {
            outbox.publish(notification, 0L);
        } catch (RuntimeException e) {
            log.warn("Failed to enqueue {} notification for {}", notification.kind(), notification.requestId(), e);
        }
    }

    private void publish(List<Notification> batch) {
        batch.forEach(this::publish);
    }

    private static void putIfPresent(Map<String, String> details, String key, String value) {
        if (value != null && !value.isBlank()) {
            details.put(key, value);
        }
    }

    String templateNameOf(DeploymentRequest request) {
        return templateName(lookupCatalog(request.getCatalogItemId()), request.getCatalogItemId());
    }

    NotificationFactory notifications() {
        return notifications;
    }

    void publishNotification(Notification notification) {
        publish(notification);
    }

    /**
     * 리마인더 발송 감사 기록 (요청 레코드는 변경하지 않음).
     *
     * <p>커밋 시점에 요청이 여전히 PENDING_APPROVAL인지 다시 확인합니다.</p>
     */
    void recordReminderSent(DeploymentRequest request, Channel channel, Duration pending) {
        RequestId requestId = request.getId();
        Map<String, String> details = new LinkedHashMap<>();
        details.put("channel", channel.name());
        details.put("pending_hours", String.valueOf(pending.toHours()));
        AuditEntry audit = AuditEntry.draft(SCHEDULER_ACTOR, AuditAction.APPROVAL_REMINDER_SENT, requestId, request.getCatalogItemId(), details);
        TransitionCommit.Precondition stillPending = reader -> {
            DeploymentRequest current = reader.find(requestId).orElseThrow(() -> notFound(requestId));
            if (current.getStatus() != RequestStatus.PENDING_APPROVAL) {
                throw new LifecycleException(ErrorCode.INVALID_STATE,
                    "Request " + requestId.getValue() + " is no longer pending (" + current.getStatus() + ")");
            }
        };
        commit(new TransitionCommit(List.of(), List.of(audit), stillPending));
    }

    Clock clock() {
        return clock;
    }
}
