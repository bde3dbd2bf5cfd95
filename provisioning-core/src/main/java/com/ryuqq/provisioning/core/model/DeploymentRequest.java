package com.ryuqq.provisioning.core.model;

import com.ryuqq.provisioning.core.error.ErrorCode;
import com.ryuqq.provisioning.core.error.LifecycleException;
import com.ryuqq.provisioning.core.pipeline.PipelineRun;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;
import com.ryuqq.provisioning.core.statemachine.StateTransition;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 배포 요청 (Aggregate Root).
 *
 * <p>불변 객체입니다. 모든 변경 메서드는 {@code version + 1}, 갱신된 {@code updatedAt}을 가진
 * 새 인스턴스를 반환하며, 저장소는 version을 compare-and-set 기준으로 사용합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>status는 {@link StateTransition}이 허용하는 경로로만 변경</li>
 *   <li>requestType, catalogItemId, parameters, requester, createdAt은 생성 후 변경 불가</li>
 *   <li>DESTROY/SCALE의 부모는 COMPLETED 상태의 DEPLOY 요청</li>
 *   <li>decision은 PENDING_APPROVAL을 벗어날 때 한 번만 기록 (승인 또는 반려 중 하나)</li>
 *   <li>expirationWarningSent는 false → true로만 변경</li>
 *   <li>release는 한 번만 기록</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class DeploymentRequest {

    /** DESTROY 요청 파라미터: 원본 요청 ID. */
    public static final String ORIGINAL_REQUEST_ID = "original_request_id";

    /** DESTROY 요청 파라미터: 삭제 사유. */
    public static final String REASON = "reason";

    private final RequestId id;
    private final RequestType requestType;
    private final RequestStatus status;
    private final String catalogItemId;
    private final Parameters parameters;
    private final Requester requester;
    private final Decision decision;
    private final PipelineRun pipelineRun;
    private final String deploymentOutput;
    private final RequestId parentRequestId;
    private final SizeChange sizeChange;
    private final CostTags costTags;
    private final Instant expiresAt;
    private final boolean expirationWarningSent;
    private final HealthReport health;
    private final ResourceRelease release;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant finishedAt;
    private final long version;

    private DeploymentRequest(Builder b) {
        if (b.id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (b.requestType == null) {
            throw new IllegalArgumentException("requestType cannot be null");
        }
        if (b.status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (b.catalogItemId == null || b.catalogItemId.isBlank()) {
            throw new IllegalArgumentException("catalogItemId cannot be null or blank");
        }
        if (b.requester == null) {
            throw new IllegalArgumentException("requester cannot be null");
        }
        if (b.createdAt == null || b.updatedAt == null) {
            throw new IllegalArgumentException("createdAt and updatedAt cannot be null");
        }
        if (b.requestType.isDerivative() != (b.parentRequestId != null)) {
            throw new IllegalArgumentException(
                "parentRequestId must be set only for DESTROY/SCALE (type: " + b.requestType + ")");
        }
        this.id = b.id;
        this.requestType = b.requestType;
        this.status = b.status;
        this.catalogItemId = b.catalogItemId;
        this.parameters = b.parameters == null ? Parameters.empty() : b.parameters;
        this.requester = b.requester;
        this.decision = b.decision;
        this.pipelineRun = b.pipelineRun;
        this.deploymentOutput = b.deploymentOutput;
        this.parentRequestId = b.parentRequestId;
        this.sizeChange = b.sizeChange;
        this.costTags = b.costTags == null ? CostTags.none() : b.costTags;
        this.expiresAt = b.expiresAt;
        this.expirationWarningSent = b.expirationWarningSent;
        this.health = b.health == null ? HealthReport.unchecked() : b.health;
        this.release = b.release;
        this.createdAt = b.createdAt;
        this.updatedAt = b.updatedAt;
        this.finishedAt = b.finishedAt;
        this.version = b.version;
    }

    // ---------------------------------------------------------------- 생성

    /**
     * 새 DEPLOY 요청 생성 (PENDING_APPROVAL).
     *
     * @param id 요청 ID
     * @param catalogItemId 카탈로그 항목 ID
     * @param parameters 캡처된 파라미터
     * @param requester 요청자
     * @param costTags 비용 태그 (null이면 없음)
     * @param expiresAt 만료 시각 (null 가능)
     * @param now 생성 시각
     * @return 새 요청 (version 1)
     */
    public static DeploymentRequest newDeploy(
        RequestId id,
        String catalogItemId,
        Parameters parameters,
        Requester requester,
        CostTags costTags,
        Instant expiresAt,
        Instant now
    ) {
        Builder b = new Builder();
        b.id = id;
        b.requestType = RequestType.DEPLOY;
        b.catalogItemId = catalogItemId;
        b.parameters = parameters;
        b.requester = requester;
        b.costTags = costTags;
        b.expiresAt = expiresAt;
        return initial(b, now);
    }

    /**
     * 완료된 DEPLOY 요청으로부터 DESTROY 요청 생성.
     *
     * <p>비용 태그는 부모에서 복사되며, 파라미터는 {@code original_request_id}와 사유입니다.</p>
     *
     * @param id 요청 ID
     * @param parent 부모 DEPLOY 요청
     * @param requester 요청자
     * @param reason 삭제 사유 (null 가능)
     * @param now 생성 시각
     * @return 새 DESTROY 요청
     * @throws LifecycleException 부모가 완료된 DEPLOY가 아닌 경우 (NOT_COMPLETED_DEPLOY)
     */
    public static DeploymentRequest newDestroy(
        RequestId id,
        DeploymentRequest parent,
        Requester requester,
        String reason,
        Instant now
    ) {
        checkDerivableParent(parent);

        Parameters params = Parameters.empty().with(ORIGINAL_REQUEST_ID, parent.id.getValue());
        if (reason != null && !reason.isBlank()) {
            params = params.with(REASON, reason);
        }

        Builder b = new Builder();
        b.id = id;
        b.requestType = RequestType.DESTROY;
        b.catalogItemId = parent.catalogItemId;
        b.parameters = params;
        b.requester = requester;
        b.parentRequestId = parent.id;
        b.costTags = parent.costTags;
        return initial(b, now);
    }

    /**
     * 완료된 DEPLOY 요청으로부터 SCALE 요청 생성.
     *
     * <p>부모의 파라미터를 복사한 뒤 {@code size}만 교체합니다.</p>
     *
     * @param id 요청 ID
     * @param parent 부모 DEPLOY 요청
     * @param requester 요청자
     * @param newSize 목표 크기
     * @param currentSize 계보 기준 현재 크기
     * @param now 생성 시각
     * @return 새 SCALE 요청
     * @throws LifecycleException 부모가 완료된 DEPLOY가 아닌 경우 (NOT_COMPLETED_DEPLOY),
     *                            newSize가 비어 있는 경우 (MISSING_PARAMETER),
     *                            현재 크기와 같은 경우 (SAME_SIZE)
     */
    public static DeploymentRequest newScale(
        RequestId id,
        DeploymentRequest parent,
        Requester requester,
        String newSize,
        String currentSize,
        Instant now
    ) {
        checkDerivableParent(parent);
        if (newSize == null || newSize.isBlank()) {
            throw new LifecycleException(ErrorCode.MISSING_PARAMETER, "newSize is required for SCALE");
        }
        if (newSize.equals(currentSize)) {
            throw new LifecycleException(
                ErrorCode.SAME_SIZE,
                "Requested size equals current size: " + currentSize
            );
        }

        Builder b = new Builder();
        b.id = id;
        b.requestType = RequestType.SCALE;
        b.catalogItemId = parent.catalogItemId;
        b.parameters = parent.parameters.with(Parameters.SIZE, newSize);
        b.requester = requester;
        b.parentRequestId = parent.id;
        b.sizeChange = new SizeChange(currentSize, newSize);
        b.costTags = parent.costTags;
        return initial(b, now);
    }

    /**
     * DESTROY/SCALE의 부모가 될 수 있는지 검증.
     *
     * @param parent 부모 후보
     * @throws IllegalArgumentException parent가 null인 경우
     * @throws LifecycleException DEPLOY가 아니거나, COMPLETED가 아니거나, 이미 해제된 경우
     */
    public static void checkDerivableParent(DeploymentRequest parent) {
        if (parent == null) {
            throw new IllegalArgumentException("parent cannot be null");
        }
        if (parent.requestType != RequestType.DEPLOY || parent.status != RequestStatus.COMPLETED) {
            throw new LifecycleException(
                ErrorCode.NOT_COMPLETED_DEPLOY,
                String.format("Parent %s is %s %s, expected COMPLETED DEPLOY",
                    parent.id.getValue(), parent.status, parent.requestType)
            );
        }
        if (parent.isReleased()) {
            throw new LifecycleException(
                ErrorCode.NOT_COMPLETED_DEPLOY,
                "Parent " + parent.id.getValue() + " resources were already released"
            );
        }
    }

    private static DeploymentRequest initial(Builder b, Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        b.status = RequestStatus.PENDING_APPROVAL;
        b.createdAt = now;
        b.updatedAt = now;
        b.version = 1L;
        return new DeploymentRequest(b);
    }

    // ---------------------------------------------------------------- 전이

    /**
     * 승인 (PENDING_APPROVAL → APPROVED).
     *
     * @param approver 승인자
     * @param now 결정 시각
     * @return 승인된 요청
     * @throws LifecycleException PENDING_APPROVAL이 아닌 경우 (INVALID_STATE)
     */
    public DeploymentRequest approve(Actor approver, Instant now) {
        if (approver == null) {
            throw new IllegalArgumentException("approver cannot be null");
        }
        Builder b = next(RequestStatus.APPROVED, now);
        b.decision = new Approval(approver.asRequester(), now);
        return new DeploymentRequest(b);
    }

    /**
     * 반려 (PENDING_APPROVAL → REJECTED).
     *
     * @param rejector 반려자
     * @param reason 반려 사유
     * @param now 결정 시각
     * @return 반려된 요청
     * @throws LifecycleException PENDING_APPROVAL이 아닌 경우 (INVALID_STATE), 사유가 비어 있는 경우 (EMPTY_REASON)
     */
    public DeploymentRequest reject(Actor rejector, String reason, Instant now) {
        if (rejector == null) {
            throw new IllegalArgumentException("rejector cannot be null");
        }
        Builder b = next(RequestStatus.REJECTED, now);
        if (reason == null || reason.isBlank()) {
            throw new LifecycleException(ErrorCode.EMPTY_REASON, "Rejection reason is required");
        }
        b.decision = new Rejection(rejector.asRequester(), now, reason.trim());
        return new DeploymentRequest(b);
    }

    /**
     * 파이프라인 트리거 성공 기록 (APPROVED → DEPLOYING).
     *
     * @param run 외부 실행 링크
     * @param now 시각
     * @return 배포 중 요청
     * @throws LifecycleException APPROVED가 아닌 경우 (INVALID_STATE)
     */
    public DeploymentRequest startDeployment(PipelineRun run, Instant now) {
        if (run == null) {
            throw new IllegalArgumentException("run cannot be null");
        }
        Builder b = next(RequestStatus.DEPLOYING, now);
        b.pipelineRun = run;
        return new DeploymentRequest(b);
    }

    /**
     * 파이프라인 성공 (DEPLOYING → COMPLETED).
     *
     * @param output 진단 출력 (null 가능)
     * @param now 시각
     * @return 완료된 요청
     */
    public DeploymentRequest complete(String output, Instant now) {
        Builder b = next(RequestStatus.COMPLETED, now);
        b.deploymentOutput = output;
        b.finishedAt = b.updatedAt;
        return new DeploymentRequest(b);
    }

    /**
     * 파이프라인 실패 (DEPLOYING → FAILED).
     *
     * @param diagnostic 진단 출력 (null 가능)
     * @param now 시각
     * @return 실패한 요청
     */
    public DeploymentRequest fail(String diagnostic, Instant now) {
        Builder b = next(RequestStatus.FAILED, now);
        b.deploymentOutput = diagnostic;
        b.finishedAt = b.updatedAt;
        return new DeploymentRequest(b);
    }

    /**
     * DESTROY 완료로 리소스 해제 기록. status는 바뀌지 않습니다.
     *
     * @param destroyRequestId 해제를 일으킨 DESTROY 요청 ID
     * @param now 해제 시각
     * @return 해제된 요청
     * @throws LifecycleException 완료된 DEPLOY가 아니거나 이미 해제된 경우 (INVALID_STATE)
     */
    public DeploymentRequest release(RequestId destroyRequestId, Instant now) {
        if (requestType != RequestType.DEPLOY || status != RequestStatus.COMPLETED || release != null) {
            throw new LifecycleException(
                ErrorCode.INVALID_STATE,
                "Cannot release " + id.getValue() + " (" + requestType + ", " + status
                    + ", released=" + isReleased() + ")"
            );
        }
        Builder b = touch(now);
        b.release = new ResourceRelease(destroyRequestId, now);
        return new DeploymentRequest(b);
    }

    /**
     * 만료 경고 발송 기록 (false → true).
     *
     * @param now 시각
     * @return 이미 기록된 경우 this, 아니면 새 인스턴스
     */
    public DeploymentRequest markExpirationWarned(Instant now) {
        if (expirationWarningSent) {
            return this;
        }
        Builder b = touch(now);
        b.expirationWarningSent = true;
        return new DeploymentRequest(b);
    }

    /**
     * 헬스 체크 결과 기록. status에는 영향이 없습니다.
     *
     * @param health 헬스 상태
     * @param details 상세 (null 가능)
     * @param now 점검 시각
     * @return 갱신된 요청
     * @throws LifecycleException COMPLETED가 아닌 경우 (NOT_COMPLETED)
     */
    public DeploymentRequest recordHealth(ResourceHealth health, String details, Instant now) {
        if (health == null) {
            throw new IllegalArgumentException("health cannot be null");
        }
        if (status != RequestStatus.COMPLETED) {
            throw new LifecycleException(
                ErrorCode.NOT_COMPLETED,
                "Health can only be recorded for COMPLETED requests (current: " + status + ")"
            );
        }
        Builder b = touch(now);
        b.health = new HealthReport(health, details, now);
        return new DeploymentRequest(b);
    }

    private Builder next(RequestStatus target, Instant now) {
        StateTransition.validate(status, target);
        Builder b = touch(now);
        b.status = target;
        return b;
    }

    private Builder touch(Instant now) {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        Builder b = new Builder();
        b.id = id;
        b.requestType = requestType;
        b.status = status;
        b.catalogItemId = catalogItemId;
        b.parameters = parameters;
        b.requester = requester;
        b.decision = decision;
        b.pipelineRun = pipelineRun;
        b.deploymentOutput = deploymentOutput;
        b.parentRequestId = parentRequestId;
        b.sizeChange = sizeChange;
        b.costTags = costTags;
        b.expiresAt = expiresAt;
        b.expirationWarningSent = expirationWarningSent;
        b.health = health;
        b.release = release;
        b.createdAt = createdAt;
        b.updatedAt = now.isBefore(updatedAt) ? updatedAt : now;
        b.finishedAt = finishedAt;
        b.version = version + 1;
        return b;
    }

    // ---------------------------------------------------------------- 조회

    public RequestId getId() {
        return id;
    }

    public RequestType getRequestType() {
        return requestType;
    }

    public RequestStatus getStatus() {
        return status;
    }

    public String getCatalogItemId() {
        return catalogItemId;
    }

    public Parameters getParameters() {
        return parameters;
    }

    public Requester getRequester() {
        return requester;
    }

    public Optional<Decision> getDecision() {
        return Optional.ofNullable(decision);
    }

    public Optional<PipelineRun> getPipelineRun() {
        return Optional.ofNullable(pipelineRun);
    }

    public Optional<String> getDeploymentOutput() {
        return Optional.ofNullable(deploymentOutput);
    }

    public Optional<RequestId> getParentRequestId() {
        return Optional.ofNullable(parentRequestId);
    }

    public Optional<SizeChange> getSizeChange() {
        return Optional.ofNullable(sizeChange);
    }

    public CostTags getCostTags() {
        return costTags;
    }

    public Optional<Instant> getExpiresAt() {
        return Optional.ofNullable(expiresAt);
    }

    public boolean isExpirationWarningSent() {
        return expirationWarningSent;
    }

    public HealthReport getHealth() {
        return health;
    }

    public Optional<ResourceRelease> getRelease() {
        return Optional.ofNullable(release);
    }

    public boolean isReleased() {
        return release != null;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * 파이프라인 결과가 기록된 시각 (COMPLETED / FAILED 전이 시 한 번만 설정).
     *
     * <p>이후 헬스 기록이나 해제로 {@code updatedAt}이 바뀌어도 변하지 않습니다.</p>
     *
     * @return 종료 시각, 아직 종료되지 않았으면 empty
     */
    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    public long getVersion() {
        return version;
    }

    /**
     * 사용자에게 보이는 활성 배포인지 확인 (완료, 미해제 DEPLOY).
     *
     * @return 활성 배포이면 true
     */
    public boolean isActiveDeployment() {
        return requestType == RequestType.DEPLOY && status == RequestStatus.COMPLETED && release == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentRequest that = (DeploymentRequest) o;
        return expirationWarningSent == that.expirationWarningSent
            && version == that.version
            && id.equals(that.id)
            && requestType == that.requestType
            && status == that.status
            && catalogItemId.equals(that.catalogItemId)
            && parameters.equals(that.parameters)
            && requester.equals(that.requester)
            && Objects.equals(decision, that.decision)
            && Objects.equals(pipelineRun, that.pipelineRun)
            && Objects.equals(deploymentOutput, that.deploymentOutput)
            && Objects.equals(parentRequestId, that.parentRequestId)
            && Objects.equals(sizeChange, that.sizeChange)
            && costTags.equals(that.costTags)
            && Objects.equals(expiresAt, that.expiresAt)
            && health.equals(that.health)
            && Objects.equals(release, that.release)
            && createdAt.equals(that.createdAt)
            && updatedAt.equals(that.updatedAt)
            && Objects.equals(finishedAt, that.finishedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "DeploymentRequest{"
            + "id=" + id.getValue()
            + ", type=" + requestType
            + ", status=" + status
            + ", catalogItemId=" + catalogItemId
            + ", requester=" + requester.email()
            + ", parent=" + (parentRequestId == null ? null : parentRequestId.getValue())
            + ", version=" + version
            + '}';
    }

    private static final class Builder {
        private RequestId id;
        private RequestType requestType;
        private RequestStatus status;
        private String catalogItemId;
        private Parameters parameters;
        private Requester requester;
        private Decision decision;
        private PipelineRun pipelineRun;
        private String deploymentOutput;
        private RequestId parentRequestId;
        private SizeChange sizeChange;
        private CostTags costTags;
        private Instant expiresAt;
        private boolean expirationWarningSent;
        private HealthReport health;
        private ResourceRelease release;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant finishedAt;
        private long version;
    }
}
