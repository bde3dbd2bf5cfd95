package com.ryuqq.provisioning.application.lifecycle;

import com.ryuqq.provisioning.core.audit.AuditEntry;
import com.ryuqq.provisioning.core.error.LifecycleException;
import com.ryuqq.provisioning.core.model.Actor;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.model.Parameters;
import com.ryuqq.provisioning.core.model.RequestId;
import com.ryuqq.provisioning.core.model.RequestType;
import com.ryuqq.provisioning.core.model.ResourceHealth;

import java.time.Duration;
import java.util.List;

/**
 * 배포 요청 생명주기 진입점.
 *
 * <p>모든 연산은 호출 주체({@link Actor})를 명시적으로 받으며, 가드는
 * (현재 레코드, 주체, 요청된 전이)의 순수 함수입니다.</p>
 *
 * <p><strong>연산 흐름:</strong></p>
 * <pre>
 * 1. 권한 확인 (FORBIDDEN)
 * 2. 요청 조회 (NOT_FOUND)
 * 3. 가드 검사 (GUARD_VIOLATION, 변경 없음)
 * 4. 상태 + 감사 로그 원자적 커밋 (실패 시 DURABILITY_FAILURE)
 * 5. best-effort 부수 효과 (파이프라인 트리거, 알림 발행)
 * </pre>
 *
 * <p>실패는 모두 {@link LifecycleException}으로 보고되며, 부수 효과 실패는 호출자에게 전파되지 않습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface RequestLifecycle {

    /**
     * 요청 생성.
     *
     * <p>DESTROY/SCALE은 {@link #requestDestroy}/{@link #requestScale}과 같은 가드를 거칩니다.</p>
     *
     * @param catalogItemId 카탈로그 항목 ID
     * @param requester 요청 주체
     * @param requestType 요청 종류
     * @param parameters 파라미터
     * @param parentRequestId 부모 요청 (DEPLOY는 null)
     * @return 생성된 요청 ID
     * @throws LifecycleException 가드 위반 시
     */
    RequestId createRequest(
        String catalogItemId,
        Actor requester,
        RequestType requestType,
        Parameters parameters,
        RequestId parentRequestId
    );

    /**
     * 부가 옵션을 포함한 요청 생성.
     *
     * @param catalogItemId 카탈로그 항목 ID
     * @param requester 요청 주체
     * @param requestType 요청 종류
     * @param parameters 파라미터
     * @param parentRequestId 부모 요청 (DEPLOY는 null)
     * @param options 비용 태그, 만료, 사유, 목표 크기
     * @return 생성된 요청 ID
     * @throws LifecycleException 가드 위반 시
     */
    RequestId createRequest(
        String catalogItemId,
        Actor requester,
        RequestType requestType,
        Parameters parameters,
        RequestId parentRequestId,
        CreateOptions options
    );

    /**
     * 승인. 커밋 후 파이프라인 트리거를 동기적으로 시도하며, 트리거 실패 시 APPROVED로 남습니다.
     *
     * @param requestId 요청 ID
     * @param approver 승인자
     * @throws LifecycleException NOT_FOUND, INVALID_STATE, FORBIDDEN
     */
    void approve(RequestId requestId, Actor approver);

    /**
     * 반려.
     *
     * @param requestId 요청 ID
     * @param approver 승인자
     * @param reason 반려 사유
     * @throws LifecycleException NOT_FOUND, INVALID_STATE, FORBIDDEN, EMPTY_REASON
     */
    void reject(RequestId requestId, Actor approver, String reason);

    /**
     * 트리거에 실패해 APPROVED로 남은 요청의 파이프라인을 다시 트리거.
     *
     * @param requestId 요청 ID
     * @param operator 승인자 권한을 가진 운영자
     * @return 트리거 후 요청 (트리거가 다시 실패하면 APPROVED 그대로)
     * @throws LifecycleException NOT_FOUND, INVALID_STATE, FORBIDDEN
     */
    DeploymentRequest retriggerPipeline(RequestId requestId, Actor operator);

    /**
     * 외부 파이프라인 결과 반영 (DEPLOYING → COMPLETED/FAILED).
     *
     * @param requestId 요청 ID
     * @param success 성공 여부
     * @param diagnosticText 진단 출력 (null 가능)
     * @throws LifecycleException NOT_FOUND, INVALID_STATE
     */
    void recordPipelineResult(RequestId requestId, boolean success, String diagnosticText);

    /**
     * 삭제 요청 생성.
     *
     * @param parentRequestId 완료된 DEPLOY 요청
     * @param requester 요청 주체 (부모 요청자와 같아야 함)
     * @param reason 사유 (null 가능)
     * @return 생성된 DESTROY 요청 ID
     * @throws LifecycleException NOT_FOUND, NOT_COMPLETED_DEPLOY, FORBIDDEN, DERIVATIVE_PENDING
     */
    RequestId requestDestroy(RequestId parentRequestId, Actor requester, String reason);

    /**
     * 크기 변경 요청 생성.
     *
     * @param parentRequestId 완료된 DEPLOY 요청
     * @param requester 요청 주체 (부모 요청자와 같아야 함)
     * @param newSize 목표 크기
     * @param reason 사유 (null 가능)
     * @return 생성된 SCALE 요청 ID
     * @throws LifecycleException NOT_FOUND, NOT_COMPLETED_DEPLOY, SAME_SIZE, FORBIDDEN, DERIVATIVE_PENDING
     */
    RequestId requestScale(RequestId parentRequestId, Actor requester, String newSize, String reason);

    /**
     * 만료 경고 발송 기록. 재호출은 no-op.
     *
     * @param requestId 요청 ID
     * @throws LifecycleException NOT_FOUND
     */
    void markExpirationWarned(RequestId requestId);

    /**
     * 헬스 체크 결과 기록. status는 변경되지 않습니다.
     *
     * @param requestId 요청 ID
     * @param health 헬스 상태
     * @param details 상세 (null 가능)
     * @throws LifecycleException NOT_FOUND, NOT_COMPLETED
     */
    void recordHealth(RequestId requestId, ResourceHealth health, String details);

    /**
     * 요청 조회.
     *
     * @param requestId 요청 ID
     * @return 요청
     * @throws LifecycleException NOT_FOUND
     */
    DeploymentRequest find(RequestId requestId);

    /**
     * 승인 대기 요청 (오래된 순).
     *
     * @return PENDING_APPROVAL 요청
     */
    List<DeploymentRequest> pendingApprovals();

    /**
     * 요청자의 활성 배포 (최신 순).
     *
     * @param requesterEmail 요청자 이메일
     * @return 완료되고 해제되지 않은 DEPLOY 요청
     */
    List<DeploymentRequest> activeDeployments(String requesterEmail);

    /**
     * 계보의 현재 크기.
     *
     * @param lineageRootId 루트 DEPLOY 요청
     * @return 최근 완료된 SCALE의 newSize, 없으면 루트의 size 파라미터, 없으면 "unknown"
     * @throws LifecycleException NOT_FOUND
     */
    String currentSize(RequestId lineageRootId);

    /**
     * 요청의 감사 로그 (커밋 순).
     *
     * @param requestId 요청 ID
     * @return 감사 로그 항목
     */
    List<AuditEntry> auditTrail(RequestId requestId);

    /**
     * 최근 기간의 감사 통계.
     *
     * @param window 조회 기간 (현재 시각 기준)
     * @return 액션별 건수와 상위 주체
     */
    AuditStatistics auditStatistics(Duration window);
}
