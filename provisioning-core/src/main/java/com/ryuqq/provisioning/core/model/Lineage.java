package com.ryuqq.provisioning.core.model;

import com.ryuqq.provisioning.core.statemachine.RequestStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * DEPLOY → {DESTROY, SCALE}* 계보 계산.
 *
 * <p>계보는 부모 ID 참조로만 연결되며 객체 그래프로 보관하지 않습니다.
 * 호출자가 루트와 그 자식 목록을 조회해 전달합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class Lineage {

    /** 크기를 알 수 없을 때의 값. */
    public static final String UNKNOWN_SIZE = "unknown";

    private Lineage() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 계보의 현재 크기.
     *
     * <p>가장 최근에 완료된 SCALE 요청의 newSize, 없으면 루트 파라미터의 {@code size},
     * 그것도 없으면 {@value #UNKNOWN_SIZE}.</p>
     *
     * @param root 계보 루트 (DEPLOY)
     * @param children 루트를 부모로 하는 요청들
     * @return 현재 크기
     * @throws IllegalArgumentException root가 null인 경우
     */
    public static String currentSize(DeploymentRequest root, Collection<DeploymentRequest> children) {
        if (root == null) {
            throw new IllegalArgumentException("root cannot be null");
        }
        return latestCompletedScale(children)
            .flatMap(DeploymentRequest::getSizeChange)
            .map(SizeChange::newSize)
            .orElseGet(() -> root.getParameters().get(Parameters.SIZE).orElse(UNKNOWN_SIZE));
    }

    /**
     * 진행 중인(종료되지 않은) DESTROY/SCALE 자식 조회.
     *
     * @param children 자식 요청들
     * @return 진행 중인 파생 요청 (없으면 empty)
     */
    public static Optional<DeploymentRequest> pendingDerivative(Collection<DeploymentRequest> children) {
        if (children == null) {
            return Optional.empty();
        }
        return children.stream()
            .filter(child -> child.getRequestType().isDerivative())
            .filter(child -> !child.getStatus().isTerminal())
            .findFirst();
    }

    /**
     * 완료 시각({@code finishedAt})이 가장 늦은 SCALE. 같은 시각이면 컬렉션 순서(생성 순)상 뒤의 것.
     * <p>{@code updatedAt}은 헬스 기록으로 다시 바뀌므로 순서 기준으로 쓰지 않습니다.</p>
     */
    private static Optional<DeploymentRequest> latestCompletedScale(Collection<DeploymentRequest> children) {
        if (children == null) {
            return Optional.empty();
        }
        Comparator<DeploymentRequest> byFinish = Comparator.comparing(Lineage::finishedOrCreatedAt);
        return children.stream()
            .filter(child -> child.getRequestType() == RequestType.SCALE)
            .filter(child -> child.getStatus() == RequestStatus.COMPLETED)
            .reduce((earlier, later) -> byFinish.compare(earlier, later) > 0 ? earlier : later);
    }

    private static Instant finishedOrCreatedAt(DeploymentRequest request) {
        return request.getFinishedAt().orElse(request.getCreatedAt());
    }
}
