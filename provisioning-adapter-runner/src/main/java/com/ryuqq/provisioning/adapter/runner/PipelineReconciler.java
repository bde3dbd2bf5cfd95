package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.lifecycle.RequestLifecycle;
import com.ryuqq.provisioning.application.sweep.Sweep;
import com.ryuqq.provisioning.core.catalog.CatalogEntry;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.pipeline.Finished;
import com.ryuqq.provisioning.core.pipeline.PipelineRun;
import com.ryuqq.provisioning.core.pipeline.PipelineStatus;
import com.ryuqq.provisioning.core.pipeline.PipelineTarget;
import com.ryuqq.provisioning.core.spi.CatalogLookup;
import com.ryuqq.provisioning.core.spi.PipelineClient;
import com.ryuqq.provisioning.core.spi.RequestStore;
import com.ryuqq.provisioning.core.statemachine.RequestStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 파이프라인 실행 결과 리컨실러.
 *
 * <p>DEPLOYING 요청의 외부 파이프라인 실행을 폴링하여 종료된 실행을
 * {@link RequestLifecycle#recordPipelineResult}로 반영합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. findByStatus(DEPLOYING, batchSize) → [R1, R2, ...]
 * 2. For each request:
 *    a. 카탈로그에서 PipelineTarget 조회
 *    b. pipelineClient.poll(target, externalId)
 *    c. Finished → recordPipelineResult(success, url 또는 진단 메시지)
 *    d. 미종료 + stuckThreshold 초과:
 *       - WAIT: 경고 로그
 *       - FAIL: recordPipelineResult(false, 진단 메시지)
 * 3. 반영 건수 로깅
 * </pre>
 *
 * <p>개별 요청 처리 중 예외가 발생해도 나머지 요청 처리는 계속됩니다.
 * 여러 인스턴스가 동시에 실행되면 늦게 반영하는 쪽은 INVALID_STATE로 실패하고 로그만 남습니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class PipelineReconciler implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(PipelineReconciler.class);

    private final RequestLifecycle lifecycle;
    private final RequestStore store;
    private final CatalogLookup catalog;
    private final PipelineClient pipelineClient;
    private final ReconcilerConfig config;
    private final Clock clock;

    /**
     * 생성자.
     *
     * @param lifecycle 생명주기 엔진
     * @param store 요청 저장소 (조회 전용)
     * @param catalog 카탈로그
     * @param pipelineClient 파이프라인 클라이언트
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public PipelineReconciler(
        RequestLifecycle lifecycle,
        RequestStore store,
        CatalogLookup catalog,
        PipelineClient pipelineClient,
        ReconcilerConfig config,
        Clock clock
    ) {
        if (lifecycle == null) {
            throw new IllegalArgumentException("lifecycle cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (pipelineClient == null) {
            throw new IllegalArgumentException("pipelineClient cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.lifecycle = lifecycle;
        this.store = store;
        this.catalog = catalog;
        this.pipelineClient = pipelineClient;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public int scan() {
        log.info("Pipeline reconcile scan started");

        List<DeploymentRequest> deploying = store.findByStatus(RequestStatus.DEPLOYING, config.batchSize());

        int recorded = 0;
        for (DeploymentRequest request : deploying) {
            if (tryReconcile(request)) {
                recorded++;
            }
        }

        log.info("Pipeline reconcile scan completed: {} recorded out of {} deploying", recorded, deploying.size());
        return recorded;
    }

    /**
     * 개별 요청 리컨실 시도.
     *
     * @param request DEPLOYING 요청
     * @return 결과를 반영했으면 true
     */
    private boolean tryReconcile(DeploymentRequest request) {
        try {
            Optional<PipelineRun> run = request.getPipelineRun();
            Optional<PipelineTarget> target = catalog.find(request.getCatalogItemId()).flatMap(CatalogEntry::target);
            if (run.isEmpty() || target.isEmpty()) {
                log.warn("Request {} is DEPLOYING without a pollable pipeline run", request.getId());
                return handleUnfinished(request);
            }

            PipelineStatus status = pipelineClient.poll(target.get(), run.get().externalId());
            if (status instanceof Finished) {
                Finished finished = (Finished) status;
                String text = finished.succeeded() ? finished.url() : finished.diagnostic();
                lifecycle.recordPipelineResult(request.getId(), finished.succeeded(), text);
                return true;
            }
            return handleUnfinished(request);

        } catch (Exception e) {
            log.error("Failed to reconcile pipeline run of {}", request.getId(), e);
            return false;
        }
    }

    private boolean handleUnfinished(DeploymentRequest request) {
        Instant now = clock.instant();
        Duration elapsed = Duration.between(request.getUpdatedAt(), now);
        if (elapsed.toMillis() < config.stuckThresholdMs()) {
            return false;
        }

        switch (config.strategy()) {
            case FAIL -> {
                lifecycle.recordPipelineResult(request.getId(), false,
                    "Pipeline did not finish within " + elapsed.toMinutes() + " minutes");
                log.warn("Request {} marked FAILED after {} minutes in DEPLOYING", request.getId(), elapsed.toMinutes());
                return true;
            }
            case WAIT -> {
                log.warn("Request {} has been DEPLOYING for {} minutes", request.getId(), elapsed.toMinutes());
                return false;
            }
            default -> throw new IllegalStateException("Unknown strategy: " + config.strategy());
        }
    }
}
