package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.application.sweep.Sweep;
import com.ryuqq.provisioning.core.model.DeploymentRequest;
import com.ryuqq.provisioning.core.spi.RequestStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;

/**
 * 만료 임박 배포 경고 스위퍼.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. findExpiring(now + warningWindow, batchSize) → 경고 미발송 활성 배포
 * 2. For each request:
 *    a. flipExpirationWarned(id)   ← 플래그 + EXPIRATION_WARNED 감사 커밋
 *    b. 이 호출이 플래그를 전환한 경우에만 EXPIRATION_WARNING 알림 발행
 * 3. 경고 건수 로깅
 * </pre>
 *
 * <p>플래그를 먼저 커밋하므로 알림 발행이 실패해도 같은 요청에 경고가 반복되지 않습니다.
 * 조회 결과가 오래되어 이미 경고된 요청이 섞여 있어도, 전환에 성공한 스위퍼 하나만 발행합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class ExpirationSweeper implements Sweep {

    private static final Logger log = LoggerFactory.getLogger(ExpirationSweeper.class);

    private final LifecycleEngine engine;
    private final RequestStore store;
    private final ExpirationConfig config;

    /**
     * 생성자.
     *
     * @param engine 생명주기 엔진
     * @param store 요청 저장소 (조회 전용)
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ExpirationSweeper(LifecycleEngine engine, RequestStore store, ExpirationConfig config) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.engine = engine;
        this.store = store;
        this.config = config;
    }

    @Override
    public int scan() {
        log.info("Expiration scan started");

        Instant threshold = engine.clock().instant().plus(config.warningWindow());
        List<DeploymentRequest> expiring = store.findExpiring(threshold, config.batchSize());

        int warned = 0;
        for (DeploymentRequest request : expiring) {
            if (tryWarn(request)) {
                warned++;
            }
        }

        log.info("Expiration scan completed: {} warned out of {} expiring", warned, expiring.size());
        return warned;
    }

    private boolean tryWarn(DeploymentRequest request) {
        try {
            if (!engine.flipExpirationWarned(request.getId())) {
                log.debug("Expiration warning for {} already issued elsewhere", request.getId());
                return false;
            }
            DeploymentRequest warned = engine.find(request.getId());
            engine.publishNotification(engine.notifications().expirationWarning(warned, engine.templateNameOf(warned)));
            log.debug("Expiration warning issued for {} (expires {})", request.getId(), request.getExpiresAt().orElse(null));
            return true;
        } catch (Exception e) {
            log.error("Failed to issue expiration warning for {}", request.getId(), e);
            return false;
        }
    }
}
