package com.ryuqq.provisioning.application.lifecycle;

import com.ryuqq.provisioning.core.audit.AuditAction;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * 감사 로그 통계.
 *
 * @param since 집계 시작 시각
 * @param total 전체 건수
 * @param countsByAction 액션별 건수
 * @param topActors 활동이 많은 주체 (내림차순)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record AuditStatistics(
    Instant since,
    long total,
    Map<AuditAction, Long> countsByAction,
    List<ActorCount> topActors
) {

    public AuditStatistics {
        if (since == null) {
            throw new IllegalArgumentException("since cannot be null");
        }
        countsByAction = countsByAction == null || countsByAction.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(countsByAction));
        topActors = topActors == null ? List.of() : List.copyOf(topActors);
    }

    /**
     * 액션 건수 조회.
     *
     * @param action 액션
     * @return 건수 (없으면 0)
     */
    public long count(AuditAction action) {
        return countsByAction.getOrDefault(action, 0L);
    }

    /**
     * 주체별 건수.
     *
     * @param actorEmail 주체 이메일
     * @param count 건수
     */
    public record ActorCount(String actorEmail, long count) {
    }
}
