package com.ryuqq.provisioning.core.audit;

import com.ryuqq.provisioning.core.model.Actor;
import com.ryuqq.provisioning.core.model.Provenance;
import com.ryuqq.provisioning.core.model.RequestId;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 불변 감사 로그 항목.
 *
 * <p>엔진은 {@link #draft}로 순번이 없는 항목을 만들고, 감사 싱크가 append 시점에
 * 전역 순번, 요청별 순번, 타임스탬프를 부여합니다 ({@link #withSequence}).
 * 같은 요청의 항목 순서는 wall-clock이 아니라 {@code requestSequence}로 결정됩니다.</p>
 *
 * @param sequence 전역 순번 (draft는 0)
 * @param requestSequence 요청별 순번, 1부터 (draft 또는 요청 없는 항목은 0)
 * @param timestamp 기록 시각 (draft는 null 가능)
 * @param actorEmail 주체 이메일
 * @param actorName 주체 이름
 * @param action 액션
 * @param requestId 관련 요청 (null 가능)
 * @param catalogItemId 관련 카탈로그 항목 (null 가능)
 * @param details 구조화된 상세 (순서 보존, 불변)
 * @param provenance 호출자 주소/에이전트 (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record AuditEntry(
    long sequence,
    long requestSequence,
    Instant timestamp,
    String actorEmail,
    String actorName,
    AuditAction action,
    RequestId requestId,
    String catalogItemId,
    Map<String, String> details,
    Provenance provenance
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException actorEmail 또는 action이 null인 경우, 순번이 음수인 경우
     */
    public AuditEntry {
        if (actorEmail == null || actorEmail.isBlank()) {
            throw new IllegalArgumentException("actorEmail cannot be null or blank");
        }
        if (action == null) {
            throw new IllegalArgumentException("action cannot be null");
        }
        if (sequence < 0 || requestSequence < 0) {
            throw new IllegalArgumentException("sequence cannot be negative");
        }
        details = details == null || details.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * 순번 없는 항목 생성.
     *
     * @param actor 주체
     * @param action 액션
     * @param requestId 관련 요청
     * @param catalogItemId 관련 카탈로그 항목
     * @param details 상세
     * @return draft 항목
     */
    public static AuditEntry draft(
        Actor actor,
        AuditAction action,
        RequestId requestId,
        String catalogItemId,
        Map<String, String> details
    ) {
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        return new AuditEntry(0L, 0L, null, actor.email(), actor.displayName(), action,
            requestId, catalogItemId, details, actor.provenance());
    }

    /**
     * 싱크가 부여한 순번과 시각을 적용한 사본.
     *
     * @param sequence 전역 순번
     * @param requestSequence 요청별 순번
     * @param timestamp 기록 시각
     * @return 순번이 부여된 항목
     */
    public AuditEntry withSequence(long sequence, long requestSequence, Instant timestamp) {
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        return new AuditEntry(sequence, requestSequence, timestamp, actorEmail, actorName, action,
            requestId, catalogItemId, details, provenance);
    }

    /**
     * 아직 싱크에 기록되지 않은 항목인지 확인.
     *
     * @return sequence가 0이면 true
     */
    public boolean isDraft() {
        return sequence == 0L;
    }
}
