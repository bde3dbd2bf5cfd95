package com.ryuqq.provisioning.core.model;

/**
 * 생명주기 연산을 호출하는 주체.
 *
 * <p>모든 연산은 Actor를 명시적 파라미터로 받습니다. 전역 "현재 사용자" 상태는 없으며,
 * 가드 판정은 (현재 레코드, Actor, 요청된 전이)만으로 결정됩니다.</p>
 *
 * @param email 이메일 (식별자)
 * @param displayName 표시 이름
 * @param approver 승인/반려 권한 보유 여부
 * @param provenance 호출 출처 (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Actor(
    String email,
    String displayName,
    boolean approver,
    Provenance provenance
) {

    private static final String SYSTEM_DOMAIN = "@system.local";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException email 또는 displayName이 null이거나 빈 문자열인 경우
     */
    public Actor {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be null or blank");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName cannot be null or blank");
        }
    }

    /**
     * 일반 사용자 생성.
     *
     * @param email 이메일
     * @param displayName 표시 이름
     * @return 승인 권한 없는 Actor
     */
    public static Actor user(String email, String displayName) {
        return new Actor(email, displayName, false, null);
    }

    /**
     * 승인자 생성.
     *
     * @param email 이메일
     * @param displayName 표시 이름
     * @return 승인 권한 있는 Actor
     */
    public static Actor approver(String email, String displayName) {
        return new Actor(email, displayName, true, null);
    }

    /**
     * 백그라운드 스윕/리컨실러용 시스템 Actor 생성.
     *
     * <p>시스템 Actor는 승인 권한이 없습니다.</p>
     *
     * @param name 컴포넌트 이름 (예: pipeline-reconciler)
     * @return 시스템 Actor
     */
    public static Actor system(String name) {
        return new Actor(name + SYSTEM_DOMAIN, name, false, null);
    }

    /**
     * 호출 출처를 덧붙인 새 Actor 반환.
     *
     * @param provenance 호출 출처
     * @return provenance가 설정된 Actor
     */
    public Actor from(Provenance provenance) {
        return new Actor(email, displayName, approver, provenance);
    }

    /**
     * 요청자 정보로 변환.
     *
     * @return Requester
     */
    public Requester asRequester() {
        return new Requester(email, displayName);
    }

    /**
     * 주어진 요청자와 동일 인물인지 확인 (이메일 대소문자 무시).
     *
     * @param requester 비교할 요청자
     * @return 동일 인물이면 true
     */
    public boolean isSamePersonAs(Requester requester) {
        return requester != null && email.equalsIgnoreCase(requester.email());
    }
}
