package com.ryuqq.provisioning.core.model;

/**
 * 호출 출처 정보 (클라이언트 주소, User-Agent).
 *
 * <p>감사 로그에 함께 기록됩니다. 두 값 모두 null 허용이며,
 * User-Agent는 최대 500자로 잘립니다.</p>
 *
 * @param clientAddress 호출자 주소 (null 가능)
 * @param userAgent 호출자 에이전트 (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record Provenance(String clientAddress, String userAgent) {

    private static final int MAX_USER_AGENT_LENGTH = 500;

    /**
     * Compact Constructor.
     */
    public Provenance {
        if (userAgent != null && userAgent.length() > MAX_USER_AGENT_LENGTH) {
            userAgent = userAgent.substring(0, MAX_USER_AGENT_LENGTH);
        }
    }

    /**
     * 프록시 헤더(X-Forwarded-For)를 고려하여 Provenance 생성.
     *
     * <p>forwardedFor가 있으면 첫 번째 주소를, 없으면 remoteAddress를 사용합니다.</p>
     *
     * @param forwardedFor X-Forwarded-For 헤더 값 (null 가능)
     * @param remoteAddress 소켓 원격 주소 (null 가능)
     * @param userAgent User-Agent 헤더 값 (null 가능)
     * @return Provenance 인스턴스
     */
    public static Provenance fromHeaders(String forwardedFor, String remoteAddress, String userAgent) {
        String address = remoteAddress;
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            address = forwardedFor.split(",")[0].trim();
        }
        return new Provenance(address, userAgent);
    }
}
