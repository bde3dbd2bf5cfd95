package com.ryuqq.provisioning.adapter.runner;

import com.ryuqq.provisioning.core.model.RequestId;

import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * LifecycleEngine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>approverEmails: 승인 요청 알림 수신자 (기본 없음)</li>
 *   <li>portalBaseUrl: 알림에 포함되는 요청 링크의 기준 URL (기본 http://localhost:8000)</li>
 *   <li>staleRetryLimit: 만료 경고, 헬스 기록, 파이프라인 결과 기록의 동시 수정 재시도 횟수 (기본 3)</li>
 * </ul>
 *
 * <p><strong>Properties 키:</strong></p>
 * <pre>
 * provisioning.approver-emails=ops@example.com,lead@example.com
 * provisioning.portal-base-url=https://portal.example.com
 * provisioning.stale-retry-limit=3
 * </pre>
 *
 * @author Provisioning Team
 * @since 1.0.0
 * @param approverEmails 승인자 이메일 목록
 * @param portalBaseUrl 포털 기준 URL (끝의 '/'는 제거됨)
 * @param staleRetryLimit 동시 수정 재시도 횟수 (1 이상)
 */
public record EngineConfig(
    List<String> approverEmails,
    String portalBaseUrl,
    int staleRetryLimit
) {

    public static final String APPROVER_EMAILS_KEY = "provisioning.approver-emails";
    public static final String PORTAL_BASE_URL_KEY = "provisioning.portal-base-url";
    public static final String STALE_RETRY_LIMIT_KEY = "provisioning.stale-retry-limit";

    private static final String DEFAULT_PORTAL_BASE_URL = "http://localhost:8000";
    private static final int DEFAULT_STALE_RETRY_LIMIT = 3;

    /**
     * 기본 설정 생성자.
     */
    public EngineConfig() {
        this(List.of(), DEFAULT_PORTAL_BASE_URL, DEFAULT_STALE_RETRY_LIMIT);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        approverEmails = approverEmails == null ? List.of() : List.copyOf(approverEmails);
        if (portalBaseUrl == null || portalBaseUrl.isBlank()) {
            throw new IllegalArgumentException("portalBaseUrl cannot be null or blank");
        }
        while (portalBaseUrl.endsWith("/")) {
            portalBaseUrl = portalBaseUrl.substring(0, portalBaseUrl.length() - 1);
        }
        if (staleRetryLimit <= 0) {
            throw new IllegalArgumentException(
                "staleRetryLimit must be positive (current: " + staleRetryLimit + ")"
            );
        }
    }

    /**
     * Properties에서 설정 로드. 없는 키는 기본값을 사용합니다.
     *
     * @param properties 설정 원본
     * @return EngineConfig
     * @throws IllegalArgumentException properties가 null이거나 값 형식이 잘못된 경우
     */
    public static EngineConfig fromProperties(Properties properties) {
        if (properties == null) {
            throw new IllegalArgumentException("properties cannot be null");
        }
        List<String> approvers = Arrays.stream(properties.getProperty(APPROVER_EMAILS_KEY, "").split(","))
            .map(String::trim)
            .filter(email -> !email.isEmpty())
            .collect(Collectors.toList());
        String baseUrl = properties.getProperty(PORTAL_BASE_URL_KEY, DEFAULT_PORTAL_BASE_URL).trim();
        String retryLimit = properties.getProperty(STALE_RETRY_LIMIT_KEY, String.valueOf(DEFAULT_STALE_RETRY_LIMIT));
        try {
            return new EngineConfig(approvers, baseUrl, Integer.parseInt(retryLimit.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(STALE_RETRY_LIMIT_KEY + " must be an integer (current: " + retryLimit + ")", e);
        }
    }

    /**
     * 요청 상세 페이지 링크.
     *
     * @param requestId 요청 ID
     * @return URL
     */
    public String requestLink(RequestId requestId) {
        return portalBaseUrl + "/requests/" + requestId.getValue();
    }

    /**
     * approverEmails만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withApproverEmails(List<String> approverEmails) {
        return new EngineConfig(approverEmails, portalBaseUrl, staleRetryLimit);
    }

    /**
     * portalBaseUrl만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withPortalBaseUrl(String portalBaseUrl) {
        return new EngineConfig(approverEmails, portalBaseUrl, staleRetryLimit);
    }

    /**
     * staleRetryLimit만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withStaleRetryLimit(int staleRetryLimit) {
        return new EngineConfig(approverEmails, portalBaseUrl, staleRetryLimit);
    }
}
