package com.ryuqq.provisioning.core.model;

/**
 * 비용 추적용 태그.
 *
 * <p>DESTROY/SCALE 요청은 부모 DEPLOY의 태그를 그대로 복사합니다.
 * 모든 값은 null 허용입니다.</p>
 *
 * @param costCenter 비용 센터
 * @param environmentType 환경 구분 (예: dev, prod)
 * @param projectCode 프로젝트 코드
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record CostTags(String costCenter, String environmentType, String projectCode) {

    private static final CostTags NONE = new CostTags(null, null, null);

    /**
     * 태그 없음.
     *
     * @return 모든 값이 null인 CostTags
     */
    public static CostTags none() {
        return NONE;
    }
}
