package com.ryuqq.provisioning.core.model;

/**
 * 배포 요청 종류.
 *
 * <p>DESTROY와 SCALE은 항상 완료된 DEPLOY 요청을 부모로 참조합니다.</p>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public enum RequestType {

    /**
     * 템플릿 기반 신규 인프라 생성.
     */
    DEPLOY,

    /**
     * 기존 배포의 인프라 제거.
     */
    DESTROY,

    /**
     * 기존 배포의 크기 변경.
     */
    SCALE;

    /**
     * 부모 요청이 필요한 파생 요청인지 확인.
     *
     * @return DESTROY 또는 SCALE인 경우 true
     */
    public boolean isDerivative() {
        return this == DESTROY || this == SCALE;
    }
}
