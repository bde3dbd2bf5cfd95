package com.ryuqq.provisioning.application.sweep;

/**
 * 주기적 백그라운드 스캔.
 *
 * <p>파이프라인 상태 리컨실, 만료 경고, 승인 리마인더가 이 계약을 구현합니다.
 * 호출 주기는 외부 스케줄러가 결정합니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>멱등: 같은 상태에서 반복 호출해도 중복 효과 없음</li>
 *   <li>항목별 실패는 로깅 후 다음 항목으로 계속 진행</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public interface Sweep {

    /**
     * 한 번 스캔.
     *
     * @return 처리에 성공한 항목 수
     */
    int scan();
}
