package com.ryuqq.provisioning.core.model;

/**
 * SCALE 요청의 크기 변경 내역.
 *
 * @param previousSize 요청 시점의 현재 크기
 * @param newSize 요청된 새 크기
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record SizeChange(String previousSize, String newSize) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 값이 null이거나 빈 문자열인 경우
     */
    public SizeChange {
        if (previousSize == null || previousSize.isBlank()) {
            throw new IllegalArgumentException("previousSize cannot be null or blank");
        }
        if (newSize == null || newSize.isBlank()) {
            throw new IllegalArgumentException("newSize cannot be null or blank");
        }
    }
}
