package com.ryuqq.provisioning.core.catalog;

/**
 * 카탈로그 템플릿의 파라미터 정의.
 *
 * @param name 파라미터명
 * @param required 필수 여부
 * @param defaultValue 기본값 (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record ParameterSpec(String name, boolean required, String defaultValue) {

    public ParameterSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
    }

    public static ParameterSpec required(String name) {
        return new ParameterSpec(name, true, null);
    }

    public static ParameterSpec optional(String name, String defaultValue) {
        return new ParameterSpec(name, false, defaultValue);
    }
}
