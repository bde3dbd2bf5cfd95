package com.ryuqq.provisioning.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 요청 생성 시 캡처된 템플릿 파라미터 (이름 → 문자열 값).
 *
 * <p>입력 순서를 보존하며, 생성 후 변경할 수 없습니다.
 * SCALE 요청은 기존 Parameters를 수정하지 않고 {@link #with(String, String)}로
 * 새 인스턴스를 만들어 새 레코드에 담습니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>이름: null 또는 빈 문자열 불가</li>
 *   <li>값: null 불가 (빈 문자열은 허용)</li>
 * </ul>
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public final class Parameters {

    /**
     * 배포 크기를 담는 표준 파라미터 이름.
     */
    public static final String SIZE = "size";

    private static final Parameters EMPTY = new Parameters(new LinkedHashMap<>());

    private final Map<String, String> values;

    private Parameters(LinkedHashMap<String, String> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Map으로부터 Parameters 생성 (순서 보존 복사).
     *
     * @param values 파라미터 맵 (null이면 빈 Parameters)
     * @return Parameters 인스턴스
     * @throws IllegalArgumentException 이름이 비어있거나 값이 null인 경우
     */
    public static Parameters of(Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }
        LinkedHashMap<String, String> copy = new LinkedHashMap<>();
        values.forEach((name, value) -> {
            validate(name, value);
            copy.put(name, value);
        });
        return new Parameters(copy);
    }

    /**
     * 빈 Parameters.
     *
     * @return 빈 Parameters 인스턴스
     */
    public static Parameters empty() {
        return EMPTY;
    }

    /**
     * 파라미터 값 조회.
     *
     * @param name 파라미터 이름
     * @return 값 (없으면 empty)
     */
    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /**
     * 하나의 파라미터를 추가하거나 교체한 새 인스턴스 반환.
     *
     * <p>기존 이름이면 원래 위치를 유지하고, 새 이름이면 끝에 추가됩니다.</p>
     *
     * @param name 파라미터 이름
     * @param value 값
     * @return 새 Parameters 인스턴스
     */
    public Parameters with(String name, String value) {
        validate(name, value);
        LinkedHashMap<String, String> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new Parameters(copy);
    }

    /**
     * 읽기 전용 Map 뷰 조회.
     *
     * @return 수정 불가 Map (입력 순서 유지)
     */
    public Map<String, String> asMap() {
        return values;
    }

    /**
     * 비어있는지 확인.
     *
     * @return 파라미터가 없으면 true
     */
    public boolean isEmpty() {
        return values.isEmpty();
    }

    private static void validate(String name, String value) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("parameter name cannot be null or blank");
        }
        if (value == null) {
            throw new IllegalArgumentException("parameter value cannot be null (name: " + name + ")");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Parameters that = (Parameters) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Parameters" + values;
    }
}
