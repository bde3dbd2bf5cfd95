package com.ryuqq.provisioning.core.catalog;

import com.ryuqq.provisioning.core.pipeline.PipelineTarget;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * 카탈로그 항목 (외부 카탈로그 로더가 제공).
 *
 * @param id 항목 ID
 * @param name 표시 이름
 * @param parameterSchema 파라미터 정의
 * @param pipelineTarget 파이프라인 대상 (null이면 트리거 불가)
 * @param estimatedMonthlyCost 예상 월 비용 (null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record CatalogEntry(
    String id,
    String name,
    List<ParameterSpec> parameterSchema,
    PipelineTarget pipelineTarget,
    BigDecimal estimatedMonthlyCost
) {

    public CatalogEntry {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (name == null || name.isBlank()) {
            name = id;
        }
        parameterSchema = parameterSchema == null ? List.of() : List.copyOf(parameterSchema);
    }

    public Optional<PipelineTarget> target() {
        return Optional.ofNullable(pipelineTarget);
    }
}
