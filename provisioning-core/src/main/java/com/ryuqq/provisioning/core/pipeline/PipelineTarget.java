package com.ryuqq.provisioning.core.pipeline;

import com.ryuqq.provisioning.core.model.Parameters;

/**
 * 카탈로그에서 해석된 외부 파이프라인 대상.
 *
 * <p>project + pipelineId + branch 조합으로 원격 빌드를 식별합니다.
 * moduleName이 지정되면 파이프라인 실행 시 {@code module_name} 파라미터로 함께 전달됩니다.</p>
 *
 * @param project 프로젝트 식별자
 * @param pipelineId 파이프라인 식별자
 * @param branch 실행 브랜치 (null이면 main)
 * @param moduleName 인프라 모듈명 (선택, null 가능)
 *
 * @author Provisioning Team
 * @since 1.0.0
 */
public record PipelineTarget(
    String project,
    String pipelineId,
    String branch,
    String moduleName
) {

    private static final String DEFAULT_BRANCH = "main";
    private static final String MODULE_NAME_PARAMETER = "module_name";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException project 또는 pipelineId가 null이거나 빈 문자열인 경우
     */
    public PipelineTarget {
        if (project == null || project.isBlank()) {
            throw new IllegalArgumentException("project cannot be null or blank");
        }
        if (pipelineId == null || pipelineId.isBlank()) {
            throw new IllegalArgumentException("pipelineId cannot be null or blank");
        }
        if (branch == null || branch.isBlank()) {
            branch = DEFAULT_BRANCH;
        }
    }

    /**
     * main 브랜치, 모듈 없는 대상 생성.
     *
     * @param project 프로젝트 식별자
     * @param pipelineId 파이프라인 식별자
     * @return PipelineTarget
     */
    public static PipelineTarget of(String project, String pipelineId) {
        return new PipelineTarget(project, pipelineId, DEFAULT_BRANCH, null);
    }

    /**
     * 파이프라인에 실제로 전달할 파라미터.
     *
     * @param requestParameters 요청에 캡처된 파라미터
     * @return moduleName이 있으면 module_name이 추가된 파라미터
     */
    public Parameters effectiveParameters(Parameters requestParameters) {
        Parameters base = requestParameters == null ? Parameters.empty() : requestParameters;
        if (moduleName == null || moduleName.isBlank()) {
            return base;
        }
        return base.with(MODULE_NAME_PARAMETER, moduleName);
    }
}
