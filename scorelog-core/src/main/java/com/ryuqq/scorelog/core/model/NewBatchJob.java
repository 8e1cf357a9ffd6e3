package com.ryuqq.scorelog.core.model;

import java.util.Map;

/**
 * BatchJob 생성 입력값.
 *
 * @param scope 호환성 범위
 * @param scoreId 스코어 ID (선택)
 * @param type 배치 유형
 * @param status 초기 상태
 * @param scoringJobCountCache 초기 링크 수 캐시
 * @param parameters 배치 파라미터 (선택)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record NewBatchJob(
    BatchScope scope,
    String scoreId,
    String type,
    BatchJobStatus status,
    int scoringJobCountCache,
    Map<String, Object> parameters
) {

    public NewBatchJob {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (scoringJobCountCache < 0) {
            throw new IllegalArgumentException(
                "scoringJobCountCache cannot be negative (current: " + scoringJobCountCache + ")"
            );
        }
        parameters = ScoringJob.copyOrNull(parameters);
    }

    /**
     * 비어 있는 OPEN 상태 BatchJob 입력값 생성.
     *
     * @param scope 호환성 범위
     * @param scoreId 스코어 ID (선택)
     * @param type 배치 유형
     * @param parameters 배치 파라미터 (선택)
     * @return NewBatchJob
     */
    public static NewBatchJob open(BatchScope scope, String scoreId, String type, Map<String, Object> parameters) {
        return new NewBatchJob(scope, scoreId, type, BatchJobStatus.OPEN, 0, parameters);
    }
}
