package com.ryuqq.scorelog.core.model;

import java.util.Map;

/**
 * ScoringJob 생성 입력값.
 *
 * @param itemId 아이템 ID
 * @param accountId 계정 ID
 * @param scorecardId 스코어카드 ID
 * @param scoreId 스코어 ID (선택)
 * @param batchId 소속 BatchJob ID
 * @param status 초기 상태
 * @param evaluationId Evaluation ID (선택)
 * @param parameters 실행 파라미터 (선택)
 * @param metadata 부가 정보 (선택)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record NewScoringJob(
    String itemId,
    String accountId,
    String scorecardId,
    String scoreId,
    String batchId,
    ScoringJobStatus status,
    String evaluationId,
    Map<String, Object> parameters,
    Map<String, Object> metadata
) {

    public NewScoringJob {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        parameters = ScoringJob.copyOrNull(parameters);
        metadata = ScoringJob.copyOrNull(metadata);
    }
}
