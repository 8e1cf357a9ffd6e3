package com.ryuqq.scorelog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 단일 아이템의 스코어링 작업 기록.
 *
 * <p><strong>불변식:</strong> 아이템(itemId)당 ScoringJob은 최대 1개.
 * 생성 전 반드시 기존 작업을 조회해야 합니다.</p>
 *
 * @param id ScoringJob ID
 * @param itemId 아이템 ID
 * @param accountId 계정 ID
 * @param scorecardId 스코어카드 ID
 * @param scoreId 스코어 ID (선택)
 * @param batchId 소속 BatchJob ID (선택)
 * @param status 상태
 * @param evaluationId Evaluation ID (선택)
 * @param parameters 실행 파라미터 (선택)
 * @param metadata 부가 정보 (선택)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record ScoringJob(
    String id,
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

    public ScoringJob {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        parameters = copyOrNull(parameters);
        metadata = copyOrNull(metadata);
    }

    /**
     * 상태만 변경한 새 인스턴스 생성.
     */
    public ScoringJob withStatus(ScoringJobStatus status) {
        return new ScoringJob(id, itemId, accountId, scorecardId, scoreId, batchId, status, evaluationId, parameters, metadata);
    }

    static Map<String, Object> copyOrNull(Map<String, Object> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
