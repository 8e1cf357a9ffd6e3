package com.ryuqq.scorelog.core.model;

import java.util.Map;

/**
 * ScoringJob 부분 갱신 입력값. null 필드는 변경하지 않습니다.
 *
 * @param status 상태 (선택)
 * @param batchId 소속 BatchJob ID (선택)
 * @param metadata 부가 정보 (선택, 지정 시 전체 교체)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record ScoringJobUpdate(ScoringJobStatus status, String batchId, Map<String, Object> metadata) {

    public ScoringJobUpdate {
        metadata = ScoringJob.copyOrNull(metadata);
        if (status == null && batchId == null && metadata == null) {
            throw new IllegalArgumentException("update must change at least one field");
        }
    }

    public static ScoringJobUpdate status(ScoringJobStatus status) {
        return new ScoringJobUpdate(status, null, null);
    }
}
