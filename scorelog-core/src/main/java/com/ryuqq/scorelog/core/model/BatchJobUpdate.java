package com.ryuqq.scorelog.core.model;

/**
 * BatchJob 부분 갱신 입력값.
 *
 * <p>null 필드는 변경하지 않습니다.</p>
 *
 * @param scoringJobCountCache 링크 수 캐시 (선택)
 * @param status 상태 (선택)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record BatchJobUpdate(Integer scoringJobCountCache, BatchJobStatus status) {

    public BatchJobUpdate {
        if (scoringJobCountCache != null && scoringJobCountCache < 0) {
            throw new IllegalArgumentException(
                "scoringJobCountCache cannot be negative (current: " + scoringJobCountCache + ")"
            );
        }
        if (scoringJobCountCache == null && status == null) {
            throw new IllegalArgumentException("update must change at least one field");
        }
    }

    /**
     * 링크 수 캐시만 갱신.
     */
    public static BatchJobUpdate countCache(int scoringJobCountCache) {
        return new BatchJobUpdate(scoringJobCountCache, null);
    }

    /**
     * 링크 수 캐시를 기록하며 CLOSED로 전이.
     */
    public static BatchJobUpdate close(int scoringJobCountCache) {
        return new BatchJobUpdate(scoringJobCountCache, BatchJobStatus.CLOSED);
    }
}
