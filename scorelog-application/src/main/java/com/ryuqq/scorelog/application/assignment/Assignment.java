package com.ryuqq.scorelog.application.assignment;

import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.ScoringJob;

/**
 * 배정 결과.
 *
 * <p>기존 ScoringJob을 재사용한 경우(reused=true) 링크가 유실되었으면 batchJob이 null일 수 있습니다.
 * 새로 배정한 경우 batchJob은 마지막으로 기록된 상태입니다.</p>
 *
 * @param scoringJob 배정된 ScoringJob
 * @param batchJob 소속 BatchJob (재사용 시 null 가능)
 * @param reused 기존 ScoringJob 재사용 여부
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record Assignment(ScoringJob scoringJob, BatchJob batchJob, boolean reused) {

    public Assignment {
        if (scoringJob == null) {
            throw new IllegalArgumentException("scoringJob cannot be null");
        }
        if (batchJob == null && !reused) {
            throw new IllegalArgumentException("batchJob cannot be null for a new assignment");
        }
    }

    public static Assignment created(ScoringJob scoringJob, BatchJob batchJob) {
        return new Assignment(scoringJob, batchJob, false);
    }

    public static Assignment reused(ScoringJob scoringJob, BatchJob batchJob) {
        return new Assignment(scoringJob, batchJob, true);
    }

    public boolean hasBatchJob() {
        return batchJob != null;
    }
}
