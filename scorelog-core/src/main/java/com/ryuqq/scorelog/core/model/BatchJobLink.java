package com.ryuqq.scorelog.core.model;

/**
 * BatchJob ↔ ScoringJob 연결 레코드.
 *
 * <p>BatchJob의 실제 ScoringJob 수를 판단하는 유일한 근거입니다.</p>
 *
 * @param batchJobId BatchJob ID
 * @param scoringJobId ScoringJob ID
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record BatchJobLink(String batchJobId, String scoringJobId) {

    public BatchJobLink {
        if (batchJobId == null || batchJobId.isBlank()) {
            throw new IllegalArgumentException("batchJobId cannot be null or blank");
        }
        if (scoringJobId == null || scoringJobId.isBlank()) {
            throw new IllegalArgumentException("scoringJobId cannot be null or blank");
        }
    }
}
