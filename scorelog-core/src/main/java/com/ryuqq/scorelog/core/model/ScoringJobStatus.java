package com.ryuqq.scorelog.core.model;

/**
 * ScoringJob의 상태.
 *
 * <p>이 SDK는 PENDING 상태로 생성만 하며, 이후 전이는 다운스트림 처리기가 수행합니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public enum ScoringJobStatus {
    PENDING,
    QUEUED,
    IN_PROGRESS,
    COMPLETED,
    FAILED;

    /**
     * 종료 상태인지 확인.
     *
     * @return COMPLETED 또는 FAILED인 경우 true
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
