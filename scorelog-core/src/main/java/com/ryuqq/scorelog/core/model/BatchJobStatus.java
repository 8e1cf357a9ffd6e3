package com.ryuqq.scorelog.core.model;

/**
 * BatchJob의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>OPEN → CLOSED (용량 도달)</li>
 *   <li>OPEN → OPEN, CLOSED → CLOSED (동일 상태 재기록 허용)</li>
 *   <li><strong>CLOSED → OPEN 불가 (불변식)</strong></li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public enum BatchJobStatus {

    /**
     * 새 ScoringJob을 받을 수 있음.
     */
    OPEN,

    /**
     * 용량 도달, 더 이상 ScoringJob을 받지 않음.
     */
    CLOSED;

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param next 전이할 상태
     * @throws IllegalArgumentException next가 null인 경우
     * @throws IllegalStateException CLOSED에서 OPEN으로 되돌리려는 경우
     */
    public void validateTransition(BatchJobStatus next) {
        if (next == null) {
            throw new IllegalArgumentException("next status cannot be null");
        }
        if (this == CLOSED && next == OPEN) {
            throw new IllegalStateException(
                String.format("Invalid batch job transition: %s → %s", this, next)
            );
        }
    }
}
