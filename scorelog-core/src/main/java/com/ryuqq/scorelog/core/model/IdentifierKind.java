package com.ryuqq.scorelog.core.model;

/**
 * 식별자 해석 대상 리소스 종류.
 *
 * <p>SCORE는 상위 스코어카드 ID 범위 안에서만 해석됩니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public enum IdentifierKind {
    ACCOUNT,
    SCORECARD,
    SCORE
}
