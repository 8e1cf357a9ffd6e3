package com.ryuqq.scorelog.core.contract;

/**
 * Gateway가 실행하는 원격 연산 이름.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public enum Operation {
    CREATE_SCORE_RESULT,
    BATCH_CREATE_SCORE_RESULTS,
    CREATE_SCORING_JOB,
    GET_SCORING_JOB,
    FIND_SCORING_JOB_BY_ITEM,
    UPDATE_SCORING_JOB,
    CREATE_BATCH_JOB,
    GET_BATCH_JOB,
    UPDATE_BATCH_JOB,
    LIST_OPEN_BATCH_JOBS,
    CREATE_BATCH_JOB_LINK,
    LIST_BATCH_JOB_LINKS,
    FIND_BATCH_JOB_LINK,
    LOOKUP_IDENTIFIER;

    /**
     * 원격 상태를 변경하는 연산인지 확인.
     *
     * @return create/update 계열이면 true
     */
    public boolean isMutation() {
        return switch (this) {
            case CREATE_SCORE_RESULT, BATCH_CREATE_SCORE_RESULTS, CREATE_SCORING_JOB, UPDATE_SCORING_JOB,
                CREATE_BATCH_JOB, UPDATE_BATCH_JOB, CREATE_BATCH_JOB_LINK -> true;
            default -> false;
        };
    }
}
