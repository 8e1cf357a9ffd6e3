package com.ryuqq.scorelog.core.model;

/**
 * 식별자 조회 방식.
 *
 * <p>선언 순서가 곧 해석 시도 순서입니다: ID → KEY → NAME → EXTERNAL_ID.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public enum LookupMethod {

    /**
     * 정식 ID 존재 확인.
     */
    ID,

    /**
     * 짧은 키 조회.
     */
    KEY,

    /**
     * 표시 이름 조회.
     */
    NAME,

    /**
     * 외부 시스템 ID 조회.
     */
    EXTERNAL_ID
}
