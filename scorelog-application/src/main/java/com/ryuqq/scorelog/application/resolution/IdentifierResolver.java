package com.ryuqq.scorelog.application.resolution;

import com.ryuqq.scorelog.core.model.IdentifierKind;

/**
 * 사람이 쓰는 식별자(key, name, external id)를 정규 ID로 변환.
 *
 * <p>해석 실패 시 예외 대신 null을 반환합니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public interface IdentifierResolver {

    /**
     * 식별자 해석.
     *
     * @param kind 식별자 종류
     * @param identifier 식별자
     * @return 정규 ID, 찾지 못하면 null
     */
    default String resolve(IdentifierKind kind, String identifier) {
        return resolve(kind, identifier, null);
    }

    /**
     * 범위가 있는 식별자 해석 (SCORE는 스코어카드 ID 범위).
     *
     * @param kind 식별자 종류
     * @param identifier 식별자
     * @param scopeId 범위 ID (선택)
     * @return 정규 ID, 찾지 못하면 null
     */
    String resolve(IdentifierKind kind, String identifier, String scopeId);
}
