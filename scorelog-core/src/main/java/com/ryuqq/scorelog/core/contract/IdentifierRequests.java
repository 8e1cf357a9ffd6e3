package com.ryuqq.scorelog.core.contract;

import com.ryuqq.scorelog.core.model.IdentifierKind;
import com.ryuqq.scorelog.core.model.LookupMethod;

import java.util.Optional;

/**
 * 식별자 조회 요청.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class IdentifierRequests {

    private IdentifierRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 하나의 조회 방식으로 식별자를 정식 ID로 변환.
     *
     * @param kind 리소스 종류
     * @param method 조회 방식
     * @param identifier 사람이 읽는 식별자
     * @param scopeId 상위 범위 ID (SCORE의 경우 스코어카드 ID, 그 외 null)
     */
    public record Lookup(IdentifierKind kind, LookupMethod method, String identifier, String scopeId)
        implements GatewayRequest<Optional<String>> {

        public Lookup {
            if (kind == null) {
                throw new IllegalArgumentException("kind cannot be null");
            }
            if (method == null) {
                throw new IllegalArgumentException("method cannot be null");
            }
            if (identifier == null || identifier.isBlank()) {
                throw new IllegalArgumentException("identifier cannot be null or blank");
            }
        }

        @Override
        public Operation operation() {
            return Operation.LOOKUP_IDENTIFIER;
        }

        @Override
        public Optional<String> accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }
}
