package com.ryuqq.scorelog.core.contract;

import com.ryuqq.scorelog.core.model.NewScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJobUpdate;

import java.util.Optional;

/**
 * ScoringJob CRUD 요청.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class ScoringJobRequests {

    private ScoringJobRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public record Create(NewScoringJob fields) implements GatewayRequest<ScoringJob> {

        public Create {
            if (fields == null) {
                throw new IllegalArgumentException("fields cannot be null");
            }
        }

        @Override
        public Operation operation() {
            return Operation.CREATE_SCORING_JOB;
        }

        @Override
        public ScoringJob accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    public record Get(String id) implements GatewayRequest<ScoringJob> {

        public Get {
            requireId(id, "id");
        }

        @Override
        public Operation operation() {
            return Operation.GET_SCORING_JOB;
        }

        @Override
        public ScoringJob accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    /**
     * itemId로 기존 ScoringJob 조회. 없으면 빈 Optional.
     */
    public record FindByItemId(String itemId) implements GatewayRequest<Optional<ScoringJob>> {

        public FindByItemId {
            requireId(itemId, "itemId");
        }

        @Override
        public Operation operation() {
            return Operation.FIND_SCORING_JOB_BY_ITEM;
        }

        @Override
        public Optional<ScoringJob> accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    public record Update(String id, ScoringJobUpdate update) implements GatewayRequest<ScoringJob> {

        public Update {
            requireId(id, "id");
            if (update == null) {
                throw new IllegalArgumentException("update cannot be null");
            }
        }

        @Override
        public Operation operation() {
            return Operation.UPDATE_SCORING_JOB;
        }

        @Override
        public ScoringJob accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    static void requireId(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
