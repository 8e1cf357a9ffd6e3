package com.ryuqq.scorelog.core.contract;

import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.BatchJobUpdate;
import com.ryuqq.scorelog.core.model.BatchScope;
import com.ryuqq.scorelog.core.model.NewBatchJob;

import java.util.List;

import static com.ryuqq.scorelog.core.contract.ScoringJobRequests.requireId;

/**
 * BatchJob CRUD 요청.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class BatchJobRequests {

    private BatchJobRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public record Create(NewBatchJob fields) implements GatewayRequest<BatchJob> {

        public Create {
            if (fields == null) {
                throw new IllegalArgumentException("fields cannot be null");
            }
        }

        @Override
        public Operation operation() {
            return Operation.CREATE_BATCH_JOB;
        }

        @Override
        public BatchJob accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    public record Get(String id) implements GatewayRequest<BatchJob> {

        public Get {
            requireId(id, "id");
        }

        @Override
        public Operation operation() {
            return Operation.GET_BATCH_JOB;
        }

        @Override
        public BatchJob accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    public record Update(String id, BatchJobUpdate update) implements GatewayRequest<BatchJob> {

        public Update {
            requireId(id, "id");
            if (update == null) {
                throw new IllegalArgumentException("update cannot be null");
            }
        }

        @Override
        public Operation operation() {
            return Operation.UPDATE_BATCH_JOB;
        }

        @Override
        public BatchJob accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    /**
     * 범위가 일치하는 OPEN 상태 BatchJob 목록 조회.
     *
     * <p>응답 항목은 id, status, totalRequests, 범위 필드만 담은 요약일 수 있습니다.</p>
     */
    public record ListOpen(BatchScope scope) implements GatewayRequest<List<BatchJob>> {

        public ListOpen {
            if (scope == null) {
                throw new IllegalArgumentException("scope cannot be null");
            }
        }

        @Override
        public Operation operation() {
            return Operation.LIST_OPEN_BATCH_JOBS;
        }

        @Override
        public List<BatchJob> accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }
}
