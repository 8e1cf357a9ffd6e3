package com.ryuqq.scorelog.core.contract;

import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.Page;

import java.util.Optional;

import static com.ryuqq.scorelog.core.contract.ScoringJobRequests.requireId;

/**
 * BatchJob ↔ ScoringJob 링크 요청.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class BatchJobLinkRequests {

    private BatchJobLinkRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public record Create(BatchJobLink link) implements GatewayRequest<BatchJobLink> {

        public Create {
            if (link == null) {
                throw new IllegalArgumentException("link cannot be null");
            }
        }

        @Override
        public Operation operation() {
            return Operation.CREATE_BATCH_JOB_LINK;
        }

        @Override
        public BatchJobLink accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    /**
     * BatchJob의 링크를 페이지 단위로 조회.
     *
     * @param batchJobId BatchJob ID
     * @param limit 페이지 크기 (1 이상)
     * @param nextToken 이전 페이지의 토큰 (첫 페이지면 null)
     */
    public record ListByBatchJob(String batchJobId, int limit, String nextToken)
        implements GatewayRequest<Page<BatchJobLink>> {

        public ListByBatchJob {
            requireId(batchJobId, "batchJobId");
            if (limit <= 0) {
                throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
            }
        }

        @Override
        public Operation operation() {
            return Operation.LIST_BATCH_JOB_LINKS;
        }

        @Override
        public Page<BatchJobLink> accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    public record FindByScoringJob(String scoringJobId) implements GatewayRequest<Optional<BatchJobLink>> {

        public FindByScoringJob {
            requireId(scoringJobId, "scoringJobId");
        }

        @Override
        public Operation operation() {
            return Operation.FIND_BATCH_JOB_LINK;
        }

        @Override
        public Optional<BatchJobLink> accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }
}
