package com.ryuqq.scorelog.application.assignment;

import com.ryuqq.scorelog.core.model.BatchScope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * ScoringJob 배정 요청.
 *
 * <p>(accountId, scorecardId, modelProvider, modelName)이 호환성 범위를 이루며,
 * 같은 범위의 OPEN BatchJob에만 배정됩니다.</p>
 *
 * @param itemId 아이템 ID (필수)
 * @param accountId 계정 ID (필수)
 * @param scorecardId 스코어카드 ID (필수)
 * @param modelProvider 모델 제공자 (필수)
 * @param modelName 모델 이름 (필수)
 * @param scoreId 스코어 ID (선택)
 * @param evaluationId Evaluation ID (선택)
 * @param parameters 실행 파라미터 (선택)
 * @param metadata 부가 정보 (선택)
 * @param maxBatchSize BatchJob 최대 크기 (기본 20)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record AssignmentRequest(
    String itemId,
    String accountId,
    String scorecardId,
    String modelProvider,
    String modelName,
    String scoreId,
    String evaluationId,
    Map<String, Object> parameters,
    Map<String, Object> metadata,
    int maxBatchSize
) {

    public static final int DEFAULT_MAX_BATCH_SIZE = 20;

    public AssignmentRequest {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId cannot be null or blank");
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive (current: " + maxBatchSize + ")");
        }
        // scope 필드는 BatchScope가 검증
        BatchScope.of(accountId, scorecardId, modelProvider, modelName);
        parameters = copyOrNull(parameters);
        metadata = copyOrNull(metadata);
    }

    /**
     * 이 요청의 호환성 범위.
     */
    public BatchScope scope() {
        return BatchScope.of(accountId, scorecardId, modelProvider, modelName);
    }

    /**
     * Builder 생성.
     *
     * @param itemId 아이템 ID
     * @return Builder
     */
    public static Builder builder(String itemId) {
        return new Builder(itemId);
    }

    private static Map<String, Object> copyOrNull(Map<String, Object> source) {
        return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static final class Builder {

        private final String itemId;
        private String accountId;
        private String scorecardId;
        private String modelProvider;
        private String modelName;
        private String scoreId;
        private String evaluationId;
        private Map<String, Object> parameters;
        private Map<String, Object> metadata;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;

        private Builder(String itemId) {
            this.itemId = itemId;
        }

        /**
         * 호환성 범위 4개 필드를 한 번에 설정.
         */
        public Builder scope(BatchScope scope) {
            this.accountId = scope.accountId();
            this.scorecardId = scope.scorecardId();
            this.modelProvider = scope.modelProvider();
            this.modelName = scope.modelName();
            return this;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder scorecardId(String scorecardId) {
            this.scorecardId = scorecardId;
            return this;
        }

        public Builder modelProvider(String modelProvider) {
            this.modelProvider = modelProvider;
            return this;
        }

        public Builder modelName(String modelName) {
            this.modelName = modelName;
            return this;
        }

        public Builder scoreId(String scoreId) {
            this.scoreId = scoreId;
            return this;
        }

        public Builder evaluationId(String evaluationId) {
            this.evaluationId = evaluationId;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public AssignmentRequest build() {
            return new AssignmentRequest(
                itemId, accountId, scorecardId, modelProvider, modelName,
                scoreId, evaluationId, parameters, metadata, maxBatchSize
            );
        }
    }
}
