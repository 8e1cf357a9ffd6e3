package com.ryuqq.scorelog.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 기록할 단일 점수 결과 (Score Result).
 *
 * <p>호출자가 제출하고, Dispatcher의 flush에 의해 정확히 한 번 소비됩니다.</p>
 *
 * <p><strong>필수 값:</strong> itemId (null 또는 빈 문자열 불가)</p>
 * <p><strong>선택 값:</strong> accountId, scorecardId, scoreId, confidence, metadata,
 * scoringJobId, evaluationId (null 허용)</p>
 *
 * <p>배치 설정(batchSize, batchTimeout)은 원격에 저장되지 않으므로 이 record에 포함되지 않으며,
 * 제출 시 {@link BatchKey}로 함께 전달됩니다.</p>
 *
 * @param value 점수 값
 * @param itemId 대상 아이템 ID
 * @param accountId 계정 ID (선택)
 * @param scorecardId 스코어카드 ID (선택)
 * @param scoreId 스코어 ID (선택)
 * @param confidence 신뢰도 (선택)
 * @param metadata 부가 정보 (선택, 불변 복사본으로 보관)
 * @param scoringJobId 연관 ScoringJob ID (선택)
 * @param evaluationId 연관 Evaluation ID (선택)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record LogItem(
    double value,
    String itemId,
    String accountId,
    String scorecardId,
    String scoreId,
    Double confidence,
    Map<String, Object> metadata,
    String scoringJobId,
    String evaluationId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException itemId가 null이거나 빈 문자열인 경우
     */
    public LogItem {
        if (itemId == null || itemId.isBlank()) {
            throw new IllegalArgumentException("itemId cannot be null or blank");
        }
        metadata = metadata == null || metadata.isEmpty()
            ? null
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * 값과 아이템 ID만으로 LogItem 생성.
     *
     * @param value 점수 값
     * @param itemId 아이템 ID
     * @return LogItem 인스턴스
     */
    public static LogItem of(double value, String itemId) {
        return builder(value, itemId).build();
    }

    /**
     * Builder 생성.
     *
     * @param value 점수 값
     * @param itemId 아이템 ID
     * @return Builder
     */
    public static Builder builder(double value, String itemId) {
        return new Builder(value, itemId);
    }

    /**
     * accountId만 변경한 새 인스턴스 생성.
     */
    public LogItem withAccountId(String accountId) {
        return new LogItem(value, itemId, accountId, scorecardId, scoreId, confidence, metadata, scoringJobId, evaluationId);
    }

    /**
     * scorecardId만 변경한 새 인스턴스 생성.
     */
    public LogItem withScorecardId(String scorecardId) {
        return new LogItem(value, itemId, accountId, scorecardId, scoreId, confidence, metadata, scoringJobId, evaluationId);
    }

    /**
     * scoreId만 변경한 새 인스턴스 생성.
     */
    public LogItem withScoreId(String scoreId) {
        return new LogItem(value, itemId, accountId, scorecardId, scoreId, confidence, metadata, scoringJobId, evaluationId);
    }

    /**
     * LogItem Builder.
     */
    public static final class Builder {

        private final double value;
        private final String itemId;
        private String accountId;
        private String scorecardId;
        private String scoreId;
        private Double confidence;
        private Map<String, Object> metadata;
        private String scoringJobId;
        private String evaluationId;

        private Builder(double value, String itemId) {
            this.value = value;
            this.itemId = itemId;
        }

        public Builder accountId(String accountId) {
            this.accountId = accountId;
            return this;
        }

        public Builder scorecardId(String scorecardId) {
            this.scorecardId = scorecardId;
            return this;
        }

        public Builder scoreId(String scoreId) {
            this.scoreId = scoreId;
            return this;
        }

        public Builder confidence(Double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public Builder scoringJobId(String scoringJobId) {
            this.scoringJobId = scoringJobId;
            return this;
        }

        public Builder evaluationId(String evaluationId) {
            this.evaluationId = evaluationId;
            return this;
        }

        /**
         * LogItem 생성.
         *
         * @return LogItem 인스턴스
         * @throws IllegalArgumentException itemId가 유효하지 않은 경우
         */
        public LogItem build() {
            return new LogItem(value, itemId, accountId, scorecardId, scoreId, confidence, metadata, scoringJobId, evaluationId);
        }
    }
}
