package com.ryuqq.scorelog.core.model;

import java.util.Map;

/**
 * 다운스트림에서 함께 처리될 ScoringJob 묶음.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>연결된 모든 ScoringJob은 이 BatchJob의 {@link BatchScope}를 공유</li>
 *   <li>scoringJobCountCache가 maxBatchSize에 도달하면 CLOSED, 이후 OPEN으로 복귀 불가</li>
 *   <li>scoringJobCountCache는 링크 테이블에서 재계산된 비정규화 값이며 맹신하지 않음</li>
 * </ul>
 *
 * @param id BatchJob ID
 * @param accountId 계정 ID
 * @param scorecardId 스코어카드 ID
 * @param scoreId 스코어 ID (선택)
 * @param type 배치 유형 (예: MultiStepScore)
 * @param modelProvider 모델 제공자
 * @param modelName 모델 이름
 * @param status 상태
 * @param totalRequests 전체 요청 수 (선택, 미설정 가능)
 * @param scoringJobCountCache 링크 수 캐시
 * @param parameters 배치 파라미터 (선택)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record BatchJob(
    String id,
    String accountId,
    String scorecardId,
    String scoreId,
    String type,
    String modelProvider,
    String modelName,
    BatchJobStatus status,
    Integer totalRequests,
    int scoringJobCountCache,
    Map<String, Object> parameters
) {

    public BatchJob {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (scoringJobCountCache < 0) {
            throw new IllegalArgumentException(
                "scoringJobCountCache cannot be negative (current: " + scoringJobCountCache + ")"
            );
        }
        parameters = ScoringJob.copyOrNull(parameters);
    }

    /**
     * 이 BatchJob의 호환성 범위.
     *
     * @return BatchScope
     */
    public BatchScope scope() {
        return BatchScope.of(accountId, scorecardId, modelProvider, modelName);
    }

    public boolean isOpen() {
        return status == BatchJobStatus.OPEN;
    }

    /**
     * 최대 크기 기준으로 여유가 있는지 확인 (first-fit 기준).
     *
     * <p>totalRequests가 설정되지 않았거나 maxBatchSize 미만이면 여유가 있는 것으로 판단합니다.</p>
     *
     * @param maxBatchSize 최대 배치 크기
     * @return 여유가 있으면 true
     */
    public boolean hasRoomFor(int maxBatchSize) {
        return totalRequests == null || totalRequests < maxBatchSize;
    }
}
