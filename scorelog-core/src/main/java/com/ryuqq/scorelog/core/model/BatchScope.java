package com.ryuqq.scorelog.core.model;

/**
 * BatchJob의 호환성 범위 (account, scorecard, model provider, model).
 *
 * <p>BatchJob에 연결된 모든 ScoringJob은 동일한 BatchScope를 공유해야 합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong> 모든 필드는 null 또는 빈 문자열 불가</p>
 *
 * @param accountId 계정 ID
 * @param scorecardId 스코어카드 ID
 * @param modelProvider 모델 제공자 (예: OpenAI, Bedrock)
 * @param modelName 모델 이름
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record BatchScope(
    String accountId,
    String scorecardId,
    String modelProvider,
    String modelName
) {

    public BatchScope {
        requireText(accountId, "accountId");
        requireText(scorecardId, "scorecardId");
        requireText(modelProvider, "modelProvider");
        requireText(modelName, "modelName");
    }

    /**
     * BatchScope 생성.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static BatchScope of(String accountId, String scorecardId, String modelProvider, String modelName) {
        return new BatchScope(accountId, scorecardId, modelProvider, modelName);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
