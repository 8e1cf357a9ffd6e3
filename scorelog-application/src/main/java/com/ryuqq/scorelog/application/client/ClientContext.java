package com.ryuqq.scorelog.application.client;

/**
 * 클라이언트 기본 범위 (불변 record).
 *
 * <p>로그 제출 시 비어 있는 accountId / scorecardId / scoreId를 채우는 데 사용됩니다.
 * 정규 ID가 주어지면 그대로 사용하고, key나 이름만 있으면 {@link
 * com.ryuqq.scorelog.application.resolution.IdentifierResolver}로 해석합니다.</p>
 *
 * @param accountKey 계정 key (선택)
 * @param accountId 계정 ID (선택, accountKey보다 우선)
 * @param scorecardKey 스코어카드 key / 이름 / external id (선택)
 * @param scorecardId 스코어카드 ID (선택, scorecardKey보다 우선)
 * @param scoreName 스코어 이름 또는 key (선택, 스코어카드 범위에서 해석)
 * @param scoreId 스코어 ID (선택, scoreName보다 우선)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record ClientContext(
    String accountKey,
    String accountId,
    String scorecardKey,
    String scorecardId,
    String scoreName,
    String scoreId
) {

    /**
     * 빈 컨텍스트 (모든 ID를 LogItem에 직접 지정하는 경우).
     */
    public ClientContext() {
        this(null, null, null, null, null, null);
    }

    public static ClientContext forAccount(String accountKey) {
        return new ClientContext().withAccountKey(accountKey);
    }

    public ClientContext withAccountKey(String accountKey) {
        return new ClientContext(accountKey, accountId, scorecardKey, scorecardId, scoreName, scoreId);
    }

    public ClientContext withAccountId(String accountId) {
        return new ClientContext(accountKey, accountId, scorecardKey, scorecardId, scoreName, scoreId);
    }

    public ClientContext withScorecardKey(String scorecardKey) {
        return new ClientContext(accountKey, accountId, scorecardKey, scorecardId, scoreName, scoreId);
    }

    public ClientContext withScorecardId(String scorecardId) {
        return new ClientContext(accountKey, accountId, scorecardKey, scorecardId, scoreName, scoreId);
    }

    public ClientContext withScoreName(String scoreName) {
        return new ClientContext(accountKey, accountId, scorecardKey, scorecardId, scoreName, scoreId);
    }

    public ClientContext withScoreId(String scoreId) {
        return new ClientContext(accountKey, accountId, scorecardKey, scorecardId, scoreName, scoreId);
    }
}
