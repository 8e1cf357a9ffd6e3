package com.ryuqq.scorelog.application.client;

import com.ryuqq.scorelog.application.assignment.Assignment;
import com.ryuqq.scorelog.application.assignment.AssignmentRequest;
import com.ryuqq.scorelog.application.assignment.BatchJobAssigner;
import com.ryuqq.scorelog.application.logger.ScoreLogger;
import com.ryuqq.scorelog.application.logger.SubmitOptions;
import com.ryuqq.scorelog.application.resolution.IdentifierResolver;
import com.ryuqq.scorelog.core.model.IdentifierKind;
import com.ryuqq.scorelog.core.model.LogItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 대시보드 클라이언트 Facade.
 *
 * <p>클라이언트 수명 동안 하나의 {@link ScoreLogger}, {@link BatchJobAssigner},
 * {@link IdentifierResolver}를 소유하고, {@link ClientContext}로 비어 있는 범위 ID를 채웁니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (DashboardClient client = DashboardClientFactory.create(gateway, context)) {
 *     client.logScore(LogItem.of(0.92, "item-1"));
 *     Assignment assignment = client.assign(request);
 * }
 * </pre>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class DashboardClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DashboardClient.class);

    private final ClientContext context;
    private final ScoreLogger scoreLogger;
    private final BatchJobAssigner assigner;
    private final IdentifierResolver resolver;

    /**
     * 생성자.
     *
     * @param context 클라이언트 기본 범위
     * @param scoreLogger 점수 로거
     * @param assigner BatchJob 배정기
     * @param resolver 식별자 해석기
     * @throws IllegalArgumentException 파라미터가 null인 경우
     */
    public DashboardClient(
        ClientContext context,
        ScoreLogger scoreLogger,
        BatchJobAssigner assigner,
        IdentifierResolver resolver
    ) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (scoreLogger == null) {
            throw new IllegalArgumentException("scoreLogger cannot be null");
        }
        if (assigner == null) {
            throw new IllegalArgumentException("assigner cannot be null");
        }
        if (resolver == null) {
            throw new IllegalArgumentException("resolver cannot be null");
        }
        this.context = context;
        this.scoreLogger = scoreLogger;
        this.assigner = assigner;
        this.resolver = resolver;
    }

    /**
     * 기본 옵션으로 점수 결과 기록 (fire-and-forget).
     *
     * @param item 기록할 LogItem
     */
    public void logScore(LogItem item) {
        logScore(item, SubmitOptions.defaults());
    }

    /**
     * 점수 결과 기록 (fire-and-forget).
     *
     * <p>비어 있는 범위 ID는 {@link ClientContext}에서 해석해 채운 뒤 로거에 제출합니다.
     * 해석에 실패한 ID는 비워 둔 채로 제출합니다.</p>
     *
     * @param item 기록할 LogItem
     * @param options 제출 옵션
     * @throws IllegalArgumentException item 또는 options가 null인 경우
     */
    public void logScore(LogItem item, SubmitOptions options) {
        logScore(item, options, null);
    }

    /**
     * 이번 호출에만 적용되는 스코어카드로 점수 결과 기록 (fire-and-forget).
     *
     * <p>scorecardKey가 주어지면 LogItem에 scorecardId가 없을 때 컨텍스트 대신 이 식별자를 해석합니다.
     * 컨텍스트는 변경하지 않으며, 스코어 ID는 해석된 스코어카드 범위에서 scoreName으로만 찾습니다.</p>
     *
     * @param item 기록할 LogItem
     * @param options 제출 옵션
     * @param scorecardKey 스코어카드 식별자 (key, 이름, 외부 ID). null이면 컨텍스트 사용
     * @throws IllegalArgumentException item 또는 options가 null인 경우
     */
    public void logScore(LogItem item, SubmitOptions options, String scorecardKey) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        boolean overridden = scorecardKey != null && !scorecardKey.isBlank();
        LogItem completed = item;
        if (completed.accountId() == null) {
            completed = completed.withAccountId(resolveAccountId());
        }
        if (completed.scorecardId() == null) {
            String scorecardId = overridden
                ? resolver.resolve(IdentifierKind.SCORECARD, scorecardKey)
                : resolveScorecardId();
            completed = completed.withScorecardId(scorecardId);
        }
        if (completed.scoreId() == null) {
            String scoreId = overridden
                ? resolveScoreName(completed.scorecardId())
                : resolveScoreId(completed.scorecardId());
            completed = completed.withScoreId(scoreId);
        }

        if (completed.accountId() == null || completed.scorecardId() == null) {
            log.warn("Submitting score for item {} without full scope (accountId: {}, scorecardId: {})",
                completed.itemId(), completed.accountId(), completed.scorecardId());
        }
        scoreLogger.submit(completed, options);
    }

    /**
     * 아이템을 호환 BatchJob에 배정.
     *
     * @param request 배정 요청
     * @return 배정 결과
     * @throws com.ryuqq.scorelog.core.exception.GatewayException 원격 호출 실패 시
     */
    public Assignment assign(AssignmentRequest request) {
        return assigner.assign(request);
    }

    /**
     * 컨텍스트의 계정 ID 해석.
     *
     * @return 계정 ID, 해석 불가 시 null
     */
    public String resolveAccountId() {
        if (context.accountId() != null) {
            return context.accountId();
        }
        return context.accountKey() == null ? null : resolver.resolve(IdentifierKind.ACCOUNT, context.accountKey());
    }

    /**
     * 컨텍스트의 스코어카드 ID 해석.
     *
     * @return 스코어카드 ID, 해석 불가 시 null
     */
    public String resolveScorecardId() {
        if (context.scorecardId() != null) {
            return context.scorecardId();
        }
        return context.scorecardKey() == null ? null : resolver.resolve(IdentifierKind.SCORECARD, context.scorecardKey());
    }

    /**
     * 컨텍스트의 스코어 ID를 주어진 스코어카드 범위에서 해석.
     *
     * @param scorecardId 스코어카드 ID (scoreName 해석 범위)
     * @return 스코어 ID, 해석 불가 시 null
     */
    public String resolveScoreId(String scorecardId) {
        if (context.scoreId() != null) {
            return context.scoreId();
        }
        return resolveScoreName(scorecardId);
    }

    private String resolveScoreName(String scorecardId) {
        if (context.scoreName() == null || scorecardId == null) {
            return null;
        }
        return resolver.resolve(IdentifierKind.SCORE, context.scoreName(), scorecardId);
    }

    public ClientContext getContext() {
        return context;
    }

    /**
     * 남은 점수 결과를 모두 저장하고 로거를 종료. 멱등.
     */
    public void flush() {
        scoreLogger.flush();
    }

    @Override
    public void close() {
        flush();
    }
}
