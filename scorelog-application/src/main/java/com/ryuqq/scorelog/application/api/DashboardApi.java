package com.ryuqq.scorelog.application.api;

import com.ryuqq.scorelog.core.contract.BatchJobLinkRequests;
import com.ryuqq.scorelog.core.contract.BatchJobRequests;
import com.ryuqq.scorelog.core.contract.GatewayError;
import com.ryuqq.scorelog.core.contract.GatewayRequest;
import com.ryuqq.scorelog.core.contract.GatewayResponse;
import com.ryuqq.scorelog.core.contract.IdentifierRequests;
import com.ryuqq.scorelog.core.contract.ScoreResultRequests;
import com.ryuqq.scorelog.core.contract.ScoringJobRequests;
import com.ryuqq.scorelog.core.exception.ApplicationException;
import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.BatchJobUpdate;
import com.ryuqq.scorelog.core.model.BatchScope;
import com.ryuqq.scorelog.core.model.IdentifierKind;
import com.ryuqq.scorelog.core.model.LogItem;
import com.ryuqq.scorelog.core.model.LookupMethod;
import com.ryuqq.scorelog.core.model.NewBatchJob;
import com.ryuqq.scorelog.core.model.NewScoringJob;
import com.ryuqq.scorelog.core.model.Page;
import com.ryuqq.scorelog.core.model.PersistedRecord;
import com.ryuqq.scorelog.core.model.ScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJobUpdate;
import com.ryuqq.scorelog.core.spi.Gateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link Gateway} 위의 타입 안전한 대시보드 API.
 *
 * <p>모든 호출에서 두 가지 실패 계층을 확인합니다:</p>
 * <ul>
 *   <li>전송 실패: Gateway가 던진 {@link com.ryuqq.scorelog.core.exception.TransportException}을 그대로 전파</li>
 *   <li>애플리케이션 실패: 응답의 errors가 비어 있지 않으면 {@link ApplicationException}으로 변환</li>
 * </ul>
 *
 * <p>필수 결과인데 data가 없는 응답도 {@link ApplicationException}으로 처리합니다.
 * 조회(find) 계열 연산은 data 부재를 빈 {@link Optional}로 취급합니다.</p>
 *
 * <p><strong>Thread Safety:</strong> 상태가 없으므로 Gateway 구현체가 thread-safe하면 안전합니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class DashboardApi {

    private static final Logger log = LoggerFactory.getLogger(DashboardApi.class);

    private final Gateway gateway;

    /**
     * 생성자.
     *
     * @param gateway 원격 Gateway
     * @throws IllegalArgumentException gateway가 null인 경우
     */
    public DashboardApi(Gateway gateway) {
        if (gateway == null) {
            throw new IllegalArgumentException("gateway cannot be null");
        }
        this.gateway = gateway;
    }

    // ============================================================
    // Score results
    // ============================================================

    public PersistedRecord createScoreResult(LogItem item) {
        return execute(new ScoreResultRequests.Create(item));
    }

    /**
     * 여러 점수 결과를 한 번의 호출로 저장.
     *
     * @param items 저장할 LogItem 목록
     * @return 저장된 레코드 목록
     */
    public List<PersistedRecord> batchCreateScoreResults(List<LogItem> items) {
        return execute(new ScoreResultRequests.BatchCreate(items));
    }

    // ============================================================
    // Scoring jobs
    // ============================================================

    public ScoringJob createScoringJob(NewScoringJob fields) {
        return execute(new ScoringJobRequests.Create(fields));
    }

    public ScoringJob getScoringJob(String id) {
        return execute(new ScoringJobRequests.Get(id));
    }

    public Optional<ScoringJob> findScoringJobByItemId(String itemId) {
        return executeOptional(new ScoringJobRequests.FindByItemId(itemId));
    }

    public ScoringJob updateScoringJob(String id, ScoringJobUpdate update) {
        return execute(new ScoringJobRequests.Update(id, update));
    }

    // ============================================================
    // Batch jobs
    // ============================================================

    public BatchJob createBatchJob(NewBatchJob fields) {
        return execute(new BatchJobRequests.Create(fields));
    }

    public BatchJob getBatchJob(String id) {
        return execute(new BatchJobRequests.Get(id));
    }

    public BatchJob updateBatchJob(String id, BatchJobUpdate update) {
        return execute(new BatchJobRequests.Update(id, update));
    }

    public List<BatchJob> listOpenBatchJobs(BatchScope scope) {
        return execute(new BatchJobRequests.ListOpen(scope));
    }

    // ============================================================
    // Links
    // ============================================================

    public BatchJobLink createLink(String batchJobId, String scoringJobId) {
        return execute(new BatchJobLinkRequests.Create(new BatchJobLink(batchJobId, scoringJobId)));
    }

    public Page<BatchJobLink> listLinks(String batchJobId, int limit, String nextToken) {
        return execute(new BatchJobLinkRequests.ListByBatchJob(batchJobId, limit, nextToken));
    }

    public Optional<BatchJobLink> findLinkForScoringJob(String scoringJobId) {
        return executeOptional(new BatchJobLinkRequests.FindByScoringJob(scoringJobId));
    }

    /**
     * BatchJob에 연결된 링크 수를 모든 페이지를 순회하여 계산.
     *
     * <p>캐시된 scoringJobCountCache를 신뢰하지 않고 링크 테이블에서 직접 센 값입니다.</p>
     *
     * @param batchJobId BatchJob ID
     * @param pageSize 페이지 크기
     * @return 링크 수
     * @throws IllegalStateException 페이지 토큰이 진행되지 않는 경우
     */
    public int countLinksForBatch(String batchJobId, int pageSize) {
        int total = 0;
        int pages = 0;
        String nextToken = null;

        do {
            Page<BatchJobLink> page = listLinks(batchJobId, pageSize, nextToken);
            total += page.items().size();
            pages++;

            if (page.hasNext() && Objects.equals(page.nextToken(), nextToken)) {
                throw new IllegalStateException(
                    "Link pagination did not advance for batch job " + batchJobId + " (token: " + nextToken + ")"
                );
            }
            nextToken = page.nextToken();
        } while (nextToken != null && !nextToken.isEmpty());

        log.debug("Counted {} links for batch job {} across {} page(s)", total, batchJobId, pages);
        return total;
    }

    // ============================================================
    // Identifiers
    // ============================================================

    public Optional<String> lookupIdentifier(IdentifierKind kind, LookupMethod method, String identifier, String scopeId) {
        return executeOptional(new IdentifierRequests.Lookup(kind, method, identifier, scopeId));
    }

    /**
     * 요청 실행 후 두 실패 계층 확인 (필수 결과).
     */
    private <T> T execute(GatewayRequest<T> request) {
        T data = checked(request, gateway.execute(request));
        if (data == null) {
            throw new ApplicationException(
                request.operation(),
                List.of(GatewayError.of("response carried no data"))
            );
        }
        return data;
    }

    /**
     * 요청 실행 후 두 실패 계층 확인 (선택 결과, data 부재는 빈 Optional).
     */
    private <T> Optional<T> executeOptional(GatewayRequest<Optional<T>> request) {
        Optional<T> data = checked(request, gateway.execute(request));
        return data == null ? Optional.empty() : data;
    }

    private <T> T checked(GatewayRequest<T> request, GatewayResponse<T> response) {
        if (response == null) {
            throw new ApplicationException(
                request.operation(),
                List.of(GatewayError.of("gateway returned no response"))
            );
        }
        if (response.hasErrors()) {
            throw new ApplicationException(request.operation(), response.errors());
        }
        return response.data();
    }
}
