package com.ryuqq.scorelog.adapter.runner;

import com.ryuqq.scorelog.application.api.DashboardApi;
import com.ryuqq.scorelog.application.assignment.Assignment;
import com.ryuqq.scorelog.application.assignment.AssignmentRequest;
import com.ryuqq.scorelog.application.assignment.BatchJobAssigner;
import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.BatchJobUpdate;
import com.ryuqq.scorelog.core.model.BatchScope;
import com.ryuqq.scorelog.core.model.NewBatchJob;
import com.ryuqq.scorelog.core.model.NewScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * BatchJob 배정 조정자.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>itemId로 기존 ScoringJob 조회, 있으면 연결된 BatchJob과 함께 반환</li>
 *   <li>같은 범위의 OPEN BatchJob 중 first-fit 선택 (totalRequests 미설정 또는 maxBatchSize 미만)</li>
 *   <li>없으면 OPEN, scoringJobCountCache=0 으로 새 BatchJob 생성</li>
 *   <li>ScoringJob을 PENDING, batchId 지정으로 생성</li>
 *   <li>링크 생성</li>
 *   <li>링크 테이블을 페이지 순회하여 재계산</li>
 *   <li>재계산 값을 scoringJobCountCache에 기록, maxBatchSize 이상이고 OPEN이면 CLOSED</li>
 * </ol>
 *
 * <p><strong>Soft cap:</strong> 2~7단계는 원자적이지 않습니다. 동시에 같은 BatchJob을 고른 호출 수만큼
 * maxBatchSize를 초과할 수 있으며, 재계산으로 캐시 값은 실제 링크 수로 수렴합니다.</p>
 *
 * <p>모든 오류는 호출자에게 전파됩니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class BatchJobCoordinator implements BatchJobAssigner {

    private static final Logger log = LoggerFactory.getLogger(BatchJobCoordinator.class);

    private final DashboardApi api;
    private final CoordinatorConfig config;

    public BatchJobCoordinator(DashboardApi api) {
        this(api, new CoordinatorConfig());
    }

    /**
     * 생성자.
     *
     * @param api 대시보드 API
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchJobCoordinator(DashboardApi api, CoordinatorConfig config) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.api = api;
        this.config = config;
    }

    @Override
    public Assignment assign(AssignmentRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }

        Optional<ScoringJob> existing = api.findScoringJobByItemId(request.itemId());
        if (existing.isPresent()) {
            return reuse(existing.get());
        }

        BatchJob batchJob = findOrCreateBatchJob(request);

        ScoringJob scoringJob = api.createScoringJob(new NewScoringJob(
            request.itemId(),
            request.accountId(),
            request.scorecardId(),
            request.scoreId(),
            batchJob.id(),
            ScoringJobStatus.PENDING,
            request.evaluationId(),
            request.parameters(),
            request.metadata()
        ));
        api.createLink(batchJob.id(), scoringJob.id());

        BatchJob updated = recount(batchJob, request.maxBatchSize());
        log.info("Assigned scoring job {} for item {} to batch job {} ({} linked, {})",
            scoringJob.id(), request.itemId(), updated.id(), updated.scoringJobCountCache(), updated.status());

        return Assignment.created(scoringJob, updated);
    }

    private Assignment reuse(ScoringJob scoringJob) {
        log.info("Found existing scoring job {} for item {}", scoringJob.id(), scoringJob.itemId());

        Optional<BatchJobLink> link = api.findLinkForScoringJob(scoringJob.id());
        if (link.isEmpty()) {
            log.warn("Scoring job {} has no batch job link", scoringJob.id());
            return Assignment.reused(scoringJob, null);
        }
        return Assignment.reused(scoringJob, api.getBatchJob(link.get().batchJobId()));
    }

    private BatchJob findOrCreateBatchJob(AssignmentRequest request) {
        BatchScope scope = request.scope();

        for (BatchJob candidate : api.listOpenBatchJobs(scope)) {
            if (!matchesScope(candidate, scope)) {
                log.warn("Skipping batch job {} returned for scope {}: scope does not match", candidate.id(), scope);
                continue;
            }
            if (candidate.isOpen() && candidate.hasRoomFor(request.maxBatchSize())) {
                BatchJob selected = api.getBatchJob(candidate.id());
                log.debug("Reusing open batch job {} for scope {}", selected.id(), scope);
                return selected;
            }
        }

        BatchJob created = api.createBatchJob(
            NewBatchJob.open(scope, request.scoreId(), config.batchJobType(), request.parameters())
        );
        log.info("Created batch job {} for scope {}", created.id(), scope);
        return created;
    }

    /**
     * 링크 수를 재계산해 캐시에 기록하고, 상한에 도달하면 닫음.
     */
    private BatchJob recount(BatchJob batchJob, int maxBatchSize) {
        int count = api.countLinksForBatch(batchJob.id(), config.linkPageSize());

        if (count >= maxBatchSize && batchJob.isOpen()) {
            log.info("Closing batch job {}: {} linked (max {})", batchJob.id(), count, maxBatchSize);
            return api.updateBatchJob(batchJob.id(), BatchJobUpdate.close(count));
        }
        return api.updateBatchJob(batchJob.id(), BatchJobUpdate.countCache(count));
    }

    private static boolean matchesScope(BatchJob job, BatchScope scope) {
        return Objects.equals(job.accountId(), scope.accountId())
            && Objects.equals(job.scorecardId(), scope.scorecardId())
            && Objects.equals(job.modelProvider(), scope.modelProvider())
            && Objects.equals(job.modelName(), scope.modelName());
    }
}
