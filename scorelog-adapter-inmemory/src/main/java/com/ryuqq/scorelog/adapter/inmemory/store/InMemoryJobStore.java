package com.ryuqq.scorelog.adapter.inmemory.store;

import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.BatchJobStatus;
import com.ryuqq.scorelog.core.model.BatchJobUpdate;
import com.ryuqq.scorelog.core.model.BatchScope;
import com.ryuqq.scorelog.core.model.NewBatchJob;
import com.ryuqq.scorelog.core.model.NewScoringJob;
import com.ryuqq.scorelog.core.model.Page;
import com.ryuqq.scorelog.core.model.ScoringJob;
import com.ryuqq.scorelog.core.model.ScoringJobUpdate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory storage of scoring jobs, batch jobs and their links.
 *
 * <p>All operations are {@code synchronized}. Each call is atomic on its own, but nothing
 * spans two calls, which mirrors a remote API where find-or-create sequences can race.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>scoringJobs:</strong> LinkedHashMap&lt;String, ScoringJob&gt; - insertion ordered</li>
 *   <li><strong>batchJobs:</strong> LinkedHashMap&lt;String, BatchJob&gt; - insertion ordered, open jobs listed oldest first</li>
 *   <li><strong>links:</strong> ArrayList&lt;BatchJobLink&gt; - insertion ordered, paged by offset token</li>
 * </ul>
 *
 * <p>The store does not reject a second scoring job for an item. Enforcing one job per item is
 * the caller's responsibility, and {@link #countScoringJobsForItem(String)} lets tests verify it.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class InMemoryJobStore {

    private final Map<String, ScoringJob> scoringJobs = new LinkedHashMap<>();
    private final Map<String, BatchJob> batchJobs = new LinkedHashMap<>();
    private final List<BatchJobLink> links = new ArrayList<>();
    private final AtomicLong scoringJobSequence = new AtomicLong();
    private final AtomicLong batchJobSequence = new AtomicLong();

    // ============================================================
    // Scoring jobs
    // ============================================================

    public synchronized ScoringJob createScoringJob(NewScoringJob fields) {
        ScoringJob job = new ScoringJob(
            "sj-" + scoringJobSequence.incrementAndGet(),
            fields.itemId(),
            fields.accountId(),
            fields.scorecardId(),
            fields.scoreId(),
            fields.batchId(),
            fields.status(),
            fields.evaluationId(),
            fields.parameters(),
            fields.metadata()
        );
        scoringJobs.put(job.id(), job);
        return job;
    }

    /**
     * @throws NoSuchElementException if no scoring job has the given id
     */
    public synchronized ScoringJob getScoringJob(String id) {
        ScoringJob job = scoringJobs.get(id);
        if (job == null) {
            throw new NoSuchElementException("Scoring job not found: " + id);
        }
        return job;
    }

    /**
     * Finds the oldest scoring job for an item.
     */
    public synchronized Optional<ScoringJob> findScoringJobByItemId(String itemId) {
        return scoringJobs.values().stream()
            .filter(job -> job.itemId().equals(itemId))
            .findFirst();
    }

    public synchronized ScoringJob updateScoringJob(String id, ScoringJobUpdate update) {
        ScoringJob current = getScoringJob(id);
        ScoringJob updated = new ScoringJob(
            current.id(),
            current.itemId(),
            current.accountId(),
            current.scorecardId(),
            current.scoreId(),
            update.batchId() != null ? update.batchId() : current.batchId(),
            update.status() != null ? update.status() : current.status(),
            current.evaluationId(),
            current.parameters(),
            update.metadata() != null ? update.metadata() : current.metadata()
        );
        scoringJobs.put(id, updated);
        return updated;
    }

    public synchronized long countScoringJobsForItem(String itemId) {
        return scoringJobs.values().stream()
            .filter(job -> job.itemId().equals(itemId))
            .count();
    }

    public synchronized List<ScoringJob> findAllScoringJobs() {
        return List.copyOf(scoringJobs.values());
    }

    // ============================================================
    // Batch jobs
    // ============================================================

    public synchronized BatchJob createBatchJob(NewBatchJob fields) {
        BatchScope scope = fields.scope();
        BatchJob job = new BatchJob(
            "bj-" + batchJobSequence.incrementAndGet(),
            scope.accountId(),
            scope.scorecardId(),
            fields.scoreId(),
            fields.type(),
            scope.modelProvider(),
            scope.modelName(),
            fields.status(),
            null,
            fields.scoringJobCountCache(),
            fields.parameters()
        );
        batchJobs.put(job.id(), job);
        return job;
    }

    /**
     * @throws NoSuchElementException if no batch job has the given id
     */
    public synchronized BatchJob getBatchJob(String id) {
        BatchJob job = batchJobs.get(id);
        if (job == null) {
            throw new NoSuchElementException("Batch job not found: " + id);
        }
        return job;
    }

    /**
     * Applies a partial update to a batch job.
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Status changes go through {@link BatchJobStatus#validateTransition(BatchJobStatus)}</li>
     *   <li>A closed batch job can never be re-opened</li>
     * </ul>
     *
     * @throws NoSuchElementException if no batch job has the given id
     * @throws IllegalStateException if the status transition is invalid
     */
    public synchronized BatchJob updateBatchJob(String id, BatchJobUpdate update) {
        BatchJob current = getBatchJob(id);
        BatchJobStatus status = current.status();
        if (update.status() != null) {
            current.status().validateTransition(update.status());
            status = update.status();
        }
        BatchJob updated = new BatchJob(
            current.id(),
            current.accountId(),
            current.scorecardId(),
            current.scoreId(),
            current.type(),
            current.modelProvider(),
            current.modelName(),
            status,
            current.totalRequests(),
            update.scoringJobCountCache() != null ? update.scoringJobCountCache() : current.scoringJobCountCache(),
            current.parameters()
        );
        batchJobs.put(id, updated);
        return updated;
    }

    /**
     * Lists open batch jobs of the given scope, oldest first.
     */
    public synchronized List<BatchJob> listOpenBatchJobs(BatchScope scope) {
        return batchJobs.values().stream()
            .filter(BatchJob::isOpen)
            .filter(job -> scope.accountId().equals(job.accountId())
                && scope.scorecardId().equals(job.scorecardId())
                && scope.modelProvider().equals(job.modelProvider())
                && scope.modelName().equals(job.modelName()))
            .collect(Collectors.toList());
    }

    /**
     * Sets the downstream request total of a batch job.
     *
     * <p>Only the downstream processor writes this field remotely. Tests use it to exercise
     * first-fit selection.</p>
     */
    public synchronized void setTotalRequests(String batchJobId, Integer totalRequests) {
        BatchJob current = getBatchJob(batchJobId);
        batchJobs.put(batchJobId, new BatchJob(
            current.id(), current.accountId(), current.scorecardId(), current.scoreId(), current.type(),
            current.modelProvider(), current.modelName(), current.status(), totalRequests,
            current.scoringJobCountCache(), current.parameters()
        ));
    }

    /**
     * Inserts a batch job as-is, bypassing scope validation of the create path.
     */
    public synchronized void putBatchJob(BatchJob job) {
        batchJobs.put(job.id(), job);
    }

    public synchronized List<BatchJob> findAllBatchJobs() {
        return List.copyOf(batchJobs.values());
    }

    // ============================================================
    // Links
    // ============================================================

    /**
     * @throws NoSuchElementException if either side of the link does not exist
     */
    public synchronized BatchJobLink createLink(BatchJobLink link) {
        getBatchJob(link.batchJobId());
        getScoringJob(link.scoringJobId());
        links.add(link);
        return link;
    }

    /**
     * Lists the links of a batch job one page at a time.
     *
     * <p>The page token is the offset of the next link, encoded as a decimal string.</p>
     *
     * @throws IllegalArgumentException if the token is malformed
     */
    public synchronized Page<BatchJobLink> listLinks(String batchJobId, int limit, String nextToken) {
        List<BatchJobLink> forBatch = links.stream()
            .filter(link -> link.batchJobId().equals(batchJobId))
            .collect(Collectors.toList());

        int offset = parseToken(nextToken);
        int end = (int) Math.min(forBatch.size(), (long) offset + limit);
        List<BatchJobLink> items = offset >= forBatch.size() ? List.of() : forBatch.subList(offset, end);
        String token = end < forBatch.size() ? String.valueOf(end) : null;
        return new Page<>(items, token);
    }

    public synchronized Optional<BatchJobLink> findLinkByScoringJob(String scoringJobId) {
        return links.stream()
            .filter(link -> link.scoringJobId().equals(scoringJobId))
            .findFirst();
    }

    public synchronized long countLinksForScoringJob(String scoringJobId) {
        return links.stream()
            .filter(link -> link.scoringJobId().equals(scoringJobId))
            .count();
    }

    public synchronized long countLinksForBatchJob(String batchJobId) {
        return links.stream()
            .filter(link -> link.batchJobId().equals(batchJobId))
            .count();
    }

    public synchronized void clear() {
        scoringJobs.clear();
        batchJobs.clear();
        links.clear();
    }

    private static int parseToken(String token) {
        if (token == null || token.isEmpty()) {
            return 0;
        }
        try {
            int offset = Integer.parseInt(token);
            if (offset < 0) {
                throw new IllegalArgumentException("page token cannot be negative (current: " + token + ")");
            }
            return offset;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Malformed page token: " + token, e);
        }
    }
}
