package com.ryuqq.scorelog.adapter.inmemory.gateway;

import com.ryuqq.scorelog.adapter.inmemory.directory.InMemoryIdentifierDirectory;
import com.ryuqq.scorelog.adapter.inmemory.store.InMemoryJobStore;
import com.ryuqq.scorelog.adapter.inmemory.store.InMemoryScoreResultStore;
import com.ryuqq.scorelog.core.contract.BatchJobLinkRequests;
import com.ryuqq.scorelog.core.contract.BatchJobRequests;
import com.ryuqq.scorelog.core.contract.GatewayError;
import com.ryuqq.scorelog.core.contract.GatewayRequest;
import com.ryuqq.scorelog.core.contract.GatewayRequestHandler;
import com.ryuqq.scorelog.core.contract.GatewayResponse;
import com.ryuqq.scorelog.core.contract.IdentifierRequests;
import com.ryuqq.scorelog.core.contract.Operation;
import com.ryuqq.scorelog.core.contract.ScoreResultRequests;
import com.ryuqq.scorelog.core.contract.ScoringJobRequests;
import com.ryuqq.scorelog.core.exception.TransportException;
import com.ryuqq.scorelog.core.model.BatchJob;
import com.ryuqq.scorelog.core.model.BatchJobLink;
import com.ryuqq.scorelog.core.model.Page;
import com.ryuqq.scorelog.core.model.PersistedRecord;
import com.ryuqq.scorelog.core.model.ScoringJob;
import com.ryuqq.scorelog.core.spi.Gateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of the {@link Gateway} SPI for testing and reference purposes.
 *
 * <p>Requests are dispatched through {@link GatewayRequestHandler} to the score result store,
 * the job store and the identifier directory. Store-level validation failures (missing entities, invalid status
 * transitions, malformed page tokens) are reported in the response {@code errors}, the way a
 * remote API reports application errors.</p>
 *
 * <p><strong>Test Support:</strong></p>
 * <ul>
 *   <li><strong>Failure injection:</strong> {@link #failNext(Operation, int, FailureMode)} makes the next calls
 *       of an operation throw {@link TransportException} or return an error response</li>
 *   <li><strong>Call counters:</strong> {@link #callCount(Operation)} counts every execute call, failed or not</li>
 *   <li><strong>Latency:</strong> {@link #setLatencyMs(long)} delays every call, for concurrency tests</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryGateway gateway = new InMemoryGateway();
 * gateway.failNext(Operation.BATCH_CREATE_SCORE_RESULTS, 1, FailureMode.TRANSPORT);
 *
 * DashboardApi api = new DashboardApi(gateway);
 * </pre>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class InMemoryGateway implements Gateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryGateway.class);

    /**
     * How an injected failure surfaces.
     */
    public enum FailureMode {
        /** execute throws {@link TransportException}. */
        TRANSPORT,
        /** execute returns a response carrying an error. */
        APPLICATION
    }

    private final InMemoryScoreResultStore scoreResults;
    private final InMemoryJobStore jobs;
    private final InMemoryIdentifierDirectory directory;

    private final Map<Operation, AtomicLong> callCounts = new ConcurrentHashMap<>();
    private final Map<Operation, InjectedFailure> injectedFailures = new ConcurrentHashMap<>();
    private final StoreHandler storeHandler = new StoreHandler();
    private volatile long latencyMs;

    /**
     * Creates a gateway over empty stores.
     */
    public InMemoryGateway() {
        this(new InMemoryScoreResultStore(), new InMemoryJobStore(), new InMemoryIdentifierDirectory());
    }

    /**
     * Creates a gateway over the given stores.
     *
     * @throws IllegalArgumentException if any store is null
     */
    public InMemoryGateway(
        InMemoryScoreResultStore scoreResults,
        InMemoryJobStore jobs,
        InMemoryIdentifierDirectory directory
    ) {
        if (scoreResults == null) {
            throw new IllegalArgumentException("scoreResults cannot be null");
        }
        if (jobs == null) {
            throw new IllegalArgumentException("jobs cannot be null");
        }
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        this.scoreResults = scoreResults;
        this.jobs = jobs;
        this.directory = directory;
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Counts the call before applying latency or injected failures</li>
     *   <li>Maps {@link IllegalArgumentException}, {@link IllegalStateException} and
     *       {@link NoSuchElementException} from the stores to an error response</li>
     * </ul>
     */
    @Override
    public <T> GatewayResponse<T> execute(GatewayRequest<T> request) {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        Operation operation = request.operation();
        callCounts.computeIfAbsent(operation, op -> new AtomicLong()).incrementAndGet();

        simulateLatency(operation);

        FailureMode failure = consumeInjectedFailure(operation);
        if (failure == FailureMode.TRANSPORT) {
            log.debug("Injected transport failure for {}", operation);
            throw new TransportException(operation, "Injected transport failure for " + operation);
        }
        if (failure == FailureMode.APPLICATION) {
            log.debug("Injected application error for {}", operation);
            return GatewayResponse.failed(List.of(new GatewayError("Injected error for " + operation, "Injected")));
        }

        try {
            return GatewayResponse.ok(request.accept(storeHandler));
        } catch (IllegalArgumentException | IllegalStateException | NoSuchElementException e) {
            log.debug("{} rejected: {}", operation, e.getMessage());
            return GatewayResponse.failed(List.of(new GatewayError(e.getMessage(), e.getClass().getSimpleName())));
        }
    }

    /**
     * Makes the next {@code times} calls of an operation fail.
     *
     * @param operation operation to fail
     * @param times number of calls to fail (positive)
     * @param mode how the failure surfaces
     * @throws IllegalArgumentException if parameters are invalid
     */
    public void failNext(Operation operation, int times, FailureMode mode) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (times <= 0) {
            throw new IllegalArgumentException("times must be positive (current: " + times + ")");
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode cannot be null");
        }
        injectedFailures.put(operation, new InjectedFailure(mode, times));
    }

    /**
     * Number of execute calls observed for an operation.
     */
    public long callCount(Operation operation) {
        AtomicLong count = callCounts.get(operation);
        return count == null ? 0 : count.get();
    }

    public void setLatencyMs(long latencyMs) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs cannot be negative (current: " + latencyMs + ")");
        }
        this.latencyMs = latencyMs;
    }

    public InMemoryScoreResultStore scoreResults() {
        return scoreResults;
    }

    public InMemoryJobStore jobs() {
        return jobs;
    }

    public InMemoryIdentifierDirectory directory() {
        return directory;
    }

    /**
     * Clears stores, counters and injected failures.
     */
    public void clear() {
        scoreResults.clear();
        jobs.clear();
        directory.clear();
        callCounts.clear();
        injectedFailures.clear();
        latencyMs = 0;
    }

    private FailureMode consumeInjectedFailure(Operation operation) {
        InjectedFailure failure = injectedFailures.get(operation);
        if (failure == null) {
            return null;
        }
        if (failure.remaining.getAndDecrement() > 0) {
            return failure.mode;
        }
        injectedFailures.remove(operation, failure);
        return null;
    }

    private void simulateLatency(Operation operation) {
        long delay = latencyMs;
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(operation, "Interrupted while simulating latency", e);
        }
    }

    /**
     * Routes each request type to the store that owns it.
     */
    private final class StoreHandler implements GatewayRequestHandler {

        @Override
        public PersistedRecord handle(ScoreResultRequests.Create request) {
            return scoreResults.create(request.item());
        }

        @Override
        public List<PersistedRecord> handle(ScoreResultRequests.BatchCreate request) {
            return scoreResults.batchCreate(request.items());
        }

        @Override
        public ScoringJob handle(ScoringJobRequests.Create request) {
            return jobs.createScoringJob(request.fields());
        }

        @Override
        public ScoringJob handle(ScoringJobRequests.Get request) {
            return jobs.getScoringJob(request.id());
        }

        @Override
        public Optional<ScoringJob> handle(ScoringJobRequests.FindByItemId request) {
            return jobs.findScoringJobByItemId(request.itemId());
        }

        @Override
        public ScoringJob handle(ScoringJobRequests.Update request) {
            return jobs.updateScoringJob(request.id(), request.update());
        }

        @Override
        public BatchJob handle(BatchJobRequests.Create request) {
            return jobs.createBatchJob(request.fields());
        }

        @Override
        public BatchJob handle(BatchJobRequests.Get request) {
            return jobs.getBatchJob(request.id());
        }

        @Override
        public BatchJob handle(BatchJobRequests.Update request) {
            return jobs.updateBatchJob(request.id(), request.update());
        }

        @Override
        public List<BatchJob> handle(BatchJobRequests.ListOpen request) {
            return jobs.listOpenBatchJobs(request.scope());
        }

        @Override
        public BatchJobLink handle(BatchJobLinkRequests.Create request) {
            return jobs.createLink(request.link());
        }

        @Override
        public Page<BatchJobLink> handle(BatchJobLinkRequests.ListByBatchJob request) {
            return jobs.listLinks(request.batchJobId(), request.limit(), request.nextToken());
        }

        @Override
        public Optional<BatchJobLink> handle(BatchJobLinkRequests.FindByScoringJob request) {
            return jobs.findLinkByScoringJob(request.scoringJobId());
        }

        @Override
        public Optional<String> handle(IdentifierRequests.Lookup request) {
            return directory.lookup(request.kind(), request.method(), request.identifier(), request.scopeId());
        }
    }

    private static final class InjectedFailure {

        private final FailureMode mode;
        private final AtomicInteger remaining;

        private InjectedFailure(FailureMode mode, int times) {
            this.mode = mode;
            this.remaining = new AtomicInteger(times);
        }
    }
}
