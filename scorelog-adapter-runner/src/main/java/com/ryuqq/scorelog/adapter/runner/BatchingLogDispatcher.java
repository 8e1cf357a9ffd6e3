package com.ryuqq.scorelog.adapter.runner;

import com.ryuqq.scorelog.application.api.DashboardApi;
import com.ryuqq.scorelog.application.logger.ScoreLogger;
import com.ryuqq.scorelog.application.logger.SubmitOptions;
import com.ryuqq.scorelog.core.model.BatchKey;
import com.ryuqq.scorelog.core.model.LogItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 큐 기반 점수 결과 Dispatcher.
 *
 * <p>여러 스레드에서 제출된 점수 결과를 {@link BatchKey}별로 모아 한 번의 일괄 저장으로 flush합니다.
 * 원격 호출 실패는 로그만 남기고 버리며, 호출자에게 전파하지 않습니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>공유 큐: 생산자는 큐에만 접근 (LinkedBlockingQueue)</li>
 *   <li>워커 스레드 1개 (daemon): 배치 맵의 유일한 소유자</li>
 *   <li>즉시 저장 Executor (daemon): immediate 제출을 단건 저장으로 처리</li>
 * </ul>
 *
 * <p><strong>워커 루프:</strong></p>
 * <pre>
 * poll(pollIntervalMs)
 *   ├─ 입력 없음 → 비어 있지 않은 배치를 모두 flush
 *   └─ 입력 있음 → 해당 BatchKey 배치에 추가
 *                   → 각 배치: size ≥ batchSize 또는 마지막 flush 이후 경과 &gt; batchTimeout 이면 flush
 * 종료 신호 → 보유한 배치를 모두 flush 후 종료
 * </pre>
 *
 * <p><strong>flush():</strong> 종료 신호 → 큐 잔여 항목을 한 번에 저장 → 워커를 깨움 → 워커 및 즉시 저장 작업 대기
 * (최대 shutdownTimeoutMs). 두 번째 호출부터는 아무 작업도 하지 않습니다.</p>
 *
 * <p>각 항목은 flush()가 큐에서 꺼내거나 워커가 꺼내거나 둘 중 한쪽에서만 소비되므로
 * 정상 종료 시 정확히 한 번 저장이 시도됩니다. 제출의 종료 확인과 큐 적재는 읽기 잠금, flush()의 종료 전환은
 * 쓰기 잠금 아래에서 수행되므로 종료 전환 이후에는 어떤 항목도 큐에 들어가지 않습니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class BatchingLogDispatcher implements ScoreLogger {

    private static final Logger log = LoggerFactory.getLogger(BatchingLogDispatcher.class);

    private static final AtomicInteger INSTANCE_SEQUENCE = new AtomicInteger();

    /**
     * 워커를 깨워 종료시키는 표식. 저장 대상이 아닙니다.
     */
    private static final PendingLog STOP = new PendingLog(null, null);

    private final DashboardApi api;
    private final LogDispatcherConfig config;
    private final BlockingQueue<PendingLog> queue;
    private final AtomicBoolean stopped;
    private final ReadWriteLock stopLock;
    private final ExecutorService immediateExecutor;
    private final Thread worker;
    private final Thread shutdownHook;

    /**
     * 생성자 (기본 설정 사용).
     *
     * @param api 대시보드 API
     * @throws IllegalArgumentException api가 null인 경우
     */
    public BatchingLogDispatcher(DashboardApi api) {
        this(api, new LogDispatcherConfig());
    }

    /**
     * 생성자. 워커 스레드를 바로 시작합니다.
     *
     * @param api 대시보드 API
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BatchingLogDispatcher(DashboardApi api, LogDispatcherConfig config) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.api = api;
        this.config = config;
        this.queue = new LinkedBlockingQueue<>();
        this.stopped = new AtomicBoolean(false);
        this.stopLock = new ReentrantReadWriteLock();

        int instance = INSTANCE_SEQUENCE.incrementAndGet();
        AtomicInteger immediateSequence = new AtomicInteger();
        this.immediateExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable,
                "scorelog-immediate-" + instance + "-" + immediateSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        this.worker = new Thread(this::runWorker, "scorelog-dispatcher-" + instance);
        this.worker.setDaemon(true);

        if (config.registerShutdownHook()) {
            this.shutdownHook = new Thread(this::flush, "scorelog-dispatcher-shutdown-" + instance);
            Runtime.getRuntime().addShutdownHook(shutdownHook);
        } else {
            this.shutdownHook = null;
        }

        this.worker.start();
    }

    /**
     * {@inheritDoc}
     *
     * <p>flush 이후의 제출은 WARN 로그를 남기고 버립니다.</p>
     */
    @Override
    public void submit(LogItem item, SubmitOptions options) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        // 종료 확인과 적재는 flush()의 종료 전환과 배타적
        stopLock.readLock().lock();
        try {
            if (stopped.get()) {
                log.warn("Dropping score for item {} submitted after flush", item.itemId());
                return;
            }

            if (options.immediate()) {
                submitImmediate(item);
            } else {
                queue.offer(new PendingLog(item, options.batchKey()));
            }
        } finally {
            stopLock.readLock().unlock();
        }
    }

    @Override
    public void flush() {
        stopLock.writeLock().lock();
        try {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
        } finally {
            stopLock.writeLock().unlock();
        }

        List<PendingLog> remaining = new ArrayList<>();
        queue.drainTo(remaining);
        if (!remaining.isEmpty()) {
            List<LogItem> items = new ArrayList<>(remaining.size());
            for (PendingLog pending : remaining) {
                items.add(pending.item());
            }
            flushItems(items);
        }
        queue.offer(STOP);

        try {
            worker.join(config.shutdownTimeoutMs());
            if (worker.isAlive()) {
                log.warn("Score log worker did not stop within {}ms", config.shutdownTimeoutMs());
            }

            immediateExecutor.shutdown();
            if (!immediateExecutor.awaitTermination(config.shutdownTimeoutMs(), TimeUnit.MILLISECONDS)) {
                log.warn("Immediate score log tasks did not finish within {}ms", config.shutdownTimeoutMs());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for score log tasks to finish");
        }

        removeShutdownHook();
    }

    @Override
    public boolean isFlushed() {
        return stopped.get();
    }

    /**
     * 아직 워커가 꺼내지 않은 제출 수.
     *
     * @return 큐에 남은 항목 수
     */
    public int pendingCount() {
        return queue.size();
    }

    private void submitImmediate(LogItem item) {
        try {
            immediateExecutor.execute(() -> createSingle(item));
        } catch (RejectedExecutionException e) {
            log.warn("Dropping immediate score for item {}: dispatcher is shutting down", item.itemId());
        }
    }

    private void createSingle(LogItem item) {
        try {
            api.createScoreResult(item);
        } catch (RuntimeException e) {
            log.error("Failed to log score for item {}", item.itemId(), e);
        }
    }

    /**
     * 워커 루프. 배치 맵은 이 스레드만 접근합니다.
     */
    private void runWorker() {
        Map<BatchKey, List<LogItem>> batches = new LinkedHashMap<>();
        long lastFlushNanos = System.nanoTime();

        while (!stopped.get()) {
            try {
                PendingLog pending = queue.poll(config.pollIntervalMs(), TimeUnit.MILLISECONDS);

                if (pending == STOP) {
                    break;
                }
                if (pending == null) {
                    // idle: 크기와 타임아웃에 관계없이 모두 flush
                    flushAll(batches);
                    lastFlushNanos = System.nanoTime();
                    continue;
                }

                batches.computeIfAbsent(pending.key(), key -> new ArrayList<>()).add(pending.item());

                long now = System.nanoTime();
                long elapsedNanos = now - lastFlushNanos;
                boolean flushed = false;
                for (Map.Entry<BatchKey, List<LogItem>> entry : batches.entrySet()) {
                    BatchKey key = entry.getKey();
                    List<LogItem> items = entry.getValue();
                    if (items.isEmpty()) {
                        continue;
                    }
                    if (items.size() >= key.batchSize() || key.isTimedOut(elapsedNanos)) {
                        flushItems(new ArrayList<>(items));
                        items.clear();
                        flushed = true;
                    }
                }
                if (flushed) {
                    lastFlushNanos = now;
                }

            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Score log worker interrupted, stopping");
                break;
            } catch (RuntimeException e) {
                log.error("Unexpected error in score log worker", e);
                if (!backoff()) {
                    break;
                }
            }
        }

        // flush() 이후 도착한 항목까지 함께 저장
        List<PendingLog> late = new ArrayList<>();
        queue.drainTo(late);
        for (PendingLog pending : late) {
            if (pending != STOP) {
                batches.computeIfAbsent(pending.key(), key -> new ArrayList<>()).add(pending.item());
            }
        }
        flushAll(batches);
        log.debug("Score log worker stopped");
    }

    private void flushAll(Map<BatchKey, List<LogItem>> batches) {
        Iterator<List<LogItem>> iterator = batches.values().iterator();
        while (iterator.hasNext()) {
            List<LogItem> items = iterator.next();
            if (!items.isEmpty()) {
                flushItems(new ArrayList<>(items));
            }
            iterator.remove();
        }
    }

    /**
     * 한 번의 일괄 저장. 실패 시 로그를 남기고 배치를 버립니다.
     */
    private void flushItems(List<LogItem> items) {
        if (items.isEmpty()) {
            return;
        }
        try {
            api.batchCreateScoreResults(items);
            log.debug("Flushed {} score results", items.size());
        } catch (RuntimeException e) {
            log.error("Failed to flush {} score results, discarding batch", items.size(), e);
        }
    }

    /**
     * 오류 후 대기.
     *
     * @return 계속 실행해야 하면 true, 인터럽트되었으면 false
     */
    private boolean backoff() {
        if (config.errorBackoffMs() == 0) {
            return true;
        }
        try {
            Thread.sleep(config.errorBackoffMs());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void removeShutdownHook() {
        if (shutdownHook == null || Thread.currentThread() == shutdownHook) {
            return;
        }
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            log.debug("JVM shutdown in progress, shutdown hook left in place");
        }
    }

    /**
     * 큐에 적재된 제출 (항목 + 배치 키).
     */
    private record PendingLog(LogItem item, BatchKey key) {
    }
}
