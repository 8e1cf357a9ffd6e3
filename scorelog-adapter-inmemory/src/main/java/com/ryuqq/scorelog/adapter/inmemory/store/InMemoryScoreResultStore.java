package com.ryuqq.scorelog.adapter.inmemory.store;

import com.ryuqq.scorelog.core.model.LogItem;
import com.ryuqq.scorelog.core.model.PersistedRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory storage of persisted score results.
 *
 * <p>Records are kept in insertion order. A batch create appends all of its records under one
 * lock, so a reader never observes a partially written batch.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class InMemoryScoreResultStore {

    private final List<PersistedRecord> records = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Persists a single score result.
     *
     * @param item the item to persist
     * @return the persisted record
     * @throws IllegalArgumentException if item is null
     */
    public synchronized PersistedRecord create(LogItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        PersistedRecord record = new PersistedRecord("sr-" + sequence.incrementAndGet(), item);
        records.add(record);
        return record;
    }

    /**
     * Persists several score results atomically.
     *
     * @param items the items to persist (not empty)
     * @return the persisted records, in input order
     * @throws IllegalArgumentException if items is null or empty
     */
    public synchronized List<PersistedRecord> batchCreate(List<LogItem> items) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("items cannot be null or empty");
        }
        List<PersistedRecord> created = new ArrayList<>(items.size());
        for (LogItem item : items) {
            if (item == null) {
                throw new IllegalArgumentException("items cannot contain null");
            }
            created.add(new PersistedRecord("sr-" + sequence.incrementAndGet(), item));
        }
        records.addAll(created);
        return created;
    }

    /**
     * Returns a snapshot of every persisted record.
     */
    public synchronized List<PersistedRecord> findAll() {
        return List.copyOf(records);
    }

    /**
     * Counts records persisted for the given item.
     *
     * @param itemId the item id
     * @return number of records for the item
     */
    public synchronized long countByItemId(String itemId) {
        return records.stream()
            .filter(record -> record.item().itemId().equals(itemId))
            .count();
    }

    public synchronized int size() {
        return records.size();
    }

    public synchronized void clear() {
        records.clear();
    }
}
