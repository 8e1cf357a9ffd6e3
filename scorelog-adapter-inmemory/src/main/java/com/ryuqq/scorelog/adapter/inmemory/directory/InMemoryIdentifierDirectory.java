package com.ryuqq.scorelog.adapter.inmemory.directory;

import com.ryuqq.scorelog.core.model.IdentifierKind;
import com.ryuqq.scorelog.core.model.LookupMethod;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory directory of accounts, scorecards and scores.
 *
 * <p>Each entry carries a canonical id plus optional key, name and external id.
 * Scores are registered under a scorecard id and only match lookups with that scope.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * directory.register(IdentifierKind.SCORECARD, "sc-1", "quality", "Quality Scorecard", "ext-9", null);
 * directory.lookup(IdentifierKind.SCORECARD, LookupMethod.KEY, "quality", null); // Optional[sc-1]
 * </pre>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class InMemoryIdentifierDirectory {

    private final List<Entry> entries = new CopyOnWriteArrayList<>();

    /**
     * Registers an entity.
     *
     * @param kind entity kind
     * @param id canonical id
     * @param key key (optional)
     * @param name name (optional)
     * @param externalId external id (optional)
     * @param scopeId owning scope id, the scorecard id for scores (optional)
     * @throws IllegalArgumentException if kind or id is missing
     */
    public void register(IdentifierKind kind, String id, String key, String name, String externalId, String scopeId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        entries.add(new Entry(kind, id, key, name, externalId, scopeId));
    }

    /**
     * Looks up a canonical id with a single method.
     *
     * @param kind entity kind
     * @param method which attribute to match
     * @param identifier value to match
     * @param scopeId required scope for scoped kinds (ignored when null)
     * @return the canonical id, or empty when nothing matches
     */
    public Optional<String> lookup(IdentifierKind kind, LookupMethod method, String identifier, String scopeId) {
        return entries.stream()
            .filter(entry -> entry.kind == kind)
            .filter(entry -> scopeId == null || Objects.equals(scopeId, entry.scopeId))
            .filter(entry -> identifier.equals(entry.valueOf(method)))
            .map(entry -> entry.id)
            .findFirst();
    }

    public void clear() {
        entries.clear();
    }

    private static final class Entry {

        private final IdentifierKind kind;
        private final String id;
        private final String key;
        private final String name;
        private final String externalId;
        private final String scopeId;

        private Entry(IdentifierKind kind, String id, String key, String name, String externalId, String scopeId) {
            this.kind = kind;
            this.id = id;
            this.key = key;
            this.name = name;
            this.externalId = externalId;
            this.scopeId = scopeId;
        }

        private String valueOf(LookupMethod method) {
            switch (method) {
                case ID:
                    return id;
                case KEY:
                    return key;
                case NAME:
                    return name;
                case EXTERNAL_ID:
                    return externalId;
                default:
                    throw new IllegalArgumentException("Unsupported lookup method: " + method);
            }
        }
    }
}
