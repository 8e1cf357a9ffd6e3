package com.ryuqq.scorelog.adapter.runner;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.ryuqq.scorelog.application.api.DashboardApi;
import com.ryuqq.scorelog.application.resolution.IdentifierResolver;
import com.ryuqq.scorelog.core.model.IdentifierKind;
import com.ryuqq.scorelog.core.model.LookupMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Caffeine 기반 식별자 해석 캐시.
 *
 * <p>ID, KEY, NAME, EXTERNAL_ID 순서로 조회하고 첫 번째 결과를 원래 식별자 기준으로 캐시합니다.
 * 해석 실패(null)는 캐시하지 않으므로 나중에 생성된 엔티티도 다음 호출에서 찾을 수 있습니다.</p>
 *
 * <p>조회 중 발생한 원격 오류는 WARN 로그 후 다음 방법으로 넘어가며, 예외를 던지지 않습니다.</p>
 *
 * <p><strong>캐시 정책:</strong> expireAfterWrite(ttlMs), maximumSize</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class IdentifierResolutionCache implements IdentifierResolver {

    private static final Logger log = LoggerFactory.getLogger(IdentifierResolutionCache.class);

    private final DashboardApi api;
    private final Cache<CacheKey, String> cache;

    public IdentifierResolutionCache(DashboardApi api) {
        this(api, new IdentifierCacheConfig());
    }

    public IdentifierResolutionCache(DashboardApi api, IdentifierCacheConfig config) {
        this(api, config, Ticker.systemTicker());
    }

    /**
     * 생성자 (커스텀 Ticker 주입).
     *
     * @param api 대시보드 API
     * @param config 설정
     * @param ticker 만료 계산용 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public IdentifierResolutionCache(DashboardApi api, IdentifierCacheConfig config, Ticker ticker) {
        if (api == null) {
            throw new IllegalArgumentException("api cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (ticker == null) {
            throw new IllegalArgumentException("ticker cannot be null");
        }
        this.api = api;
        this.cache = Caffeine.newBuilder()
            .maximumSize(config.maximumSize())
            .expireAfterWrite(Duration.ofMillis(config.ttlMs()))
            .ticker(ticker)
            .build();
    }

    @Override
    public String resolve(IdentifierKind kind, String identifier, String scopeId) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (identifier == null || identifier.isBlank()) {
            return null;
        }

        CacheKey key = new CacheKey(kind, identifier, scopeId);
        String cached = cache.getIfPresent(key);
        if (cached != null) {
            return cached;
        }

        for (LookupMethod method : LookupMethod.values()) {
            Optional<String> resolved = lookup(kind, method, identifier, scopeId);
            if (resolved.isPresent()) {
                cache.put(key, resolved.get());
                log.debug("Resolved {} '{}' by {} to {}", kind, identifier, method, resolved.get());
                return resolved.get();
            }
        }

        log.debug("Could not resolve {} '{}'", kind, identifier);
        return null;
    }

    /**
     * 캐시된 해석 결과 제거 (범위 없음).
     */
    public void invalidate(IdentifierKind kind, String identifier) {
        invalidate(kind, identifier, null);
    }

    public void invalidate(IdentifierKind kind, String identifier, String scopeId) {
        cache.invalidate(new CacheKey(kind, identifier, scopeId));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    /**
     * 캐시된 항목 수 (근사값).
     */
    public long estimatedSize() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    private Optional<String> lookup(IdentifierKind kind, LookupMethod method, String identifier, String scopeId) {
        try {
            return api.lookupIdentifier(kind, method, identifier, scopeId);
        } catch (RuntimeException e) {
            log.warn("Lookup of {} '{}' by {} failed: {}", kind, identifier, method, e.getMessage());
            return Optional.empty();
        }
    }

    private record CacheKey(IdentifierKind kind, String identifier, String scopeId) {
    }
}
