package com.ryuqq.scorelog.adapter.runner;

/**
 * IdentifierResolutionCache 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>ttlMs: 해석 결과 유지 시간, 쓰기 시점 기준 (기본 3600000ms = 1시간)</li>
 *   <li>maximumSize: 최대 항목 수 (기본 10000)</li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 * @param ttlMs 유지 시간 (밀리초, 양수여야 함)
 * @param maximumSize 최대 항목 수 (양수여야 함)
 */
public record IdentifierCacheConfig(long ttlMs, long maximumSize) {

    /**
     * 기본 설정 생성자 (ttlMs=1시간, maximumSize=10000).
     */
    public IdentifierCacheConfig() {
        this(3_600_000L, 10_000L);
    }

    public IdentifierCacheConfig {
        if (ttlMs <= 0) {
            throw new IllegalArgumentException("ttlMs must be positive (current: " + ttlMs + ")");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive (current: " + maximumSize + ")");
        }
    }

    public IdentifierCacheConfig withTtlMs(long ttlMs) {
        return new IdentifierCacheConfig(ttlMs, maximumSize);
    }

    public IdentifierCacheConfig withMaximumSize(long maximumSize) {
        return new IdentifierCacheConfig(ttlMs, maximumSize);
    }
}
