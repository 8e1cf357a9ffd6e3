package com.ryuqq.scorelog.core.model;

import java.util.List;

/**
 * 페이지 단위 조회 결과.
 *
 * @param items 현재 페이지 항목
 * @param nextToken 다음 페이지 토큰 (마지막 페이지면 null)
 * @param <T> 항목 타입
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record Page<T>(List<T> items, String nextToken) {

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null);
    }

    public boolean hasNext() {
        return nextToken != null && !nextToken.isEmpty();
    }
}
