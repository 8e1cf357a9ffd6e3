package com.ryuqq.scorelog.core.model;

/**
 * 원격에 저장된 점수 결과.
 *
 * @param id 저장된 레코드 ID
 * @param item 저장된 원본 LogItem
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record PersistedRecord(String id, LogItem item) {

    public PersistedRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
    }
}
