package com.ryuqq.scorelog.core.model;

import java.time.Duration;

/**
 * 배치 누적기(accumulator)의 키.
 *
 * <p>동일한 (batchSize, batchTimeout) 설정으로 제출된 LogItem은 같은 배치에 누적됩니다.
 * 원격에 저장되지 않는 설정값입니다.</p>
 *
 * <p><strong>기본값:</strong> batchSize=10, batchTimeout=1초</p>
 *
 * @param batchSize 배치 크기 (1 이상이어야 함)
 * @param batchTimeout 마지막 flush 이후 허용되는 최대 경과 시간 (양수여야 함)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record BatchKey(int batchSize, Duration batchTimeout) {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final Duration DEFAULT_BATCH_TIMEOUT = Duration.ofSeconds(1);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BatchKey {
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
        if (batchTimeout == null) {
            throw new IllegalArgumentException("batchTimeout cannot be null");
        }
        if (batchTimeout.isZero() || batchTimeout.isNegative()) {
            throw new IllegalArgumentException(
                "batchTimeout must be positive (current: " + batchTimeout + ")"
            );
        }
    }

    /**
     * 기본 설정 키 (batchSize=10, batchTimeout=1초).
     *
     * @return 기본 BatchKey
     */
    public static BatchKey defaults() {
        return new BatchKey(DEFAULT_BATCH_SIZE, DEFAULT_BATCH_TIMEOUT);
    }

    /**
     * 마지막 flush 이후 경과 시간이 timeout을 초과했는지 확인.
     *
     * @param elapsedNanos 마지막 flush 이후 경과 시간 (나노초)
     * @return 초과한 경우 true
     */
    public boolean isTimedOut(long elapsedNanos) {
        return elapsedNanos > batchTimeout.toNanos();
    }
}
