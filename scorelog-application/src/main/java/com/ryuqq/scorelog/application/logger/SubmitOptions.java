package com.ryuqq.scorelog.application.logger;

import com.ryuqq.scorelog.core.model.BatchKey;

import java.time.Duration;

/**
 * 점수 결과 제출 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>immediate: true면 큐를 거치지 않고 단건 저장 (기본 false)</li>
 *   <li>batchKey: 누적될 배치의 (batchSize, batchTimeout) (기본 10, 1초)</li>
 * </ul>
 *
 * @param immediate 즉시 저장 여부
 * @param batchKey 배치 설정 (null이 아니어야 함)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record SubmitOptions(boolean immediate, BatchKey batchKey) {

    public SubmitOptions {
        if (batchKey == null) {
            throw new IllegalArgumentException("batchKey cannot be null");
        }
    }

    /**
     * 기본 옵션 (batched, batchSize=10, batchTimeout=1초).
     */
    public static SubmitOptions defaults() {
        return new SubmitOptions(false, BatchKey.defaults());
    }

    /**
     * 즉시 저장 옵션.
     */
    public static SubmitOptions immediately() {
        return new SubmitOptions(true, BatchKey.defaults());
    }

    /**
     * 지정한 배치 설정으로 누적.
     *
     * @param batchSize 배치 크기
     * @param batchTimeout 배치 타임아웃
     * @return SubmitOptions
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public static SubmitOptions batched(int batchSize, Duration batchTimeout) {
        return new SubmitOptions(false, new BatchKey(batchSize, batchTimeout));
    }
}
