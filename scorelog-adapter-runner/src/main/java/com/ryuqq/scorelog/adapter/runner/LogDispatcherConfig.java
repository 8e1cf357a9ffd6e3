package com.ryuqq.scorelog.adapter.runner;

/**
 * BatchingLogDispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>pollIntervalMs: 큐 폴링 대기 시간, 이 시간 동안 입력이 없으면 모든 배치를 flush (기본 1000ms)</li>
 *   <li>shutdownTimeoutMs: flush 시 워커 및 즉시 저장 작업 종료 대기 시간 (기본 5000ms)</li>
 *   <li>errorBackoffMs: 워커 루프에서 예기치 못한 오류 후 대기 시간 (기본 1000ms)</li>
 *   <li>registerShutdownHook: JVM 종료 시 flush 호출 여부 (기본 true)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>테스트: pollIntervalMs 감소 (1000 → 50), registerShutdownHook=false</li>
 *   <li>느린 원격 API: shutdownTimeoutMs 증가</li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 * @param pollIntervalMs 큐 폴링 대기 시간 (밀리초, 양수여야 함)
 * @param shutdownTimeoutMs 종료 대기 시간 (밀리초, 양수여야 함)
 * @param errorBackoffMs 오류 후 대기 시간 (밀리초, 0 이상)
 * @param registerShutdownHook JVM 종료 훅 등록 여부
 */
public record LogDispatcherConfig(
    long pollIntervalMs,
    long shutdownTimeoutMs,
    long errorBackoffMs,
    boolean registerShutdownHook
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: pollIntervalMs=1000ms, shutdownTimeoutMs=5000ms, errorBackoffMs=1000ms,
     * registerShutdownHook=true</p>
     */
    public LogDispatcherConfig() {
        this(1000, 5000, 1000, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public LogDispatcherConfig {
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "pollIntervalMs must be positive (current: " + pollIntervalMs + ")"
            );
        }
        if (shutdownTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "shutdownTimeoutMs must be positive (current: " + shutdownTimeoutMs + ")"
            );
        }
        if (errorBackoffMs < 0) {
            throw new IllegalArgumentException(
                "errorBackoffMs cannot be negative (current: " + errorBackoffMs + ")"
            );
        }
    }

    /**
     * pollIntervalMs만 변경한 새 인스턴스 생성.
     */
    public LogDispatcherConfig withPollIntervalMs(long pollIntervalMs) {
        return new LogDispatcherConfig(pollIntervalMs, shutdownTimeoutMs, errorBackoffMs, registerShutdownHook);
    }

    /**
     * shutdownTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public LogDispatcherConfig withShutdownTimeoutMs(long shutdownTimeoutMs) {
        return new LogDispatcherConfig(pollIntervalMs, shutdownTimeoutMs, errorBackoffMs, registerShutdownHook);
    }

    /**
     * errorBackoffMs만 변경한 새 인스턴스 생성.
     */
    public LogDispatcherConfig withErrorBackoffMs(long errorBackoffMs) {
        return new LogDispatcherConfig(pollIntervalMs, shutdownTimeoutMs, errorBackoffMs, registerShutdownHook);
    }

    /**
     * registerShutdownHook만 변경한 새 인스턴스 생성.
     */
    public LogDispatcherConfig withRegisterShutdownHook(boolean registerShutdownHook) {
        return new LogDispatcherConfig(pollIntervalMs, shutdownTimeoutMs, errorBackoffMs, registerShutdownHook);
    }
}
