package com.ryuqq.scorelog.application.logger;

import com.ryuqq.scorelog.core.model.LogItem;

/**
 * 비동기 점수 결과 로거.
 *
 * <p>로깅은 스코어링 경로보다 부차적이므로, 구현체는 원격 호출 실패를 절대
 * 호출자에게 전파하지 않습니다 (fire-and-forget).</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #submit}: 큐 적재 이상으로 블로킹하지 않음, 원격 실패로 예외를 던지지 않음</li>
 *   <li>{@link #flush}: 백그라운드 처리를 멈추고 남은 항목을 동기적으로 저장. 멱등</li>
 *   <li>{@link #close}: {@link #flush}와 동일</li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public interface ScoreLogger extends AutoCloseable {

    /**
     * 점수 결과 제출.
     *
     * @param item 기록할 LogItem
     * @param options 제출 옵션
     * @throws IllegalArgumentException item 또는 options가 null인 경우
     */
    void submit(LogItem item, SubmitOptions options);

    /**
     * 기본 옵션으로 점수 결과 제출.
     *
     * @param item 기록할 LogItem
     */
    default void submit(LogItem item) {
        submit(item, SubmitOptions.defaults());
    }

    /**
     * 남은 항목을 모두 저장하고 백그라운드 처리를 종료.
     *
     * <p>두 번째 호출부터는 아무 작업도 하지 않습니다.</p>
     */
    void flush();

    /**
     * flush가 이미 수행되었는지 확인.
     *
     * @return flush 이후면 true
     */
    boolean isFlushed();

    @Override
    default void close() {
        flush();
    }
}
