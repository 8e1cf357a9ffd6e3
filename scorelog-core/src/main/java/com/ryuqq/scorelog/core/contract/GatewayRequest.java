package com.ryuqq.scorelog.core.contract;

/**
 * Gateway에 전달되는 타입 안전한 요청.
 *
 * <p>요청 변수는 record 필드로만 전달되며, 쿼리 문자열 조립은 Gateway 구현체의 책임입니다.
 * 호출자는 문자열 보간으로 쿼리를 만들지 않습니다.</p>
 *
 * @param <T> 응답 data 타입
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public interface GatewayRequest<T> {

    /**
     * 이 요청이 실행할 원격 연산.
     *
     * @return Operation
     */
    Operation operation();

    /**
     * 요청 타입에 맞는 처리기 메서드로 위임.
     *
     * @param handler 요청 처리기
     * @return 응답 data
     */
    T accept(GatewayRequestHandler handler);
}
