package com.ryuqq.scorelog.core.contract;

import java.util.List;

/**
 * Gateway 응답.
 *
 * <p>전송 계층 실패는 예외로 전달되고, 애플리케이션 레벨 실패는 {@link #errors()}에 담깁니다.
 * fire-and-forget 경로가 아닌 호출자는 두 계층을 모두 확인해야 합니다.</p>
 *
 * @param data 응답 데이터 (오류 시 null 가능)
 * @param errors 애플리케이션 오류 목록 (없으면 빈 목록)
 * @param <T> data 타입
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record GatewayResponse<T>(T data, List<GatewayError> errors) {

    public GatewayResponse {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * 성공 응답 생성.
     *
     * @param data 응답 데이터
     * @return GatewayResponse
     */
    public static <T> GatewayResponse<T> ok(T data) {
        return new GatewayResponse<>(data, List.of());
    }

    /**
     * 오류 응답 생성.
     *
     * @param errors 오류 목록
     * @return GatewayResponse
     */
    public static <T> GatewayResponse<T> failed(List<GatewayError> errors) {
        if (errors == null || errors.isEmpty()) {
            throw new IllegalArgumentException("errors cannot be null or empty");
        }
        return new GatewayResponse<>(null, errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
