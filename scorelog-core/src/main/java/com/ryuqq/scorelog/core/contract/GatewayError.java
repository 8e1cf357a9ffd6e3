package com.ryuqq.scorelog.core.contract;

/**
 * 구조적으로는 성공한 응답에 포함된 애플리케이션 레벨 오류.
 *
 * @param message 오류 메시지
 * @param errorType 오류 유형 (선택, null 가능)
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public record GatewayError(String message, String errorType) {

    public GatewayError {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static GatewayError of(String message) {
        return new GatewayError(message, null);
    }
}
