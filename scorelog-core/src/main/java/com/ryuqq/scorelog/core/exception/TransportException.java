package com.ryuqq.scorelog.core.exception;

import com.ryuqq.scorelog.core.contract.Operation;

/**
 * 전송 계층 실패 (네트워크, 인증 등).
 *
 * <p>fire-and-forget 경로가 아닌 호출자에게는 항상 전파됩니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class TransportException extends GatewayException {

    public TransportException(Operation operation, String message) {
        super(operation, message, null);
    }

    public TransportException(Operation operation, String message, Throwable cause) {
        super(operation, message, cause);
    }
}
