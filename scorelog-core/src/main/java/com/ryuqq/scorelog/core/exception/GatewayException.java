package com.ryuqq.scorelog.core.exception;

import com.ryuqq.scorelog.core.contract.Operation;

/**
 * Gateway 호출 실패의 공통 상위 예외.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public abstract class GatewayException extends RuntimeException {

    private final Operation operation;

    protected GatewayException(Operation operation, String message, Throwable cause) {
        super(message, cause);
        this.operation = operation;
    }

    /**
     * 실패한 연산.
     *
     * @return Operation (알 수 없으면 null)
     */
    public Operation getOperation() {
        return operation;
    }
}
