package com.ryuqq.scorelog.core.exception;

import com.ryuqq.scorelog.core.contract.GatewayError;
import com.ryuqq.scorelog.core.contract.Operation;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 응답은 도착했으나 errors 페이로드를 포함한 경우.
 *
 * <p>전송 실패와 동일하게 호출자에게 전파됩니다.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public class ApplicationException extends GatewayException {

    private final List<GatewayError> errors;

    public ApplicationException(Operation operation, List<GatewayError> errors) {
        super(operation, buildMessage(operation, errors), null);
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * 응답에 담긴 오류 목록.
     *
     * @return 오류 목록 (불변)
     */
    public List<GatewayError> getErrors() {
        return errors;
    }

    private static String buildMessage(Operation operation, List<GatewayError> errors) {
        if (errors == null || errors.isEmpty()) {
            return operation + " failed with an empty error payload";
        }
        return operation + " failed: " + errors.stream()
            .map(GatewayError::message)
            .collect(Collectors.joining("; "));
    }
}
