package com.ryuqq.scorelog.core.exception;

import com.ryuqq.scorelog.core.contract.GatewayError;
import com.ryuqq.scorelog.core.contract.Operation;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Gateway 예외 계층 테스트.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
class ApplicationExceptionTest {

    @Test
    void 오류_메시지를_합쳐_예외_메시지로_사용() {
        ApplicationException exception = new ApplicationException(
            Operation.CREATE_BATCH_JOB,
            List.of(GatewayError.of("first"), new GatewayError("second", "Validation"))
        );

        assertThat(exception.getMessage()).isEqualTo("CREATE_BATCH_JOB failed: first; second");
        assertThat(exception.getErrors()).hasSize(2);
        assertThat(exception.getOperation()).isEqualTo(Operation.CREATE_BATCH_JOB);
    }

    @Test
    void 오류목록이_비어도_메시지_생성() {
        ApplicationException exception = new ApplicationException(Operation.GET_BATCH_JOB, null);

        assertThat(exception.getErrors()).isEmpty();
        assertThat(exception.getMessage()).contains("empty error payload");
    }

    @Test
    void 전송_예외는_원인을_보존() {
        IOException cause = new IOException("connection reset");

        TransportException exception = new TransportException(Operation.LIST_OPEN_BATCH_JOBS, "unreachable", cause);

        assertThat(exception).isInstanceOf(GatewayException.class);
        assertThat(exception.getCause()).isSameAs(cause);
        assertThat(exception.getOperation()).isEqualTo(Operation.LIST_OPEN_BATCH_JOBS);
    }
}
