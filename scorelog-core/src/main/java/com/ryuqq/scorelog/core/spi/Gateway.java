package com.ryuqq.scorelog.core.spi;

import com.ryuqq.scorelog.core.contract.GatewayRequest;
import com.ryuqq.scorelog.core.contract.GatewayResponse;

/**
 * Remote Mutation Gateway SPI.
 *
 * <p>This interface abstracts the remote store that persists score results, scoring jobs,
 * batch jobs and their links. The transport, its wire schema, retry/backoff and
 * authentication are the implementation's concern.</p>
 *
 * <p><strong>Failure Layers:</strong></p>
 * <ul>
 *   <li>Transport: connectivity or authentication failure, thrown as
 *       {@link com.ryuqq.scorelog.core.exception.TransportException}</li>
 *   <li>Application: a structurally successful response whose
 *       {@link GatewayResponse#errors()} is non-empty</li>
 * </ul>
 *
 * <p>Callers other than the fire-and-forget log path must check both layers.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: called concurrently by caller threads, the dispatcher worker
 *       and immediate-log tasks</li>
 *   <li>Bulk creation ({@code BATCH_CREATE_SCORE_RESULTS}) persists all items of one call atomically</li>
 *   <li>Link listing is paginated through {@code nextToken}</li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public interface Gateway {

    /**
     * Executes a typed request against the remote store.
     *
     * @param request the request (operation plus variables)
     * @param <T> the response data type
     * @return the parsed response, possibly carrying application errors
     * @throws IllegalArgumentException if request is null
     * @throws com.ryuqq.scorelog.core.exception.TransportException if the remote call fails at transport level
     */
    <T> GatewayResponse<T> execute(GatewayRequest<T> request);
}
