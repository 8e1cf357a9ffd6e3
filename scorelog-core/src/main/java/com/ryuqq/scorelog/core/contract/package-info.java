/**
 * Typed request/response contract of the remote mutation gateway.
 *
 * <p>Every remote call is a {@link com.ryuqq.scorelog.core.contract.GatewayRequest} record
 * carrying its variables as fields, so the gateway boundary can be tested with fixed
 * fixtures and no query string is ever built by interpolation.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.scorelog.core.contract.ScoreResultRequests} - single and bulk score result creation</li>
 *   <li>{@link com.ryuqq.scorelog.core.contract.ScoringJobRequests} - scoring job CRUD</li>
 *   <li>{@link com.ryuqq.scorelog.core.contract.BatchJobRequests} - batch job CRUD and open-batch listing</li>
 *   <li>{@link com.ryuqq.scorelog.core.contract.BatchJobLinkRequests} - link creation and paginated listing</li>
 *   <li>{@link com.ryuqq.scorelog.core.contract.IdentifierRequests} - identifier lookups</li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.core.contract;
