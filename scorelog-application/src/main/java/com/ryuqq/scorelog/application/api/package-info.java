/**
 * Typed dashboard API over the gateway SPI.
 *
 * <p>{@link com.ryuqq.scorelog.application.api.DashboardApi} turns every
 * {@link com.ryuqq.scorelog.core.spi.Gateway} call into a typed method and surfaces both
 * failure layers (transport and application errors) as exceptions.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.application.api;
