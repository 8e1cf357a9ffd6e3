/**
 * In-memory {@link com.ryuqq.scorelog.core.spi.Gateway} implementation.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.adapter.inmemory.gateway;
