/**
 * Service Provider Interfaces implemented by adapters.
 *
 * <ul>
 *   <li>{@link com.ryuqq.scorelog.core.spi.Gateway} - remote mutation gateway</li>
 * </ul>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.core.spi;
