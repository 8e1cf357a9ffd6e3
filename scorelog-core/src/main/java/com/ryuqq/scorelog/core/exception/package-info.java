/**
 * Gateway failure taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.scorelog.core.exception.TransportException} - connectivity or auth failure</li>
 *   <li>{@link com.ryuqq.scorelog.core.exception.ApplicationException} - response carrying an errors payload</li>
 * </ul>
 *
 * <p>Both are unchecked. Inside the log dispatcher they are caught, logged and discarded;
 * everywhere else they propagate.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.core.exception;
