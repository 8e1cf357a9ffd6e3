/**
 * In-memory storage backing the reference gateway.
 *
 * <p>Thread-safe, insertion ordered, and lost on restart. Intended for tests and local use.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.adapter.inmemory.store;
