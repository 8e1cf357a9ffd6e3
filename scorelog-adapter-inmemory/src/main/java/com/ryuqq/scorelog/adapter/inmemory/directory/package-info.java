/**
 * In-memory identifier directory for lookup requests.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.adapter.inmemory.directory;
