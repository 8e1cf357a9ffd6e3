/**
 * Batch job assignment contract.
 *
 * <p>Assigning an item creates at most one scoring job for it and links that job to an open
 * batch job of the same scope, closing the batch job once it reaches its maximum size.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.application.assignment;
