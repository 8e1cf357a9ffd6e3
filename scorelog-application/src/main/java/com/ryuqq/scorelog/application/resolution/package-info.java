/**
 * Identifier resolution contract.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.application.resolution;
