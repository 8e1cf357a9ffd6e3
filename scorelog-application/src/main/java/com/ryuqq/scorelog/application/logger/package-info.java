/**
 * Fire-and-forget score result logging contract.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.application.logger;
