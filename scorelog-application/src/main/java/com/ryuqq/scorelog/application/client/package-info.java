/**
 * Client facade.
 *
 * <p>{@link com.ryuqq.scorelog.application.client.DashboardClient} bundles the score logger,
 * the batch job assigner and the identifier resolver for the lifetime of one client, and fills
 * missing scope ids from a {@link com.ryuqq.scorelog.application.client.ClientContext}.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.application.client;
