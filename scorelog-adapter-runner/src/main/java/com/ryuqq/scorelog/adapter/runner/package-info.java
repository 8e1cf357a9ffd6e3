/**
 * Runner Adapter Layer - ScoreLog 구현체.
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scorelog.adapter.runner.BatchingLogDispatcher} - 큐 + 워커 기반 점수 결과 Dispatcher</li>
 *   <li>{@link com.ryuqq.scorelog.adapter.runner.BatchJobCoordinator} - find-or-create BatchJob 배정</li>
 *   <li>{@link com.ryuqq.scorelog.adapter.runner.IdentifierResolutionCache} - Caffeine 기반 식별자 캐시</li>
 *   <li>{@link com.ryuqq.scorelog.adapter.runner.DashboardClientFactory} - 클라이언트 조립</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BatchingLogDispatcher, BatchJobCoordinator, IdentifierResolutionCache)
 *   ↓ implements
 * application (ScoreLogger, BatchJobAssigner, IdentifierResolver, DashboardApi)
 *   ↓ depends on
 * core (LogItem, BatchJob, ScoringJob, Gateway SPI)
 * </pre>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.adapter.runner;
