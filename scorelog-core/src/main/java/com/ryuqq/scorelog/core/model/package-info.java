/**
 * Domain model for score logging and batch job coordination.
 *
 * <h2>Log side</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scorelog.core.model.LogItem} - a single score result to persist</li>
 *   <li>{@link com.ryuqq.scorelog.core.model.BatchKey} - (batchSize, batchTimeout) accumulator key</li>
 *   <li>{@link com.ryuqq.scorelog.core.model.PersistedRecord} - a persisted score result</li>
 * </ul>
 *
 * <h2>Batch side</h2>
 * <ul>
 *   <li>{@link com.ryuqq.scorelog.core.model.ScoringJob} - at most one per item</li>
 *   <li>{@link com.ryuqq.scorelog.core.model.BatchJob} - bounded group of scoring jobs</li>
 *   <li>{@link com.ryuqq.scorelog.core.model.BatchScope} - compatibility tuple of a batch job</li>
 *   <li>{@link com.ryuqq.scorelog.core.model.BatchJobLink} - authoritative membership record</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> records with defensive copies of map fields</li>
 *   <li><strong>Validation:</strong> compact constructors reject invalid data early</li>
 *   <li><strong>Pure Java:</strong> no external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ScoreLog Team
 */
package com.ryuqq.scorelog.core.model;
