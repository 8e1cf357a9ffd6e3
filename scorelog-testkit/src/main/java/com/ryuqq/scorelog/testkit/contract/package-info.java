/**
 * Contract test support.
 *
 * <p>{@link com.ryuqq.scorelog.testkit.contract.AbstractContractTest} wires the runner
 * components to the in-memory gateway so that contract tests can verify delivery, assignment and
 * identifier resolution end to end.</p>
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
package com.ryuqq.scorelog.testkit.contract;
