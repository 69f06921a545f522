/**
 * Transition outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for transition results,
 * providing compile-time exhaustive handling.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.transferchain.core.outcome.Ok} - Valid request, carries the write-set to commit</li>
 *   <li>{@link com.ryuqq.transferchain.core.outcome.Fail} - Rejected request, carries a {@link com.ryuqq.transferchain.core.outcome.RejectionCode}</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Type Safety:</strong> Sealed interface ensures all cases are known at compile-time</li>
 *   <li><strong>No Retry Case:</strong> A rejection is final for the given state; retry policy belongs to the host</li>
 *   <li><strong>Separation:</strong> Infrastructure failures are exceptions, never outcomes</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Transfer Chain Team
 */
package com.ryuqq.transferchain.core.outcome;
