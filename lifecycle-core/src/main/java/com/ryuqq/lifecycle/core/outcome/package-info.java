/**
 * Runner execution outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for runner results.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.outcome.Success} - Normal completion</li>
 *   <li>{@link com.ryuqq.lifecycle.core.outcome.Cancelled} - Cooperative exit after cancellation (non-fatal)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.outcome.Failure} - Unrecovered error (triggers shutdown)</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.outcome;
