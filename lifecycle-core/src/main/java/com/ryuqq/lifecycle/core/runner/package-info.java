/**
 * Runner contract and decorators.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.runner.Runner} - {@code (CancellationSignal) -> Outcome}</li>
 *   <li>{@link com.ryuqq.lifecycle.core.runner.Runners} - invocation normalization, labels, error handlers, service adapter</li>
 *   <li>{@link com.ryuqq.lifecycle.core.runner.Service} - start/stop component adaptable into a runner</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.runner;
