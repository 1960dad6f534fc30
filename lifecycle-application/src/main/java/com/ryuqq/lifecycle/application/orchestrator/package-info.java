/**
 * Orchestrator port.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.application.orchestrator.Orchestrator} - blocking run of a bound runner set</li>
 *   <li>{@link com.ryuqq.lifecycle.application.orchestrator.RunResult} - aggregated, immutable outcome of a run</li>
 *   <li>{@link com.ryuqq.lifecycle.application.orchestrator.TerminationCause} /
 *       {@link com.ryuqq.lifecycle.application.orchestrator.TerminationCategory} - operator-facing classification</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 * <pre>
 * adapter-runner (ConcurrentOrchestrator)
 *   ↓ implements
 * application (Orchestrator interface)
 *   ↓ depends on
 * core (Runner, Outcome, CancellationSignal, ShutdownReason)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.application.orchestrator;
