/**
 * Orchestrator state machine package.
 *
 * <h2>State Transition Rules</h2>
 * <pre>
 * IDLE → RUNNING (run invoked)
 * RUNNING → SHUTTING_DOWN (first shutdown trigger)
 * SHUTTING_DOWN → TERMINATED (drained or timed out, cleanup done)
 * </pre>
 *
 * <p>Invalid transitions throw {@link java.lang.IllegalStateException} immediately.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.statemachine;
