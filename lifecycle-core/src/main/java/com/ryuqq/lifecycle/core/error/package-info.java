/**
 * Lifecycle error taxonomy.
 *
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.error.RunnerFailureException} - a runner returned a non-cancellation error</li>
 *   <li>{@link com.ryuqq.lifecycle.core.error.ShutdownDeadlineExceededException} - the bounded drain elapsed (always fatal)</li>
 *   <li>{@link com.ryuqq.lifecycle.core.error.CleanupFailureException} - the cleanup hook failed</li>
 *   <li>{@link com.ryuqq.lifecycle.core.error.InitializationException} - the application could not be assembled</li>
 * </ul>
 *
 * <p>An external signal is a shutdown reason, not an error, and has no exception type.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.error;
