/**
 * Shutdown reason package.
 *
 * <p>Tagged values describing why an orchestration run left the RUNNING state:
 * {@link com.ryuqq.lifecycle.core.reason.ExternalSignal},
 * {@link com.ryuqq.lifecycle.core.reason.RunnerFailure} or
 * {@link com.ryuqq.lifecycle.core.reason.AllCompleted}.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.reason;
