/**
 * Behavioural contract tests shared by every {@link com.ryuqq.lifecycle.application.orchestrator.Orchestrator}
 * implementation.
 *
 * @see com.ryuqq.lifecycle.testkit.contract.AbstractOrchestratorContractTest
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.testkit.contract;
