/**
 * Scripted runners and cleanup hooks for orchestrator tests.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.testkit.fixture;
