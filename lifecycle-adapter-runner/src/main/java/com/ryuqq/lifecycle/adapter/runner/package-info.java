/**
 * Thread-based orchestrator adapter: {@link com.ryuqq.lifecycle.adapter.runner.ConcurrentOrchestrator},
 * its configuration, the JVM shutdown-hook signal source and the
 * {@link com.ryuqq.lifecycle.adapter.runner.LifecycleLauncher} process entry point.
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.adapter.runner;
