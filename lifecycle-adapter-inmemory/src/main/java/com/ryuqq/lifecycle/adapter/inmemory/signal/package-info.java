/**
 * In-memory shutdown signal source for embedding and tests.
 *
 * <p>{@link com.ryuqq.lifecycle.adapter.inmemory.signal.ManualShutdownSignalSource} replaces the
 * JVM shutdown hook when the shutdown request originates inside the process, such as an admin
 * endpoint or a test driving an orchestrator run.</p>
 *
 * @see com.ryuqq.lifecycle.core.spi.ShutdownSignalSource
 * @author Orchestrator Team
 * @since 1.0.0
 */
package com.ryuqq.lifecycle.adapter.inmemory.signal;
