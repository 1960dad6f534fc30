/**
 * Service Provider Interface (SPI) package.
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.ShutdownSignalSource} - Producer of the external shutdown trigger</li>
 *   <li>{@link com.ryuqq.lifecycle.core.spi.CleanupHook} - Single post-shutdown callback</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter modules (lifecycle-adapter-runner for JVM signals, lifecycle-adapter-inmemory for
 * programmatic triggers) provide the signal sources; applications provide cleanup hooks.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.spi;
