/**
 * Cancellation primitives.
 *
 * <p>{@link com.ryuqq.lifecycle.core.signal.CancellationSource} owns a one-way, idempotent,
 * broadcast cancellation flag with an optional deadline; runners only ever see its read-only
 * {@link com.ryuqq.lifecycle.core.signal.CancellationSignal} view.</p>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li><strong>Monotonic:</strong> once cancelled, always cancelled</li>
 *   <li><strong>Broadcast:</strong> one cancel() wakes every waiter and runs each callback once</li>
 *   <li><strong>Hierarchical:</strong> parent cancellation cascades to children, never the reverse</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.lifecycle.core.signal;
