/**
 * Resource lifecycle package.
 *
 * <p>Every component that owns a timer, a subscription or a child resource exposes a single
 * idempotent teardown operation through {@link com.ryuqq.cadence.core.lifecycle.Disposable}.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.core.lifecycle.Disposable} - Teardown capability (AutoCloseable)</li>
 *   <li>{@link com.ryuqq.cadence.core.lifecycle.DisposableStore} - Collectively owned set, fault-isolated teardown</li>
 *   <li>{@link com.ryuqq.cadence.core.lifecycle.MutableDisposable} - Single slot, disposes the replaced value</li>
 *   <li>{@link com.ryuqq.cadence.core.lifecycle.AbstractDisposable} - Base class with {@code register}</li>
 *   <li>{@link com.ryuqq.cadence.core.lifecycle.DisposalException} - Aggregated teardown failures</li>
 * </ul>
 *
 * <h2>Error Policy</h2>
 * <ul>
 *   <li><strong>Bulk teardown:</strong> all members are disposed, failures are aggregated and logged, never rethrown</li>
 *   <li><strong>Single teardown:</strong> {@code deleteAndDispose} logs and rethrows</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.core.lifecycle;
