/**
 * Cooperative cancellation package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.core.cancellation.CancellationToken} - Read-only cancellation signal
 *       ({@code NONE}, {@code CANCELLED}, source-owned mutable token)</li>
 * </ul>
 *
 * <h2>Control</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.core.cancellation.CancellationTokenSource} - Lazily allocates and flips a token, cascades from a parent</li>
 *   <li>{@link com.ryuqq.cadence.core.cancellation.CancellationError} - Distinguished cancellation failure</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.core.cancellation;
