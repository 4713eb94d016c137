/**
 * Retry with exponential backoff.
 *
 * <ul>
 *   <li>{@link com.ryuqq.cadence.async.retry.Retry} - Re-runs a failing task on the event loop</li>
 *   <li>{@link com.ryuqq.cadence.async.retry.RetryOptions} - retries / delay / multiplier configuration</li>
 *   <li>{@link com.ryuqq.cadence.async.retry.BackoffCalculator} - Delay computation with optional jitter</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.async.retry;
