/**
 * Asynchronous coordination primitives driven by an {@link com.ryuqq.cadence.core.loop.EventLoop}.
 *
 * <h2>At-most-one execution</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.async.Throttler} - One active task, latest queued task replaces earlier ones</li>
 *   <li>{@link com.ryuqq.cadence.async.RateLimiter} - At most one call per interval, latest arguments win</li>
 * </ul>
 *
 * <h2>Ordering</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.async.Sequencer} - Single FIFO chain</li>
 *   <li>{@link com.ryuqq.cadence.async.SequencerByKey} - One FIFO chain per key</li>
 * </ul>
 *
 * <h2>Delayed execution</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.async.Delayer} - Shared result, restartable timer</li>
 *   <li>{@link com.ryuqq.cadence.async.SimpleDelayer} - Per-trigger result, earlier triggers cancelled</li>
 *   <li>{@link com.ryuqq.cadence.async.RunOnceScheduler} - Reschedulable one-shot runnable</li>
 *   <li>{@link com.ryuqq.cadence.async.IdleValue} - Value computed in idle time or on first read</li>
 *   <li>{@link com.ryuqq.cadence.async.Async} - timeout / nextFrame / nextIdle</li>
 * </ul>
 *
 * <h2>Failure Semantics</h2>
 * <p>Failures reach callers unwrapped: the future fails with the exact exception the task threw.
 * A task that throws synchronously behaves like one returning a failed future.</p>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.async;
