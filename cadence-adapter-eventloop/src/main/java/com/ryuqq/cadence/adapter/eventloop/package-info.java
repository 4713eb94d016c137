/**
 * Dedicated-thread {@link com.ryuqq.cadence.core.loop.EventLoop} adapter.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.adapter.eventloop.SingleThreadEventLoop} - Real-time loop on one thread,
 *       accepts tasks from any thread</li>
 *   <li>{@link com.ryuqq.cadence.adapter.eventloop.EventLoopConfig} - Thread name, daemon flag, idle budget</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * <p>Callbacks always run on the loop thread, so the single-threaded primitives in
 * {@code cadence-core} and {@code cadence-async} can be driven without locks.</p>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.adapter.eventloop;
