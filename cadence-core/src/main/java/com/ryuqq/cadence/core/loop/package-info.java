/**
 * Cooperative event loop SPI.
 *
 * <p>All primitives in Cadence schedule timers, microtasks, frame ticks and idle callbacks
 * through {@link com.ryuqq.cadence.core.loop.EventLoop}. There is no parallelism: concurrency is
 * the interleaving of callbacks on one loop.</p>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.core.loop.ManualEventLoop} - Host-driven, virtual time (tests, custom frame loops)</li>
 *   <li>{@code com.ryuqq.cadence.adapter.eventloop.SingleThreadEventLoop} - Dedicated thread, real time</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.core.loop;
