/**
 * Typed publish/subscribe package.
 *
 * <h2>Primitives</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.core.event.Event} - Subscription function</li>
 *   <li>{@link com.ryuqq.cadence.core.event.Emitter} - Owns listeners, fires from a snapshot, isolates listener failures</li>
 *   <li>{@link com.ryuqq.cadence.core.event.Events} - Combinators (once, map, filter, any, reduce, debounce, buffer, ...)</li>
 * </ul>
 *
 * <h2>Containers</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.core.event.EventBuffer} - Batches items pushed in one tick</li>
 *   <li>{@link com.ryuqq.cadence.core.event.EventCoalescer} - Batches items over a quiet window</li>
 *   <li>{@link com.ryuqq.cadence.core.event.Relay} - Stable output with a swappable input</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.core.event;
