/**
 * Reusable contract tests.
 *
 * <h2>Event Loop</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.testkit.contract.AbstractEventLoopContractTest} - Ordering, cancellation and idle
 *       rules every {@link com.ryuqq.cadence.core.loop.EventLoop} must honor</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.testkit.contract;
