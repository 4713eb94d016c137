/**
 * Log assertions for tests.
 *
 * <ul>
 *   <li>{@link com.ryuqq.cadence.testkit.log.LogCapture} - Logback ListAppender attached to one logger</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.testkit.log;
