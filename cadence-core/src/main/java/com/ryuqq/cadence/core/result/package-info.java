/**
 * Value-based result package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.cadence.core.result.Result} - Sealed interface (permits Ok, Err)</li>
 *   <li>{@link com.ryuqq.cadence.core.result.Ok} - Success value</li>
 *   <li>{@link com.ryuqq.cadence.core.result.Err} - Error value</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Cadence Team
 */
package com.ryuqq.cadence.core.result;
