/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.driftwatch.exception.DriftWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.driftwatch.exception.InvalidConfigurationException} - Fatal
 *       startup fault, raised before the monitor loop exists</li>
 *   <li>{@link com.phillippitts.driftwatch.exception.LogSourceException} - I/O fault while
 *       reading the tailed log; reported and retried on the next poll, never fatal</li>
 * </ul>
 *
 * <p>Malformed input lines are not exceptions: the decoder returns them as values and the
 * monitor counts them as skipped.
 *
 * @since 1.0
 */
package com.phillippitts.driftwatch.exception;
