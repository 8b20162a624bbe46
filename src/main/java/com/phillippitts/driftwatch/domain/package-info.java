/**
 * Immutable value types flowing through the monitor.
 *
 * <p>{@link com.phillippitts.driftwatch.domain.Observation} is decoded from a log line,
 * {@link com.phillippitts.driftwatch.domain.Window} is a completed tumbling window, and
 * {@link com.phillippitts.driftwatch.domain.Alert},
 * {@link com.phillippitts.driftwatch.domain.StatusSnapshot} and
 * {@link com.phillippitts.driftwatch.domain.RunSummary} are the output events published to
 * Spring listeners. Which detector fired is carried by boolean fields, not subtypes.
 *
 * @since 1.0
 */
package com.phillippitts.driftwatch.domain;
