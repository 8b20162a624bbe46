/**
 * Spring configuration for the drift monitor.
 *
 * <p>{@link com.phillippitts.driftwatch.config.MonitorConfig} builds every monitor component
 * explicitly from the bound {@code drift.monitor.*} and {@code drift.detector.*} properties;
 * {@code MonitorConfigurationValidator} rejects unusable settings before any of them exist.
 *
 * @since 1.0
 */
package com.phillippitts.driftwatch.config;
