/**
 * Log ingestion: following a growing prediction file and waking the control loop.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.driftwatch.service.ingest.TailingLineSource} - byte-offset tailing
 *       with truncation, rotation and vanish handling</li>
 *   <li>{@link com.phillippitts.driftwatch.service.ingest.FileChangeWatcher} - best-effort OS
 *       notifications on a daemon thread</li>
 *   <li>{@link com.phillippitts.driftwatch.service.ingest.WakeSignal} - the single wait point of
 *       the control loop: file change, poll timeout or cancel</li>
 *   <li>{@link com.phillippitts.driftwatch.service.ingest.IngestionFaultEvent} - recoverable faults,
 *       published to Spring listeners</li>
 * </ul>
 *
 * <p>Threading: only the watcher runs on its own thread, and it touches nothing but the wake
 * signal. Everything else is confined to the monitor control thread.
 *
 * @since 1.0
 */
package com.phillippitts.driftwatch.service.ingest;
