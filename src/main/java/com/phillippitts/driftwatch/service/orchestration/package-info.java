/**
 * Monitor lifecycle and control loop.
 *
 * <p>{@link com.phillippitts.driftwatch.service.orchestration.DefaultMonitorOrchestrator} runs
 * the loop as a Spring {@code SmartLifecycle}, tracking
 * {@link com.phillippitts.driftwatch.service.orchestration.MonitorState} through
 * {@link com.phillippitts.driftwatch.service.orchestration.MonitorStateMachine}, and feeds each
 * line to {@link com.phillippitts.driftwatch.service.orchestration.MonitorPipeline}.
 *
 * @since 1.0
 */
package com.phillippitts.driftwatch.service.orchestration;
