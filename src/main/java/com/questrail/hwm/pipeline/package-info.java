/**
 * Pipelines
 * =============================================================================
 *
 * <p>A pipeline is a fixed group of devices that is reserved as a unit and
 * drives at most one session at a time.</p>
 *
 * <pre>
 *   input device  ← writeToPipeline(data)        ← session user
 *   output device → writeOutput(data)            → session
 *   any device    → writeTelemetry(datum)        → session
 * </pre>
 *
 * <p>Pipelines are built once from configuration by
 * {@link com.questrail.hwm.pipeline.PipelineRegistry}; their membership never
 * changes afterwards. Reservation, session registration and service selection
 * are all-or-nothing: a failure leaves the pipeline exactly as it was.</p>
 */
package com.questrail.hwm.pipeline;
