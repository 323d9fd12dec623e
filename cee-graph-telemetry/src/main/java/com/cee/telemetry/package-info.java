/**
 * Telemetry for validation and reconciliation counts.
 * <ul>
 *   <li>{@link com.cee.telemetry.TelemetrySink} - event name plus counts</li>
 *   <li>{@link com.cee.telemetry.NoOpTelemetrySink}, {@link com.cee.telemetry.LoggingTelemetrySink},
 *       {@link com.cee.telemetry.MicrometerTelemetrySink} - sinks selectable via {@code CEE_TELEMETRY_SINK}</li>
 *   <li>{@link com.cee.telemetry.TelemetryEmitter} - fail-safe facade; sink errors are logged and never rethrown</li>
 * </ul>
 */
package com.cee.telemetry;
