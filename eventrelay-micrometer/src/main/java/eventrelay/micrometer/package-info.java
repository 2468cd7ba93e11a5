/**
 * Micrometer integration: {@link eventrelay.micrometer.MicrometerMetricsExporter} publishes
 * outbox and webhook metrics to any {@link io.micrometer.core.instrument.MeterRegistry}.
 */
package eventrelay.micrometer;
