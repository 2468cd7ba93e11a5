package eventrelay.micrometer;

import eventrelay.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code eventrelay.events.recorded} - events written to the outbox</li>
 *   <li>{@code eventrelay.process.success} - events that reached PUBLISHED</li>
 *   <li>{@code eventrelay.process.retry} - handler failures scheduled for retry</li>
 *   <li>{@code eventrelay.process.failed} - events moved to FAILED</li>
 *   <li>{@code eventrelay.webhook.delivery} tagged {@code outcome=success|failure}</li>
 * </ul>
 *
 * <h3>Timers and gauges</h3>
 * <ul>
 *   <li>{@code eventrelay.webhook.duration} - round-trip time of answered webhook POSTs</li>
 *   <li>{@code eventrelay.lag.oldest.ms} - age of the oldest event seen by the last poll</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter eventsRecorded;
  private final Counter processSuccess;
  private final Counter processRetry;
  private final Counter processFailed;
  private final Counter webhookSuccess;
  private final Counter webhookFailure;
  private final Timer webhookDuration;
  private final Gauge lagGauge;

  private final AtomicLong oldestLagMs = new AtomicLong();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "eventrelay"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "eventrelay");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "billing.eventrelay"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.eventsRecorded = Counter.builder(namePrefix + ".events.recorded")
        .description("Events written to the outbox")
        .register(registry);
    this.processSuccess = Counter.builder(namePrefix + ".process.success")
        .description("Events processed and marked PUBLISHED")
        .register(registry);
    this.processRetry = Counter.builder(namePrefix + ".process.retry")
        .description("Handler failures scheduled for retry")
        .register(registry);
    this.processFailed = Counter.builder(namePrefix + ".process.failed")
        .description("Events moved to FAILED")
        .register(registry);
    this.webhookSuccess = Counter.builder(namePrefix + ".webhook.delivery")
        .tag("outcome", "success")
        .description("Webhook delivery attempts")
        .register(registry);
    this.webhookFailure = Counter.builder(namePrefix + ".webhook.delivery")
        .tag("outcome", "failure")
        .description("Webhook delivery attempts")
        .register(registry);
    this.webhookDuration = Timer.builder(namePrefix + ".webhook.duration")
        .description("Round-trip time of webhook POSTs that produced a response")
        .register(registry);
    this.lagGauge = Gauge.builder(namePrefix + ".lag.oldest.ms", oldestLagMs, AtomicLong::get)
        .description("Age of the oldest event seen by the last poll")
        .register(registry);
  }

  @Override
  public void incrementEventsRecorded() {
    if (closed) return;
    eventsRecorded.increment();
  }

  @Override
  public void incrementProcessSuccess() {
    if (closed) return;
    processSuccess.increment();
  }

  @Override
  public void incrementProcessRetry() {
    if (closed) return;
    processRetry.increment();
  }

  @Override
  public void incrementProcessFailed() {
    if (closed) return;
    processFailed.increment();
  }

  @Override
  public void incrementWebhookSuccess() {
    if (closed) return;
    webhookSuccess.increment();
  }

  @Override
  public void incrementWebhookFailure() {
    if (closed) return;
    webhookFailure.increment();
  }

  @Override
  public void recordWebhookDurationMs(long durationMs) {
    if (closed) return;
    webhookDuration.record(Duration.ofMillis(durationMs));
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    if (closed) return;
    oldestLagMs.set(lagMs);
  }

  /**
   * Removes all meters registered by this exporter from the registry. Called by
   * {@link eventrelay.EventRelay#close()}.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(eventsRecorded, processSuccess, processRetry, processFailed,
        webhookSuccess, webhookFailure, webhookDuration, lagGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
