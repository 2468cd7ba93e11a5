package eventrelay.spi;

/**
 * Observability hook for exporting outbox and webhook counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of events written to the outbox.
   */
  void incrementEventsRecorded();

  /**
   * Increments the count of events whose handlers all completed (PUBLISHED).
   */
  void incrementProcessSuccess();

  /**
   * Increments the count of handler failures that were scheduled for retry.
   */
  void incrementProcessRetry();

  /**
   * Increments the count of events moved to FAILED.
   */
  void incrementProcessFailed();

  /**
   * Increments the count of successful webhook deliveries.
   */
  void incrementWebhookSuccess();

  /**
   * Increments the count of failed webhook deliveries (non-2xx, timeout or transport error).
   */
  void incrementWebhookFailure();

  /**
   * Records the round-trip time of a webhook POST that produced a response.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  default void recordWebhookDurationMs(long durationMs) {
  }

  /**
   * Records the age (in milliseconds) of the oldest event seen by the last poll.
   *
   * @param lagMs lag in milliseconds (always non-negative)
   */
  void recordOldestLagMs(long lagMs);

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementEventsRecorded() {
    }

    @Override
    public void incrementProcessSuccess() {
    }

    @Override
    public void incrementProcessRetry() {
    }

    @Override
    public void incrementProcessFailed() {
    }

    @Override
    public void incrementWebhookSuccess() {
    }

    @Override
    public void incrementWebhookFailure() {
    }

    @Override
    public void recordOldestLagMs(long lagMs) {
    }
  }
}
