package eventrelay.stub;

import eventrelay.spi.MetricsExporter;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

public final class RecordingMetrics implements MetricsExporter {
  public final AtomicInteger recorded = new AtomicInteger();
  public final AtomicInteger success = new AtomicInteger();
  public final AtomicInteger retry = new AtomicInteger();
  public final AtomicInteger failed = new AtomicInteger();
  public final AtomicInteger webhookSuccess = new AtomicInteger();
  public final AtomicInteger webhookFailure = new AtomicInteger();
  public final AtomicLong oldestLagMs = new AtomicLong(-1);

  @Override
  public void incrementEventsRecorded() {
    recorded.incrementAndGet();
  }

  @Override
  public void incrementProcessSuccess() {
    success.incrementAndGet();
  }

  @Override
  public void incrementProcessRetry() {
    retry.incrementAndGet();
  }

  @Override
  public void incrementProcessFailed() {
    failed.incrementAndGet();
  }

  @Override
  public void incrementWebhookSuccess() {
    webhookSuccess.incrementAndGet();
  }

  @Override
  public void incrementWebhookFailure() {
    webhookFailure.incrementAndGet();
  }

  @Override
  public void recordOldestLagMs(long lagMs) {
    oldestLagMs.set(lagMs);
  }
}
