package eventrelay.webhook;

import eventrelay.model.AttemptSummary;
import eventrelay.model.DeliveryResult;
import eventrelay.model.OutboxRecord;
import eventrelay.model.WebhookEndpoint;
import eventrelay.spi.ConnectionProvider;
import eventrelay.spi.OutboxStore;
import eventrelay.spi.WebhookDeliveryStore;
import eventrelay.spi.WebhookEndpointStore;
import eventrelay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fans PUBLISHED outbox records out to the webhook endpoints subscribed to them.
 *
 * <p>Each {@link #runOnce()} selects up to {@code batchSize} records whose fan-out has not
 * completed, oldest first, and all active endpoints. For every record the matching endpoints
 * (subscribed type, and a global or same-tenant scope) are delivered to concurrently; all HTTP
 * calls of the batch share one counting semaphore, so at most {@code maxConcurrentDeliveries}
 * are ever in flight. The worker waits for a record's deliveries, pauses for
 * {@code eventThrottle}, then moves to the next record.
 *
 * <p>An (event, endpoint) pair is settled once it has a successful delivery or has failed more
 * than {@link WebhookEndpoint#maxRetries()} times. Failed pairs are retried on later runs after
 * {@code retryDelay * failures}. When every matching endpoint is settled the record is marked
 * delivered and leaves the selection window. Otherwise the record's next delivery time is set to
 * the earliest of those retries, and the record is not selected again before then, so records
 * backing off against an unreachable endpoint do not hold back newer ones.
 *
 * <p>Only one worker instance may run against a database: selection does not lock rows.
 *
 * @see WebhookSender
 */
public final class WebhookDeliveryWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WebhookDeliveryWorker.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;
  private final WebhookEndpointStore endpointStore;
  private final WebhookDeliveryStore deliveryStore;
  private final WebhookSender sender;
  private final int maxConcurrentDeliveries;
  private final int batchSize;
  private final Duration eventThrottle;
  private final Duration retryDelay;
  private final long intervalMs;

  private final Semaphore permits;
  private final ExecutorService deliveryPool;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> task;
  private volatile boolean closed;

  private WebhookDeliveryWorker(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    this.endpointStore = Objects.requireNonNull(builder.endpointStore, "endpointStore");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.sender = Objects.requireNonNull(builder.sender, "sender");

    if (builder.maxConcurrentDeliveries <= 0) {
      throw new IllegalArgumentException("maxConcurrentDeliveries must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.eventThrottle.isNegative()) {
      throw new IllegalArgumentException("eventThrottle must be >= 0");
    }
    if (builder.retryDelay.isNegative()) {
      throw new IllegalArgumentException("retryDelay must be >= 0");
    }

    this.maxConcurrentDeliveries = builder.maxConcurrentDeliveries;
    this.batchSize = builder.batchSize;
    this.eventThrottle = builder.eventThrottle;
    this.retryDelay = builder.retryDelay;
    this.intervalMs = builder.intervalMs;
    this.permits = new Semaphore(maxConcurrentDeliveries);
    this.deliveryPool = Executors.newCachedThreadPool(new DaemonThreadFactory("eventrelay-webhook-"));
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled delivery loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("WebhookDeliveryWorker has been closed");
    }
    if (task != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("eventrelay-webhook-worker-"));
    task = scheduler.scheduleWithFixedDelay(this::runOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Runs one delivery batch and blocks until it completes.
   *
   * @return the number of events for which at least one delivery was attempted
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    try {
      List<OutboxRecord> events;
      List<WebhookEndpoint> endpoints;
      try (Connection conn = connectionProvider.getConnection()) {
        conn.setAutoCommit(true);
        events = outboxStore.listUndelivered(conn, Instant.now(), batchSize);
        if (events.isEmpty()) {
          return 0;
        }
        endpoints = endpointStore.findActive(conn);
      }
      if (endpoints.isEmpty()) {
        logger.info("No active webhook endpoints configured");
        return 0;
      }

      int processed = 0;
      for (int i = 0; i < events.size() && !closed; i++) {
        OutboxRecord event = events.get(i);
        if (deliverEvent(event, matching(endpoints, event))) {
          processed++;
        }
        if (i < events.size() - 1 && !eventThrottle.isZero()) {
          Thread.sleep(eventThrottle.toMillis());
        }
      }
      logger.log(Level.INFO, "Processed {0} events for webhook delivery", processed);
      return processed;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return 0;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Error processing webhook events", t);
      return 0;
    }
  }

  static List<WebhookEndpoint> matching(List<WebhookEndpoint> endpoints, OutboxRecord event) {
    List<WebhookEndpoint> matching = new ArrayList<>();
    for (WebhookEndpoint endpoint : endpoints) {
      if (endpoint.matches(event.eventType(), event.tenantId())) {
        matching.add(endpoint);
      }
    }
    return matching;
  }

  private boolean deliverEvent(OutboxRecord event, List<WebhookEndpoint> matching)
      throws SQLException, InterruptedException {
    Map<Long, AttemptSummary> history;
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      history = new HashMap<>(deliveryStore.summarizeAttempts(conn, event.eventId()));
    }

    Instant now = Instant.now();
    List<WebhookEndpoint> due = new ArrayList<>();
    for (WebhookEndpoint endpoint : matching) {
      AttemptSummary summary = history.get(endpoint.id());
      if (summary == null) {
        due.add(endpoint);
      } else if (!settled(summary, endpoint) && !now.isBefore(retryAt(summary))) {
        due.add(endpoint);
      }
    }

    if (!due.isEmpty()) {
      Map<Long, DeliveryResult> results = fanOut(event, due);
      Instant attemptedAt = Instant.now();
      results.forEach((endpointId, result) -> {
        AttemptSummary previous = history.get(endpointId);
        int failures = (previous == null ? 0 : previous.failures()) + (result.success() ? 0 : 1);
        boolean succeeded = (previous != null && previous.succeeded()) || result.success();
        history.put(endpointId, new AttemptSummary(endpointId, failures, succeeded, attemptedAt));
      });
    }

    // Earliest retry among unsettled endpoints; null once an endpoint has no attempt at all.
    boolean allSettled = true;
    Instant nextDeliveryAt = null;
    boolean dueNow = false;
    for (WebhookEndpoint endpoint : matching) {
      AttemptSummary summary = history.get(endpoint.id());
      if (summary != null && settled(summary, endpoint)) {
        continue;
      }
      allSettled = false;
      if (summary == null) {
        dueNow = true;
      } else {
        Instant retryAt = retryAt(summary);
        if (nextDeliveryAt == null || retryAt.isBefore(nextDeliveryAt)) {
          nextDeliveryAt = retryAt;
        }
      }
    }
    if (allSettled) {
      markDelivered(event.eventId());
    } else {
      scheduleDelivery(event.eventId(), dueNow ? null : nextDeliveryAt);
    }
    return !due.isEmpty();
  }

  private Instant retryAt(AttemptSummary summary) {
    return summary.lastAttemptAt().plus(retryDelay.multipliedBy(summary.failures()));
  }

  private static boolean settled(AttemptSummary summary, WebhookEndpoint endpoint) {
    return summary.succeeded() || summary.failures() > endpoint.maxRetries();
  }

  private Map<Long, DeliveryResult> fanOut(OutboxRecord event, List<WebhookEndpoint> endpoints)
      throws InterruptedException {
    Map<Long, Future<DeliveryResult>> futures = new HashMap<>();
    for (WebhookEndpoint endpoint : endpoints) {
      permits.acquire();
      try {
        futures.put(endpoint.id(), deliveryPool.submit(() -> {
          try {
            return sender.deliver(event, endpoint);
          } finally {
            permits.release();
          }
        }));
      } catch (RejectedExecutionException e) {
        permits.release();
        logger.log(Level.WARNING, "Delivery pool rejected endpoint " + endpoint.id(), e);
      }
    }

    Map<Long, DeliveryResult> results = new HashMap<>();
    for (Map.Entry<Long, Future<DeliveryResult>> entry : futures.entrySet()) {
      try {
        results.put(entry.getKey(), entry.getValue().get());
      } catch (ExecutionException e) {
        logger.log(Level.SEVERE, "Webhook delivery failed for endpoint " + entry.getKey(),
            e.getCause());
      }
    }
    return results;
  }

  private void scheduleDelivery(String eventId, Instant nextDeliveryAt) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      outboxStore.scheduleDelivery(conn, eventId, nextDeliveryAt);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to schedule next delivery for eventId=" + eventId, e);
    }
  }

  private void markDelivered(String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      outboxStore.markDelivered(conn, eventId, Instant.now());
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to mark delivered for eventId=" + eventId, e);
    }
  }

  public int maxConcurrentDeliveries() {
    return maxConcurrentDeliveries;
  }

  /**
   * Cancels the schedule and shuts down the scheduler and delivery threads.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (task != null) {
      task.cancel(false);
      task = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
    }
    deliveryPool.shutdown();
    try {
      if (scheduler != null) {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      }
      if (!deliveryPool.awaitTermination(5, TimeUnit.SECONDS)) {
        deliveryPool.shutdownNow();
      }
    } catch (InterruptedException e) {
      deliveryPool.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link WebhookDeliveryWorker}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private OutboxStore outboxStore;
    private WebhookEndpointStore endpointStore;
    private WebhookDeliveryStore deliveryStore;
    private WebhookSender sender;
    private int maxConcurrentDeliveries = 10;
    private int batchSize = 50;
    private Duration eventThrottle = Duration.ofMillis(100);
    private Duration retryDelay = Duration.ofMinutes(1);
    private long intervalMs = 10_000;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> Source of PUBLISHED records awaiting fan-out. */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder endpointStore(WebhookEndpointStore endpointStore) {
      this.endpointStore = endpointStore;
      return this;
    }

    /** <b>Required.</b> Read for per-endpoint attempt history. */
    public Builder deliveryStore(WebhookDeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder sender(WebhookSender sender) {
      this.sender = sender;
      return this;
    }

    /**
     * Caps the number of HTTP calls in flight across the whole batch.
     *
     * <p>Optional. Defaults to {@code 10}. Must be &gt; 0.
     *
     * @param maxConcurrentDeliveries the concurrency bound
     * @return this builder
     */
    public Builder maxConcurrentDeliveries(int maxConcurrentDeliveries) {
      this.maxConcurrentDeliveries = maxConcurrentDeliveries;
      return this;
    }

    /**
     * Sets the maximum number of records per run.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     *
     * @param batchSize records per run
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the pause between two records of a batch.
     *
     * <p>Optional. Defaults to 100 ms. {@link Duration#ZERO} disables the pause.
     *
     * @param eventThrottle the pause
     * @return this builder
     */
    public Builder eventThrottle(Duration eventThrottle) {
      this.eventThrottle = Objects.requireNonNull(eventThrottle, "eventThrottle");
      return this;
    }

    /**
     * Sets the linear backoff step between retries of a failed (event, endpoint) pair.
     *
     * <p>Optional. Defaults to 1 minute.
     *
     * @param retryDelay the backoff step
     * @return this builder
     */
    public Builder retryDelay(Duration retryDelay) {
      this.retryDelay = Objects.requireNonNull(retryDelay, "retryDelay");
      return this;
    }

    /**
     * Sets the delay between scheduled runs.
     *
     * <p>Optional. Defaults to {@code 10000} ms. Must be &gt; 0.
     *
     * @param intervalMs the interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Builds the worker. Call {@link WebhookDeliveryWorker#start()} to schedule it, or
     * {@link WebhookDeliveryWorker#runOnce()} to run a batch directly.
     *
     * @return a new worker
     * @throws NullPointerException     if a required collaborator is missing
     * @throws IllegalArgumentException if a numeric setting is out of range
     */
    public WebhookDeliveryWorker build() {
      return new WebhookDeliveryWorker(this);
    }
  }
}
