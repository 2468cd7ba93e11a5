package eventrelay.poller;

import eventrelay.dispatch.EventDispatcher;
import eventrelay.model.OutboxRecord;
import eventrelay.spi.MetricsExporter;
import eventrelay.util.DaemonThreadFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Scheduled consumption step: lists ready outbox records and hands each one to
 * {@link EventDispatcher#process}.
 *
 * <p>Operates in two modes:
 * <ul>
 *   <li><b>Single-node</b> (default): lists ready records and lets {@code process} claim them
 *       one at a time with a conditional update.
 *   <li><b>Claiming</b>: claims a whole batch up front with {@link EventDispatcher#claimPending},
 *       which database-specific stores back with row-level locking. Enabled via
 *       {@link Builder#claimBatches}.
 * </ul>
 *
 * <p>With {@link Builder#staleAfter} set, each cycle first recovers records left in PROCESSING
 * by a crashed consumer. A claimed batch interrupted by {@link #close()} is handed back as
 * RETRYING, due now, before the cycle returns.
 *
 * <p>Handlers must be registered on the dispatcher before {@link #start()}.
 *
 * <p>The {@link #start()} and {@link #close()} methods are synchronized.
 *
 * @see OutboxPoller.Builder
 */
public final class OutboxPoller implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(OutboxPoller.class.getName());

  private final EventDispatcher dispatcher;
  private final int batchSize;
  private final long intervalMs;
  private final Set<String> eventTypes;
  private final Duration staleAfter;
  private final boolean claimBatches;
  private final MetricsExporter metrics;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> pollTask;
  private volatile boolean closed;

  private OutboxPoller(Builder builder) {
    this.dispatcher = Objects.requireNonNull(builder.dispatcher, "dispatcher");
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    if (builder.staleAfter != null && (builder.staleAfter.isNegative() || builder.staleAfter.isZero())) {
      throw new IllegalArgumentException("staleAfter must be positive");
    }
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.eventTypes = builder.eventTypes == null ? Set.of() : Set.copyOf(builder.eventTypes);
    this.staleAfter = builder.staleAfter;
    this.claimBatches = builder.claimBatches;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled polling loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("OutboxPoller has been closed");
    }
    if (pollTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("eventrelay-poller-"));
    pollTask = scheduler.scheduleWithFixedDelay(this::poll, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single poll cycle. Called by the scheduler, but may also be invoked directly.
   *
   * @return the number of records that reached PUBLISHED in this cycle
   */
  public int poll() {
    if (closed) {
      return 0;
    }
    try {
      Instant now = Instant.now();
      if (staleAfter != null) {
        dispatcher.releaseStale(now.minus(staleAfter));
      }
      List<OutboxRecord> records = claimBatches
          ? dispatcher.claimPending(batchSize, eventTypes)
          : dispatcher.listPending(batchSize, eventTypes);
      if (records.isEmpty()) {
        metrics.recordOldestLagMs(0);
        return 0;
      }
      // records are ordered oldest first
      long lagMs = Duration.between(records.get(0).createdAt(), now).toMillis();
      metrics.recordOldestLagMs(Math.max(0L, lagMs));

      int published = 0;
      for (int i = 0; i < records.size(); i++) {
        if (closed) {
          if (claimBatches) {
            releaseClaims(records.subList(i, records.size()));
          }
          break;
        }
        OutboxRecord record = records.get(i);
        boolean ok = claimBatches ? dispatcher.processClaimed(record) : dispatcher.process(record);
        if (ok) {
          published++;
        }
      }
      logger.log(Level.FINE, "Poll cycle published {0} of {1} events",
          new Object[]{published, records.size()});
      return published;
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Poll cycle failed", t);
      return 0;
    }
  }

  private void releaseClaims(List<OutboxRecord> unprocessed) {
    int released = 0;
    for (OutboxRecord record : unprocessed) {
      if (dispatcher.releaseClaim(record.eventId())) {
        released++;
      }
    }
    logger.log(Level.INFO, "Closed mid-batch, released {0} claimed events", released);
  }

  /**
   * Cancels the polling schedule and shuts down the scheduler thread.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (pollTask != null) {
      pollTask.cancel(false);
      pollTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link OutboxPoller}.
   */
  public static final class Builder {
    private EventDispatcher dispatcher;
    private int batchSize = 50;
    private long intervalMs = 5000;
    private Collection<String> eventTypes;
    private Duration staleAfter;
    private boolean claimBatches;
    private MetricsExporter metrics;

    private Builder() {
    }

    /**
     * Sets the dispatcher whose records are consumed.
     *
     * <p><b>Required.</b>
     *
     * @param dispatcher the event dispatcher
     * @return this builder
     */
    public Builder dispatcher(EventDispatcher dispatcher) {
      this.dispatcher = dispatcher;
      return this;
    }

    /**
     * Sets the maximum number of records handled per poll cycle.
     *
     * <p>Optional. Defaults to {@code 50}. Must be &gt; 0.
     *
     * @param batchSize max records per poll
     * @return this builder
     */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /**
     * Sets the polling interval in milliseconds.
     *
     * <p>Optional. Defaults to {@code 5000} ms. Must be &gt; 0.
     *
     * @param intervalMs polling interval in milliseconds
     * @return this builder
     */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    /**
     * Restricts the poller to the given event types.
     *
     * <p>Optional. Defaults to all types.
     *
     * @param eventTypes the event types to consume
     * @return this builder
     */
    public Builder eventTypes(Collection<String> eventTypes) {
      this.eventTypes = eventTypes;
      return this;
    }

    /**
     * Enables recovery of records left in PROCESSING for longer than {@code staleAfter}.
     *
     * <p>Optional. Disabled by default. Must be positive and comfortably longer than the
     * slowest handler.
     *
     * @param staleAfter how long a record may stay in PROCESSING
     * @return this builder
     */
    public Builder staleAfter(Duration staleAfter) {
      this.staleAfter = staleAfter;
      return this;
    }

    /**
     * Claims whole batches with {@link EventDispatcher#claimPending} instead of claiming
     * record by record.
     *
     * <p>Optional. Defaults to {@code false}.
     *
     * @param claimBatches whether to claim batches up front
     * @return this builder
     */
    public Builder claimBatches(boolean claimBatches) {
      this.claimBatches = claimBatches;
      return this;
    }

    /**
     * Sets the metrics exporter for recording poll lag.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the poller. Call {@link OutboxPoller#start()} to begin the polling schedule.
     *
     * @return a new {@link OutboxPoller} instance
     * @throws NullPointerException     if {@code dispatcher} is null
     * @throws IllegalArgumentException if {@code batchSize <= 0}, {@code intervalMs <= 0}
     *                                  or {@code staleAfter} is not positive
     */
    public OutboxPoller build() {
      return new OutboxPoller(this);
    }
  }
}
