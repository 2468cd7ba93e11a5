package eventrelay.purge;

import eventrelay.spi.ConnectionProvider;
import eventrelay.spi.EventPurger;
import eventrelay.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps a table bounded by deleting rows that have outlived their retention.
 *
 * <p>{@link eventrelay.EventRelay} runs two of these: one drops PUBLISHED outbox records 30 days
 * after {@code processed_at}, the other drops webhook delivery attempts 7 days after
 * {@code attempted_at}. What a row is and how its age is read belongs to the {@link EventPurger};
 * this class only owns the schedule and the batching.
 *
 * <p>A run fixes its cutoff once, then calls the purger with {@code batchSize} as the limit,
 * each call on a fresh auto-commit connection, until a call deletes fewer rows than asked for
 * or the scheduler is closed. Failures end the run and are logged; the next run starts over.
 */
public final class PurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(PurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final EventPurger purger;
  private final String label;
  private final Duration retention;
  private final int batchSize;
  private final long intervalSeconds;

  private ScheduledExecutorService executor;
  private volatile ScheduledFuture<?> schedule;
  private volatile boolean closed;

  private PurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.purger = Objects.requireNonNull(builder.purger, "purger");
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalSeconds <= 0L) {
      throw new IllegalArgumentException("intervalSeconds must be > 0");
    }
    this.label = builder.name;
    this.retention = builder.retention;
    this.batchSize = builder.batchSize;
    this.intervalSeconds = builder.intervalSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Schedules {@link #runOnce()} every {@code intervalSeconds}; repeated calls are ignored. */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("PurgeScheduler has been closed");
    }
    if (schedule != null) {
      return;
    }
    executor = Executors.newSingleThreadScheduledExecutor(
        new DaemonThreadFactory("eventrelay-purge-"));
    schedule = executor.scheduleWithFixedDelay(
        this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  /**
   * Deletes everything older than {@code now - retention}, one batch at a time.
   *
   * @return rows deleted by this run; {@code 0} when closed or when the first batch failed
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    Instant cutoff = Instant.now().minus(retention);
    long total = 0;
    try {
      while (!closed) {
        int deleted = deleteBatch(cutoff);
        total += deleted;
        if (deleted < batchSize) {
          break;
        }
        logger.log(Level.FINE, "Deleted a full batch of {0} {1}, continuing",
            new Object[]{deleted, label});
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Retention run for " + label + " stopped after " + total + " rows", t);
    }
    if (total > 0) {
      logger.log(Level.INFO, "Retention removed {0} {1} older than {2}",
          new Object[]{total, label, cutoff});
    }
    return total;
  }

  private int deleteBatch(Instant cutoff) throws SQLException {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return purger.purge(conn, cutoff, batchSize);
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (schedule != null) {
      schedule.cancel(false);
      schedule = null;
    }
    if (executor != null) {
      executor.shutdownNow();
      try {
        executor.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link PurgeScheduler}. {@code connectionProvider} and {@code purger} are
   * required; retention defaults to 30 days, batches to 500 rows, the interval to one hour.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private EventPurger purger;
    private String name = "rows";
    private Duration retention = Duration.ofDays(30);
    private int batchSize = 500;
    private long intervalSeconds = 3600;

    private Builder() {}

    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * The batch delete, usually {@code outboxStore::purgePublished} or
     * {@code deliveryStore::purgeBefore}.
     */
    public Builder purger(EventPurger purger) {
      this.purger = purger;
      return this;
    }

    /** What the rows are, as it should read in log lines ({@code "webhook deliveries"}). */
    public Builder name(String name) {
      this.name = Objects.requireNonNull(name, "name");
      return this;
    }

    /** How long a row is kept. Zero purges everything older than the start of the run. */
    public Builder retention(Duration retention) {
      this.retention = Objects.requireNonNull(retention, "retention");
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder intervalSeconds(long intervalSeconds) {
      this.intervalSeconds = intervalSeconds;
      return this;
    }

    /**
     * @throws NullPointerException     if {@code connectionProvider} or {@code purger} is missing
     * @throws IllegalArgumentException if retention is negative, or batch size or interval is
     *     not positive
     */
    public PurgeScheduler build() {
      return new PurgeScheduler(this);
    }
  }
}
