package eventrelay.dispatch;

import eventrelay.EventEnvelope;
import eventrelay.EventHandler;
import eventrelay.EventType;
import eventrelay.ValidationException;
import eventrelay.model.EventStatus;
import eventrelay.model.OutboxRecord;
import eventrelay.registry.DefaultHandlerRegistry;
import eventrelay.registry.HandlerRegistry;
import eventrelay.spi.ConnectionProvider;
import eventrelay.spi.MetricsExporter;
import eventrelay.spi.OutboxStore;
import eventrelay.spi.TxContext;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records domain events in the caller's transaction and drives them through in-process handlers.
 *
 * <p>{@link #publish} requires an active transaction on the configured {@link TxContext} and
 * never opens one: the outbox row commits or rolls back with the business change. Every other
 * operation runs on the caller's transactional connection when one is active, otherwise on a
 * fresh auto-commit connection from the {@link ConnectionProvider}.
 *
 * <p>{@link #process} is the consumption step used by {@link eventrelay.poller.OutboxPoller}. It
 * claims the record with a conditional update, so two consumers never handle the same record
 * concurrently, and it never throws.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see EventDispatcher.Builder
 */
public final class EventDispatcher {
  private static final Logger logger = Logger.getLogger(EventDispatcher.class.getName());

  private final TxContext txContext;
  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;
  private final HandlerRegistry handlerRegistry;
  private final RetryPolicy retryPolicy;
  private final int maxRetries;
  private final MetricsExporter metrics;

  private EventDispatcher(Builder builder) {
    this.txContext = Objects.requireNonNull(builder.txContext, "txContext");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.handlerRegistry = builder.handlerRegistry != null
        ? builder.handlerRegistry : new DefaultHandlerRegistry();
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : LinearBackoffRetryPolicy.ofMinutes(5);
    this.maxRetries = builder.maxRetries;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Writes an event to the outbox as PENDING, inside the caller's transaction.
   *
   * @param envelope the event to record
   * @return the inserted record
   * @throws ValidationException   if the event type, aggregate type or aggregate id is blank,
   *     or an identifying field is longer than its column
   * @throws IllegalStateException if no transaction is active
   */
  public OutboxRecord publish(EventEnvelope envelope) {
    validate(envelope);
    Connection conn = requireTransaction();
    return insert(conn, envelope);
  }

  /**
   * Writes several events in the caller's transaction. Every envelope is validated before the
   * first insert, so an invalid envelope leaves nothing written by this call.
   *
   * @param envelopes the events to record, in order
   * @return the inserted records, in order
   * @throws ValidationException   if any envelope is invalid
   * @throws IllegalStateException if no transaction is active
   */
  public List<OutboxRecord> publishBatch(List<EventEnvelope> envelopes) {
    Objects.requireNonNull(envelopes, "envelopes");
    for (EventEnvelope envelope : envelopes) {
      validate(envelope);
    }
    Connection conn = requireTransaction();
    List<OutboxRecord> records = new ArrayList<>(envelopes.size());
    for (EventEnvelope envelope : envelopes) {
      records.add(insert(conn, envelope));
    }
    return records;
  }

  private OutboxRecord insert(Connection conn, EventEnvelope envelope) {
    Instant now = Instant.now();
    OutboxRecord record = new OutboxRecord(
        envelope.eventId(),
        envelope.eventType(),
        envelope.aggregateType(),
        envelope.aggregateId(),
        envelope.payload(),
        envelope.metadata(),
        envelope.tenantId(),
        envelope.occurredAt(),
        EventStatus.PENDING,
        0,
        maxRetries,
        now,
        null,
        null,
        null,
        null,
        null,
        null);
    outboxStore.insert(conn, record);
    metrics.incrementEventsRecorded();
    logger.log(Level.FINE, "Recorded event {0} ({1})",
        new Object[]{record.eventId(), record.eventType()});
    return record;
  }

  private static void validate(EventEnvelope envelope) {
    if (envelope == null) {
      throw new ValidationException("envelope is required");
    }
    if (isBlank(envelope.eventType())) {
      throw new ValidationException("eventType is required");
    }
    if (isBlank(envelope.aggregateType())) {
      throw new ValidationException("aggregateType is required");
    }
    if (isBlank(envelope.aggregateId())) {
      throw new ValidationException("aggregateId is required");
    }
    checkLength("eventId", envelope.eventId(), EventEnvelope.MAX_EVENT_ID_LENGTH);
    checkLength("eventType", envelope.eventType(), EventEnvelope.MAX_EVENT_TYPE_LENGTH);
    checkLength("aggregateType", envelope.aggregateType(), EventEnvelope.MAX_AGGREGATE_TYPE_LENGTH);
    checkLength("aggregateId", envelope.aggregateId(), EventEnvelope.MAX_AGGREGATE_ID_LENGTH);
  }

  private static void checkLength(String field, String value, int max) {
    if (value.length() > max) {
      throw new ValidationException(
          field + " exceeds " + max + " characters (was " + value.length() + ")");
    }
  }

  private Connection requireTransaction() {
    if (!txContext.isTransactionActive()) {
      throw new IllegalStateException(
          "No active transaction: events must be published inside the caller's transaction");
    }
    return txContext.currentConnection();
  }

  /**
   * Lists records ready for processing: PENDING records and RETRYING records that are due.
   *
   * @param limit maximum number of records (must be &gt; 0)
   * @return records ordered by creation time, oldest first
   */
  public List<OutboxRecord> listPending(int limit) {
    return listPending(limit, null);
  }

  /**
   * Lists records ready for processing, restricted to the given event types.
   *
   * @param limit      maximum number of records (must be &gt; 0)
   * @param eventTypes types to include; {@code null} or empty for all
   * @return records ordered by creation time, oldest first
   */
  public List<OutboxRecord> listPending(int limit, Collection<String> eventTypes) {
    requirePositive(limit);
    return withConnection("list pending events", null,
        conn -> outboxStore.listPending(conn, Instant.now(), limit, eventTypes), List.of());
  }

  /**
   * Claims up to {@code limit} ready records at once, moving them to PROCESSING.
   *
   * <p>Claimed records must be handed to {@link #processClaimed}.
   *
   * @param limit      maximum number of records (must be &gt; 0)
   * @param eventTypes types to include; {@code null} or empty for all
   * @return the claimed records
   */
  public List<OutboxRecord> claimPending(int limit, Collection<String> eventTypes) {
    requirePositive(limit);
    return withConnection("claim pending events", null,
        conn -> outboxStore.claimPending(conn, Instant.now(), limit, eventTypes), List.of());
  }

  public Optional<OutboxRecord> find(String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    return withConnection("find event", eventId,
        conn -> outboxStore.findById(conn, eventId), Optional.empty());
  }

  /**
   * Moves a PENDING or due RETRYING record to PROCESSING.
   *
   * @return {@code true} if this call claimed the record
   */
  public boolean markProcessing(String eventId) {
    return withConnection("mark PROCESSING", eventId,
        conn -> outboxStore.markProcessing(conn, eventId, Instant.now()), 0) > 0;
  }

  /**
   * Moves a PROCESSING record to PUBLISHED and records {@code processedAt}.
   *
   * @return {@code true} if the transition applied
   */
  public boolean markPublished(String eventId) {
    return withConnection("mark PUBLISHED", eventId,
        conn -> outboxStore.markPublished(conn, eventId, Instant.now()), 0) > 0;
  }

  /**
   * Records a failed processing attempt using the configured retry policy.
   *
   * @see #markFailed(String, String, long)
   */
  public EventStatus markFailed(String eventId, String error) {
    return markFailed(eventId, error, retryPolicy);
  }

  /**
   * Records a failed processing attempt.
   *
   * <p>Increments {@code retryCount}. Once it reaches the record's {@code maxRetries} the record
   * becomes FAILED and no further retry is scheduled; otherwise it becomes RETRYING, due
   * {@code retryDelayMinutes * retryCount} minutes from now.
   *
   * @param eventId           the record to update
   * @param error             failure description (truncated to 4000 characters)
   * @param retryDelayMinutes linear backoff step in minutes
   * @return the new status, or {@code null} if the record is missing or not PROCESSING
   */
  public EventStatus markFailed(String eventId, String error, long retryDelayMinutes) {
    return markFailed(eventId, error, LinearBackoffRetryPolicy.ofMinutes(retryDelayMinutes));
  }

  private EventStatus markFailed(String eventId, String error, RetryPolicy policy) {
    Objects.requireNonNull(eventId, "eventId");
    String truncated = OutboxRecord.truncateError(error);
    return withConnection("mark failed", eventId, conn -> {
      OutboxRecord current = outboxStore.findById(conn, eventId).orElse(null);
      if (current == null || current.status() != EventStatus.PROCESSING) {
        return null;
      }
      int retryCount = current.retryCount() + 1;
      if (retryCount >= current.maxRetries()) {
        if (outboxStore.markFailed(conn, eventId, truncated) == 0) {
          return null;
        }
        metrics.incrementProcessFailed();
        logger.log(Level.SEVERE, "Event {0} FAILED after {1} attempts: {2}",
            new Object[]{eventId, retryCount, truncated});
        return EventStatus.FAILED;
      }
      Instant nextRetryAt = Instant.now()
          .plus(policy.computeDelayMs(retryCount), ChronoUnit.MILLIS);
      if (outboxStore.markRetrying(conn, eventId, nextRetryAt, truncated) == 0) {
        return null;
      }
      metrics.incrementProcessRetry();
      logger.log(Level.WARNING, "Event {0} scheduled for retry {1} at {2}: {3}",
          new Object[]{eventId, retryCount, nextRetryAt, truncated});
      return EventStatus.RETRYING;
    }, null);
  }

  /**
   * Registers an in-process handler. Handlers are not persisted and must be registered again
   * after a restart, before polling starts.
   *
   * @param eventType the event type, or {@code "*"} for every type
   * @param handler   the handler
   */
  public void registerHandler(String eventType, EventHandler handler) {
    handlerRegistry.register(eventType, handler);
  }

  public void registerHandler(EventType eventType, EventHandler handler) {
    handlerRegistry.register(eventType.value(), handler);
  }

  /**
   * Claims a record and runs its handlers.
   *
   * <p>Without handlers the record is marked PUBLISHED directly. The first handler exception
   * stops the remaining handlers and routes the record to {@link #markFailed(String, String)}.
   *
   * @param record the record to process (usually from {@link #listPending})
   * @return {@code true} if the record reached PUBLISHED
   */
  public boolean process(OutboxRecord record) {
    try {
      if (!markProcessing(record.eventId())) {
        logger.log(Level.FINE, "Event {0} already claimed or no longer pending", record.eventId());
        return false;
      }
      return runHandlers(record);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to process event " + record.eventId(), e);
      return false;
    }
  }

  /**
   * Runs the handlers of a record already claimed through {@link #claimPending}.
   *
   * @return {@code true} if the record reached PUBLISHED
   */
  public boolean processClaimed(OutboxRecord record) {
    try {
      return runHandlers(record);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to process event " + record.eventId(), e);
      return false;
    }
  }

  private boolean runHandlers(OutboxRecord record) {
    String eventId = record.eventId();
    for (EventHandler handler : handlerRegistry.handlersFor(record.eventType())) {
      try {
        handler.handle(record);
      } catch (Exception e) {
        logger.log(Level.WARNING, "Handler failed for event " + eventId, e);
        markFailed(eventId, describe(e));
        return false;
      }
    }
    if (!markPublished(eventId)) {
      logger.log(Level.WARNING, "Event {0} was not PROCESSING when publishing", eventId);
      return false;
    }
    metrics.incrementProcessSuccess();
    return true;
  }

  /**
   * Moves PROCESSING records locked before {@code lockedBefore} back to RETRYING, due now,
   * without consuming a retry.
   *
   * @return the number of recovered records
   */
  public int releaseStale(Instant lockedBefore) {
    Objects.requireNonNull(lockedBefore, "lockedBefore");
    int released = withConnection("release stale events", null,
        conn -> outboxStore.releaseStale(conn, lockedBefore, Instant.now()), 0);
    if (released > 0) {
      logger.log(Level.WARNING, "Recovered {0} events stuck in PROCESSING", released);
    }
    return released;
  }

  /**
   * Hands a record claimed through {@link #claimPending} back as RETRYING, due now, without
   * consuming a retry.
   *
   * @return {@code true} if the record was still PROCESSING
   */
  public boolean releaseClaim(String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    return withConnection("release claimed event", eventId,
        conn -> outboxStore.releaseClaim(conn, eventId, Instant.now()) > 0, false);
  }

  /**
   * Deletes PUBLISHED records processed more than {@code olderThanDays} days ago.
   *
   * @return the number of deleted records
   */
  public int purge(int olderThanDays) {
    if (olderThanDays < 0) {
      throw new IllegalArgumentException("olderThanDays must be >= 0");
    }
    Instant cutoff = Instant.now().minus(Duration.ofDays(olderThanDays));
    int deleted = withConnection("purge published events", null,
        conn -> outboxStore.purgePublished(conn, cutoff, Integer.MAX_VALUE), 0);
    logger.log(Level.INFO, "Purged {0} published events older than {1}",
        new Object[]{deleted, cutoff});
    return deleted;
  }

  public HandlerRegistry handlerRegistry() {
    return handlerRegistry;
  }

  private <T> T withConnection(String action, String eventId, SqlFunction<T> op, T fallback) {
    if (txContext.isTransactionActive()) {
      try {
        return op.apply(txContext.currentConnection());
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to " + action + suffix(eventId), e);
        return fallback;
      }
    }
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to " + action + suffix(eventId), e);
      return fallback;
    }
  }

  private static String suffix(String eventId) {
    return eventId == null ? "" : " for eventId=" + eventId;
  }

  private static String describe(Exception e) {
    String message = e.getMessage();
    return message == null || message.isEmpty() ? e.getClass().getName() : message;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static void requirePositive(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }

  /** Builder for {@link EventDispatcher}. */
  public static final class Builder {
    private TxContext txContext;
    private ConnectionProvider connectionProvider;
    private OutboxStore outboxStore;
    private HandlerRegistry handlerRegistry;
    private RetryPolicy retryPolicy;
    private int maxRetries = 3;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the transaction context that {@link EventDispatcher#publish} joins.
     *
     * <p><b>Required.</b>
     *
     * @param txContext the transaction context
     * @return this builder
     */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /**
     * Sets the connection provider used outside a transaction.
     *
     * <p><b>Required.</b>
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Sets the outbox persistence backend.
     *
     * <p><b>Required.</b>
     *
     * @param outboxStore the outbox store
     * @return this builder
     */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /**
     * Sets the handler registry.
     *
     * <p>Optional. Defaults to an empty {@link DefaultHandlerRegistry}.
     *
     * @param handlerRegistry the handler registry
     * @return this builder
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Sets the retry policy applied by {@link EventDispatcher#markFailed(String, String)}.
     *
     * <p>Optional. Defaults to {@link LinearBackoffRetryPolicy} with a five minute step.
     *
     * @param retryPolicy the retry policy
     * @return this builder
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Sets the retry budget stamped on newly published records.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     *
     * @param maxRetries failed attempts after which a record becomes FAILED
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * Sets the metrics exporter.
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
     * Builds the dispatcher.
     *
     * @return a new {@link EventDispatcher}
     * @throws NullPointerException     if {@code txContext}, {@code connectionProvider} or
     *                                  {@code outboxStore} is null
     * @throws IllegalArgumentException if {@code maxRetries < 0}
     */
    public EventDispatcher build() {
      return new EventDispatcher(this);
    }
  }
}
