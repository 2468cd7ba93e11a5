package eventrelay;

import eventrelay.dispatch.EventDispatcher;
import eventrelay.dispatch.RetryPolicy;
import eventrelay.failed.FailedEventManager;
import eventrelay.poller.OutboxPoller;
import eventrelay.purge.PurgeScheduler;
import eventrelay.registry.HandlerRegistry;
import eventrelay.spi.ConnectionProvider;
import eventrelay.spi.MetricsExporter;
import eventrelay.spi.OutboxStore;
import eventrelay.spi.TxContext;
import eventrelay.spi.WebhookDeliveryStore;
import eventrelay.spi.WebhookEndpointStore;
import eventrelay.webhook.HttpClientWebhookTransport;
import eventrelay.webhook.WebhookDeliveryWorker;
import eventrelay.webhook.WebhookManager;
import eventrelay.webhook.WebhookSender;
import eventrelay.webhook.WebhookTransport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires the dispatcher, poller, webhook worker, webhook manager,
 * failed-event manager and both retention jobs from one set of stores.
 *
 * <p>{@link Builder#build()} starts the scheduled components; {@link #close()} stops them in
 * reverse order. Callers own the instance: there is no global registry.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 * var txContext    = new ThreadLocalTxContext();
 *
 * try (EventRelay relay = EventRelay.builder()
 *     .connectionProvider(connProvider)
 *     .txContext(txContext)
 *     .outboxStore(JdbcOutboxStores.detect(dataSource))
 *     .endpointStore(new JdbcWebhookEndpointStore())
 *     .deliveryStore(new JdbcWebhookDeliveryStore())
 *     .handler("ticket.created", event -> notifier.ticketOpened(event))
 *     .build()) {
 *
 *   var txManager = new JdbcTransactionManager(connProvider, txContext);
 *   try (var tx = txManager.begin()) {
 *     ticketRepository.insert(tx.connection(), ticket);
 *     relay.dispatcher().publish(DomainEvents.ticketCreated(
 *         ticket.id(), ticket.tenantId(), ticket.number(), ticket.title(), Map.of()));
 *     tx.commit();
 *   }
 * }
 * }</pre>
 */
public final class EventRelay implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EventRelay.class.getName());

  private final EventDispatcher dispatcher;
  private final OutboxPoller poller;
  private final WebhookDeliveryWorker worker;
  private final WebhookManager webhookManager;
  private final FailedEventManager failedEventManager;
  private final PurgeScheduler outboxPurge;
  private final PurgeScheduler deliveryPurge;
  private final MetricsExporter metrics;

  private EventRelay(EventDispatcher dispatcher, OutboxPoller poller, WebhookDeliveryWorker worker,
      WebhookManager webhookManager, FailedEventManager failedEventManager,
      PurgeScheduler outboxPurge, PurgeScheduler deliveryPurge, MetricsExporter metrics) {
    this.dispatcher = dispatcher;
    this.poller = poller;
    this.worker = worker;
    this.webhookManager = webhookManager;
    this.failedEventManager = failedEventManager;
    this.outboxPurge = outboxPurge;
    this.deliveryPurge = deliveryPurge;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public EventDispatcher dispatcher() {
    return dispatcher;
  }

  public OutboxPoller poller() {
    return poller;
  }

  public WebhookDeliveryWorker worker() {
    return worker;
  }

  public WebhookManager webhooks() {
    return webhookManager;
  }

  public FailedEventManager failedEvents() {
    return failedEventManager;
  }

  /**
   * Shuts down components in order: purge schedulers, webhook worker, poller, then the metrics
   * exporter if it is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (AutoCloseable component : List.<AutoCloseable>of(deliveryPurge, outboxPurge, worker, poller)) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link EventRelay}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TxContext txContext;
    private OutboxStore outboxStore;
    private WebhookEndpointStore endpointStore;
    private WebhookDeliveryStore deliveryStore;
    private HandlerRegistry handlerRegistry;
    private final List<Registration> handlers = new ArrayList<>();
    private WebhookTransport transport;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private int maxRetries = 3;
    private long pollIntervalMs = 5000;
    private int pollBatchSize = 50;
    private Duration staleAfter;
    private boolean claimBatches;
    private int maxConcurrentDeliveries = 10;
    private long deliveryIntervalMs = 10_000;
    private Duration deliveryRetryDelay;
    private Duration eventThrottle;
    private String userAgent;
    private Duration outboxRetention = Duration.ofDays(30);
    private Duration deliveryRetention = Duration.ofDays(7);
    private long purgeIntervalSeconds = 3600;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> The transaction context {@code publish} joins. */
    public Builder txContext(TxContext txContext) {
      this.txContext = txContext;
      return this;
    }

    /** <b>Required.</b> */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder endpointStore(WebhookEndpointStore endpointStore) {
      this.endpointStore = endpointStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deliveryStore(WebhookDeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    /**
     * Sets a pre-populated handler registry.
     *
     * <p>Optional. Defaults to an empty registry.
     */
    public Builder handlerRegistry(HandlerRegistry handlerRegistry) {
      this.handlerRegistry = handlerRegistry;
      return this;
    }

    /**
     * Registers a handler before the poller starts.
     *
     * @param eventType the event type, or {@code "*"}
     * @param handler   the handler
     * @return this builder
     */
    public Builder handler(String eventType, EventHandler handler) {
      handlers.add(new Registration(
          Objects.requireNonNull(eventType, "eventType"), Objects.requireNonNull(handler, "handler")));
      return this;
    }

    public Builder handler(EventType eventType, EventHandler handler) {
      return handler(eventType.value(), handler);
    }

    /**
     * Sets the HTTP transport.
     *
     * <p>Optional. Defaults to {@link HttpClientWebhookTransport}.
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Optional. Defaults to {@code 3}. */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /** Optional. Defaults to {@code 5000} ms. */
    public Builder pollIntervalMs(long pollIntervalMs) {
      this.pollIntervalMs = pollIntervalMs;
      return this;
    }

    /** Optional. Defaults to {@code 50}. */
    public Builder pollBatchSize(int pollBatchSize) {
      this.pollBatchSize = pollBatchSize;
      return this;
    }

    /** Optional. Disabled by default. See {@link OutboxPoller.Builder#staleAfter}. */
    public Builder staleAfter(Duration staleAfter) {
      this.staleAfter = staleAfter;
      return this;
    }

    /** Optional. See {@link OutboxPoller.Builder#claimBatches}. */
    public Builder claimBatches(boolean claimBatches) {
      this.claimBatches = claimBatches;
      return this;
    }

    /** Optional. Defaults to {@code 10}. */
    public Builder maxConcurrentDeliveries(int maxConcurrentDeliveries) {
      this.maxConcurrentDeliveries = maxConcurrentDeliveries;
      return this;
    }

    /** Optional. Defaults to {@code 10000} ms. */
    public Builder deliveryIntervalMs(long deliveryIntervalMs) {
      this.deliveryIntervalMs = deliveryIntervalMs;
      return this;
    }

    /** Optional. Defaults to 1 minute. */
    public Builder deliveryRetryDelay(Duration deliveryRetryDelay) {
      this.deliveryRetryDelay = deliveryRetryDelay;
      return this;
    }

    /** Optional. Defaults to 100 ms. */
    public Builder eventThrottle(Duration eventThrottle) {
      this.eventThrottle = eventThrottle;
      return this;
    }

    /** Optional. Defaults to {@code EventRelay-Webhook/1.0}. */
    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    /** Optional. PUBLISHED records are kept 30 days by default. */
    public Builder outboxRetention(Duration outboxRetention) {
      this.outboxRetention = Objects.requireNonNull(outboxRetention, "outboxRetention");
      return this;
    }

    /** Optional. Delivery attempts are kept 7 days by default. */
    public Builder deliveryRetention(Duration deliveryRetention) {
      this.deliveryRetention = Objects.requireNonNull(deliveryRetention, "deliveryRetention");
      return this;
    }

    /** Optional. Defaults to {@code 3600} seconds. */
    public Builder purgeIntervalSeconds(long purgeIntervalSeconds) {
      this.purgeIntervalSeconds = purgeIntervalSeconds;
      return this;
    }

    /**
     * Builds every component and starts the poller, the webhook worker and both purge jobs.
     * If a component fails to build or start, the ones already started are closed before
     * rethrowing.
     *
     * @return a running {@link EventRelay}
     * @throws NullPointerException  if a required collaborator is missing
     * @throws IllegalStateException if this builder was already used
     */
    public EventRelay build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(txContext, "txContext");
      Objects.requireNonNull(outboxStore, "outboxStore");
      Objects.requireNonNull(endpointStore, "endpointStore");
      Objects.requireNonNull(deliveryStore, "deliveryStore");
      MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;

      EventDispatcher dispatcher = EventDispatcher.builder()
          .txContext(txContext)
          .connectionProvider(connectionProvider)
          .outboxStore(outboxStore)
          .handlerRegistry(handlerRegistry)
          .retryPolicy(retryPolicy)
          .maxRetries(maxRetries)
          .metrics(effectiveMetrics)
          .build();
      for (Registration registration : handlers) {
        dispatcher.registerHandler(registration.eventType(), registration.handler());
      }

      WebhookSender sender = WebhookSender.builder()
          .transport(transport != null ? transport : new HttpClientWebhookTransport())
          .connectionProvider(connectionProvider)
          .deliveryStore(deliveryStore)
          .userAgent(userAgent)
          .metrics(effectiveMetrics)
          .build();
      WebhookManager webhookManager =
          new WebhookManager(connectionProvider, endpointStore, deliveryStore, sender);
      FailedEventManager failedEventManager = new FailedEventManager(connectionProvider, outboxStore);

      List<AutoCloseable> started = new ArrayList<>();
      try {
        OutboxPoller poller = OutboxPoller.builder()
            .dispatcher(dispatcher)
            .intervalMs(pollIntervalMs)
            .batchSize(pollBatchSize)
            .staleAfter(staleAfter)
            .claimBatches(claimBatches)
            .metrics(effectiveMetrics)
            .build();
        started.add(poller);
        poller.start();

        WebhookDeliveryWorker.Builder wb = WebhookDeliveryWorker.builder()
            .connectionProvider(connectionProvider)
            .outboxStore(outboxStore)
            .endpointStore(endpointStore)
            .deliveryStore(deliveryStore)
            .sender(sender)
            .maxConcurrentDeliveries(maxConcurrentDeliveries)
            .intervalMs(deliveryIntervalMs);
        if (deliveryRetryDelay != null) {
          wb.retryDelay(deliveryRetryDelay);
        }
        if (eventThrottle != null) {
          wb.eventThrottle(eventThrottle);
        }
        WebhookDeliveryWorker worker = wb.build();
        started.add(worker);
        worker.start();

        PurgeScheduler outboxPurge = PurgeScheduler.builder()
            .connectionProvider(connectionProvider)
            .purger(outboxStore::purgePublished)
            .name("published events")
            .retention(outboxRetention)
            .intervalSeconds(purgeIntervalSeconds)
            .build();
        started.add(outboxPurge);
        outboxPurge.start();

        PurgeScheduler deliveryPurge = PurgeScheduler.builder()
            .connectionProvider(connectionProvider)
            .purger(deliveryStore::purgeBefore)
            .name("webhook deliveries")
            .retention(deliveryRetention)
            .intervalSeconds(purgeIntervalSeconds)
            .build();
        started.add(deliveryPurge);
        deliveryPurge.start();

        logger.log(Level.INFO, "EventRelay started with {0} handler registrations",
            handlers.size());
        return new EventRelay(dispatcher, poller, worker, webhookManager, failedEventManager,
            outboxPurge, deliveryPurge, effectiveMetrics);
      } catch (RuntimeException e) {
        for (int i = started.size() - 1; i >= 0; i--) {
          try {
            started.get(i).close();
          } catch (Exception suppressed) {
            e.addSuppressed(suppressed);
          }
        }
        throw e;
      }
    }

    private record Registration(String eventType, EventHandler handler) {}
  }
}
