package eventrelay.webhook;

import eventrelay.EventEnvelope;
import eventrelay.ValidationException;
import eventrelay.model.DeliveryResult;
import eventrelay.model.DeliveryStats;
import eventrelay.model.DeliveryTotals;
import eventrelay.model.NewWebhookEndpoint;
import eventrelay.model.WebhookDelivery;
import eventrelay.model.WebhookEndpoint;
import eventrelay.spi.ConnectionProvider;
import eventrelay.spi.WebhookDeliveryStore;
import eventrelay.spi.WebhookEndpointStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Administration of webhook endpoints: registration, connectivity tests and delivery
 * statistics.
 *
 * <p>This is the API an administrative surface calls; it performs no authorization. Database
 * failures surface as {@link IllegalStateException}.
 */
public final class WebhookManager {
  private static final Logger logger = Logger.getLogger(WebhookManager.class.getName());

  /** Default trailing window of {@link #stats(long)}. */
  public static final int DEFAULT_STATS_DAYS = 7;

  private final ConnectionProvider connectionProvider;
  private final WebhookEndpointStore endpointStore;
  private final WebhookDeliveryStore deliveryStore;
  private final WebhookSender sender;

  public WebhookManager(ConnectionProvider connectionProvider, WebhookEndpointStore endpointStore,
      WebhookDeliveryStore deliveryStore, WebhookSender sender) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.endpointStore = Objects.requireNonNull(endpointStore, "endpointStore");
    this.deliveryStore = Objects.requireNonNull(deliveryStore, "deliveryStore");
    this.sender = Objects.requireNonNull(sender, "sender");
  }

  /**
   * Registers a new endpoint. The request was validated when it was built.
   *
   * @param request the endpoint configuration
   * @return the stored endpoint, with its generated id
   */
  public WebhookEndpoint createEndpoint(NewWebhookEndpoint request) {
    Objects.requireNonNull(request, "request");
    WebhookEndpoint endpoint = inConnection("create webhook endpoint",
        conn -> endpointStore.insert(conn, request, Instant.now()));
    logger.log(Level.INFO, "Created webhook endpoint: {0} -> {1}",
        new Object[]{endpoint.name(), endpoint.url()});
    return endpoint;
  }

  /**
   * Sends a synthetic {@code webhook.test} event to an endpoint through the regular signing and
   * delivery path, and logs it like any other delivery.
   *
   * @param endpointId the endpoint to test (active or not)
   * @return the delivery outcome
   * @throws ValidationException if the endpoint does not exist
   */
  public DeliveryResult testEndpoint(long endpointId) {
    WebhookEndpoint endpoint = findEndpoint(endpointId)
        .orElseThrow(() -> new ValidationException("Webhook endpoint " + endpointId + " not found"));
    String eventId = EventEnvelope.newEventId();
    return sender.deliver(eventId, WebhookPayloads.testBody(eventId, endpoint, Instant.now()), endpoint);
  }

  /**
   * Returns delivery statistics over the last {@value #DEFAULT_STATS_DAYS} days.
   */
  public DeliveryStats stats(long endpointId) {
    return stats(endpointId, DEFAULT_STATS_DAYS);
  }

  /**
   * Aggregates the delivery log of an endpoint over the trailing {@code days}.
   *
   * @param endpointId the endpoint
   * @param days       window length in days (must be &gt; 0)
   * @return totals, success rate and average duration
   */
  public DeliveryStats stats(long endpointId, int days) {
    if (days <= 0) {
      throw new IllegalArgumentException("days must be > 0");
    }
    Instant since = Instant.now().minus(Duration.ofDays(days));
    DeliveryTotals totals = inConnection("compute webhook stats",
        conn -> deliveryStore.totals(conn, endpointId, since));
    return DeliveryStats.from(endpointId, totals, days);
  }

  public Optional<WebhookEndpoint> findEndpoint(long endpointId) {
    return inConnection("find webhook endpoint", conn -> endpointStore.findById(conn, endpointId));
  }

  /**
   * Lists endpoints.
   *
   * @param tenantId restrict to one tenant's endpoints; {@code null} lists every endpoint
   */
  public List<WebhookEndpoint> listEndpoints(Long tenantId) {
    return inConnection("list webhook endpoints", conn -> endpointStore.findAll(conn, tenantId));
  }

  /**
   * Enables or disables an endpoint.
   *
   * @return {@code true} if the endpoint exists
   */
  public boolean setActive(long endpointId, boolean active) {
    boolean updated = inConnection("update webhook endpoint",
        conn -> endpointStore.updateActive(conn, endpointId, active, Instant.now())) > 0;
    if (updated) {
      logger.log(Level.INFO, "Webhook endpoint {0} {1}",
          new Object[]{endpointId, active ? "activated" : "deactivated"});
    }
    return updated;
  }

  /**
   * Deletes an endpoint. Its delivery log is kept until retention removes it.
   *
   * @return {@code true} if the endpoint existed
   */
  public boolean deleteEndpoint(long endpointId) {
    boolean deleted = inConnection("delete webhook endpoint",
        conn -> endpointStore.delete(conn, endpointId)) > 0;
    if (deleted) {
      logger.log(Level.INFO, "Deleted webhook endpoint {0}", endpointId);
    }
    return deleted;
  }

  /**
   * Returns every logged attempt for an event, oldest first.
   */
  public List<WebhookDelivery> deliveriesFor(String eventId) {
    Objects.requireNonNull(eventId, "eventId");
    return inConnection("list webhook deliveries", conn -> deliveryStore.findByEvent(conn, eventId));
  }

  private <T> T inConnection(String action, SqlFunction<T> op) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return op.apply(conn);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to " + action, e);
    }
  }

  @FunctionalInterface
  private interface SqlFunction<T> {
    T apply(Connection conn) throws SQLException;
  }
}
