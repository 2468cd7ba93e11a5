package eventrelay.webhook;

import eventrelay.model.DeliveryResult;
import eventrelay.model.OutboxRecord;
import eventrelay.model.WebhookDelivery;
import eventrelay.model.WebhookEndpoint;
import eventrelay.spi.ConnectionProvider;
import eventrelay.spi.MetricsExporter;
import eventrelay.spi.WebhookDeliveryStore;
import eventrelay.util.JsonCodec;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Signs, posts and logs a single webhook delivery.
 *
 * <p>Every call writes exactly one {@code webhook_delivery} row, whatever the outcome, and
 * never throws: timeouts, transport errors and non-2xx responses are reported through the
 * returned {@link DeliveryResult} and the delivery log. A failure to write the log row is
 * itself only logged.
 *
 * <p>Thread-safe; one instance is shared by {@link WebhookDeliveryWorker} and
 * {@link WebhookManager}.
 */
public final class WebhookSender {
  private static final Logger logger = Logger.getLogger(WebhookSender.class.getName());

  public static final String DEFAULT_USER_AGENT = "EventRelay-Webhook/1.0";
  public static final String DELIVERY_HEADER = "X-Webhook-Delivery";

  private final WebhookTransport transport;
  private final ConnectionProvider connectionProvider;
  private final WebhookDeliveryStore deliveryStore;
  private final JsonCodec jsonCodec;
  private final String userAgent;
  private final MetricsExporter metrics;

  private WebhookSender(Builder builder) {
    this.transport = Objects.requireNonNull(builder.transport, "transport");
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.deliveryStore = Objects.requireNonNull(builder.deliveryStore, "deliveryStore");
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    this.userAgent = builder.userAgent != null ? builder.userAgent : DEFAULT_USER_AGENT;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Delivers an outbox record to one endpoint.
   */
  public DeliveryResult deliver(OutboxRecord record, WebhookEndpoint endpoint) {
    return deliver(record.eventId(), WebhookPayloads.fromRecord(record), endpoint);
  }

  /**
   * Delivers a prepared body to one endpoint and logs the attempt under {@code eventId}.
   *
   * @param eventId  event id recorded on the delivery row
   * @param body     the webhook body, serialized in iteration order
   * @param endpoint the target endpoint
   * @return the outcome; never {@code null}
   */
  public DeliveryResult deliver(String eventId, Map<String, Object> body, WebhookEndpoint endpoint) {
    String url = endpoint.url();
    String json;
    byte[] bytes;
    Map<String, String> headers;
    try {
      json = jsonCodec.toJson(body);
      bytes = json.getBytes(StandardCharsets.UTF_8);
      headers = headers(endpoint, bytes);
    } catch (RuntimeException e) {
      String error = "Webhook delivery error to " + url + ": " + e.getMessage();
      logger.log(Level.SEVERE, error, e);
      Long id = log(endpoint, eventId, null, Map.of(), null, false, error, null, null);
      metrics.incrementWebhookFailure();
      return new DeliveryResult(id, false, null, null, null, error, false);
    }

    WebhookRequest request = new WebhookRequest(url, headers, bytes,
        Duration.ofSeconds(endpoint.timeoutSeconds()));
    long start = System.nanoTime();
    try {
      WebhookResponse response = transport.post(request);
      long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
      boolean success = response.successful();
      String error = success ? null : "HTTP " + response.statusCode();
      Long id = log(endpoint, eventId, json, headers, response, success, error, durationMs,
          response.headers());
      metrics.recordWebhookDurationMs(durationMs);
      if (success) {
        metrics.incrementWebhookSuccess();
        logger.log(Level.INFO, "Webhook delivered successfully to {0} for event {1}",
            new Object[]{url, eventId});
      } else {
        metrics.incrementWebhookFailure();
        logger.log(Level.WARNING, "Webhook delivery failed with status {0} to {1}",
            new Object[]{response.statusCode(), url});
      }
      return new DeliveryResult(id, success, response.statusCode(), truncate(response.body()),
          durationMs, error, false);
    } catch (HttpTimeoutException e) {
      String error = "Webhook delivery timeout to " + url;
      logger.log(Level.WARNING, error);
      return failed(endpoint, eventId, json, headers, error, true);
    } catch (IOException | RuntimeException e) {
      String error = "Webhook delivery error to " + url + ": " + e.getMessage();
      logger.log(Level.SEVERE, error, e);
      return failed(endpoint, eventId, json, headers, error, false);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      String error = "Webhook delivery error to " + url + ": interrupted";
      logger.log(Level.WARNING, error);
      return failed(endpoint, eventId, json, headers, error, false);
    }
  }

  private DeliveryResult failed(WebhookEndpoint endpoint, String eventId, String json,
      Map<String, String> headers, String error, boolean timedOut) {
    Long id = log(endpoint, eventId, json, headers, null, false, error, null, null);
    metrics.incrementWebhookFailure();
    return new DeliveryResult(id, false, null, null, null, error, timedOut);
  }

  private Map<String, String> headers(WebhookEndpoint endpoint, byte[] body) {
    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json");
    headers.put("User-Agent", userAgent);
    headers.put(DELIVERY_HEADER, Long.toString(Instant.now().getEpochSecond()));
    if (endpoint.signed()) {
      headers.put(WebhookSigner.SIGNATURE_HEADER, WebhookSigner.sign(endpoint.secret(), body));
    }
    return Collections.unmodifiableMap(headers);
  }

  private Long log(WebhookEndpoint endpoint, String eventId, String json,
      Map<String, String> headers, WebhookResponse response, boolean success, String error,
      Long durationMs, Map<String, String> responseHeaders) {
    WebhookDelivery delivery = new WebhookDelivery(
        null,
        endpoint.id(),
        eventId,
        endpoint.url(),
        headers,
        json,
        response == null ? null : response.statusCode(),
        response == null ? null : response.body(),
        responseHeaders,
        durationMs,
        success,
        error,
        Instant.now());
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deliveryStore.insert(conn, delivery);
    } catch (SQLException | RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to log webhook delivery for event " + eventId
          + " to endpoint " + endpoint.id(), e);
      return null;
    }
  }

  private static String truncate(String body) {
    if (body == null || body.length() <= WebhookDelivery.MAX_RESPONSE_BODY_LENGTH) {
      return body;
    }
    return body.substring(0, WebhookDelivery.MAX_RESPONSE_BODY_LENGTH);
  }

  /** Builder for {@link WebhookSender}. */
  public static final class Builder {
    private WebhookTransport transport;
    private ConnectionProvider connectionProvider;
    private WebhookDeliveryStore deliveryStore;
    private JsonCodec jsonCodec;
    private String userAgent;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * <p><b>Required.</b> Typically {@link HttpClientWebhookTransport}.
     *
     * @param transport the HTTP transport
     * @return this builder
     */
    public Builder transport(WebhookTransport transport) {
      this.transport = transport;
      return this;
    }

    /**
     * <p><b>Required.</b> Used to write delivery rows.
     *
     * @param connectionProvider the connection provider
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * <p><b>Required.</b>
     *
     * @param deliveryStore the delivery log store
     * @return this builder
     */
    public Builder deliveryStore(WebhookDeliveryStore deliveryStore) {
      this.deliveryStore = deliveryStore;
      return this;
    }

    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the {@code User-Agent} header.
     *
     * <p>Optional. Defaults to {@code EventRelay-Webhook/1.0}.
     *
     * @param userAgent the user agent
     * @return this builder
     */
    public Builder userAgent(String userAgent) {
      this.userAgent = userAgent;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public WebhookSender build() {
      return new WebhookSender(this);
    }
  }
}
