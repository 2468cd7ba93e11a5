package eventrelay.webhook;

import eventrelay.DomainEventType;
import eventrelay.model.OutboxRecord;
import eventrelay.model.WebhookEndpoint;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds webhook bodies. Field order is fixed:
 * {@code event_id, event_type, aggregate_type, aggregate_id, payload, metadata, timestamp,
 * tenant_id}.
 */
public final class WebhookPayloads {

  private WebhookPayloads() {}

  /**
   * Builds the body for an outbox record. {@code timestamp} is the ISO-8601 occurrence time.
   */
  public static Map<String, Object> fromRecord(OutboxRecord record) {
    return body(record.eventId(), record.eventType(), record.aggregateType(),
        record.aggregateId(), record.payload(), record.metadata(), record.occurredAt(),
        record.tenantId());
  }

  /**
   * Builds the synthetic {@code webhook.test} body sent by
   * {@link WebhookManager#testEndpoint(long)}.
   */
  public static Map<String, Object> testBody(String eventId, WebhookEndpoint endpoint, Instant now) {
    return body(eventId, DomainEventType.WEBHOOK_TEST.value(), "test", "test-123",
        Map.of("message", "This is a test webhook delivery"), Map.of("test", true), now,
        endpoint.tenantId());
  }

  private static Map<String, Object> body(String eventId, String eventType, String aggregateType,
      String aggregateId, Map<String, Object> payload, Map<String, Object> metadata,
      Instant timestamp, Long tenantId) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("event_id", eventId);
    body.put("event_type", eventType);
    body.put("aggregate_type", aggregateType);
    body.put("aggregate_id", aggregateId);
    body.put("payload", payload == null ? Map.of() : payload);
    body.put("metadata", metadata == null ? Map.of() : metadata);
    body.put("timestamp", timestamp == null ? null : timestamp.toString());
    body.put("tenant_id", tenantId);
    return body;
  }
}
