package eventrelay.webhook;

import eventrelay.model.EventStatus;
import eventrelay.model.OutboxRecord;
import eventrelay.model.WebhookEndpoint;
import eventrelay.util.JsonCodec;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;

class WebhookPayloadsTest {

  private static final Instant OCCURRED = Instant.parse("2024-06-10T08:00:00Z");

  @Test
  void recordBodyHasFixedFieldOrder() {
    OutboxRecord record = new OutboxRecord("e-1", "ticket.created", "ticket", "42",
        Map.of("ticket_id", 42), Map.of(), 1L, OCCURRED, EventStatus.PUBLISHED, 0, 3,
        OCCURRED.plusSeconds(1), OCCURRED.plusSeconds(2), null, null, null, null, null);

    Map<String, Object> body = WebhookPayloads.fromRecord(record);

    assertEquals(List.of("event_id", "event_type", "aggregate_type", "aggregate_id", "payload",
        "metadata", "timestamp", "tenant_id"), List.copyOf(body.keySet()));
    assertEquals("2024-06-10T08:00:00Z", body.get("timestamp"));
    assertEquals(
        "{\"event_id\":\"e-1\",\"event_type\":\"ticket.created\",\"aggregate_type\":\"ticket\","
            + "\"aggregate_id\":\"42\",\"payload\":{\"ticket_id\":42},\"metadata\":{},"
            + "\"timestamp\":\"2024-06-10T08:00:00Z\",\"tenant_id\":1}",
        JsonCodec.getDefault().toJson(body));
  }

  @Test
  void testBodyUsesTheEndpointTenant() {
    WebhookEndpoint endpoint = new WebhookEndpoint(4, "desk", "https://example.com", null,
        Set.of("ticket.created"), true, 30, 3, 9L, OCCURRED, OCCURRED);

    Map<String, Object> body = WebhookPayloads.testBody("t-1", endpoint, OCCURRED);

    assertEquals("webhook.test", body.get("event_type"));
    assertEquals("test", body.get("aggregate_type"));
    assertEquals("test-123", body.get("aggregate_id"));
    assertEquals(Map.of("message", "This is a test webhook delivery"), body.get("payload"));
    assertEquals(Map.of("test", true), body.get("metadata"));
    assertEquals(9L, body.get("tenant_id"));
  }
}
