package eventrelay.webhook;

import eventrelay.ValidationException;
import eventrelay.model.DeliveryResult;
import eventrelay.model.DeliveryStats;
import eventrelay.model.NewWebhookEndpoint;
import eventrelay.model.WebhookDelivery;
import eventrelay.model.WebhookEndpoint;
import eventrelay.stub.Connections;
import eventrelay.stub.InMemoryWebhookDeliveryStore;
import eventrelay.stub.InMemoryWebhookEndpointStore;
import eventrelay.stub.RecordingTransport;
import eventrelay.util.JsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookManagerTest {

  private InMemoryWebhookEndpointStore endpoints;
  private InMemoryWebhookDeliveryStore deliveries;
  private RecordingTransport transport;
  private WebhookManager manager;

  @BeforeEach
  void setUp() {
    endpoints = new InMemoryWebhookEndpointStore();
    deliveries = new InMemoryWebhookDeliveryStore();
    transport = new RecordingTransport();
    WebhookSender sender = WebhookSender.builder()
        .transport(transport)
        .connectionProvider(Connections.dummyProvider())
        .deliveryStore(deliveries)
        .build();
    manager = new WebhookManager(Connections.dummyProvider(), endpoints, deliveries, sender);
  }

  @Test
  void createAndListEndpoints() {
    WebhookEndpoint desk = manager.createEndpoint(request("desk", 1L));
    manager.createEndpoint(request("crm", 2L));
    manager.createEndpoint(request("audit", null));

    assertEquals(desk, manager.findEndpoint(desk.id()).orElseThrow());
    assertEquals(3, manager.listEndpoints(null).size());
    assertEquals(List.of(desk), manager.listEndpoints(1L));
  }

  @Test
  void activateDeactivateAndDelete() {
    WebhookEndpoint desk = manager.createEndpoint(request("desk", null));

    assertTrue(manager.setActive(desk.id(), false));
    assertFalse(manager.findEndpoint(desk.id()).orElseThrow().active());
    assertFalse(manager.setActive(999L, true));

    assertTrue(manager.deleteEndpoint(desk.id()));
    assertFalse(manager.deleteEndpoint(desk.id()));
    assertTrue(manager.findEndpoint(desk.id()).isEmpty());
  }

  @Test
  void testEndpointSendsSyntheticEventEvenWhenInactive() {
    WebhookEndpoint desk = manager.createEndpoint(request("desk", 4L));
    manager.setActive(desk.id(), false);

    DeliveryResult result = manager.testEndpoint(desk.id());

    assertTrue(result.success());
    Map<String, Object> body = JsonCodec.getDefault().parseObject(
        new String(transport.requests().get(0).body(), StandardCharsets.UTF_8));
    assertEquals("webhook.test", body.get("event_type"));
    assertEquals(4, ((Number) body.get("tenant_id")).intValue());
    assertEquals(body.get("event_id"), deliveries.all().get(0).eventId());
  }

  @Test
  void eachTestUsesAFreshEventId() {
    WebhookEndpoint desk = manager.createEndpoint(request("desk", null));
    manager.testEndpoint(desk.id());
    manager.testEndpoint(desk.id());

    List<WebhookDelivery> rows = deliveries.all();
    assertNotEquals(rows.get(0).eventId(), rows.get(1).eventId());
  }

  @Test
  void testUnknownEndpointThrows() {
    ValidationException e = assertThrows(ValidationException.class, () -> manager.testEndpoint(77L));
    assertEquals("Webhook endpoint 77 not found", e.getMessage());
  }

  @Test
  void statsAggregateTheWindow() {
    long id = manager.createEndpoint(request("desk", null)).id();
    Instant now = Instant.now();
    log(id, true, 100L, now.minus(Duration.ofHours(1)));
    log(id, true, 200L, now.minus(Duration.ofDays(2)));
    log(id, false, null, now.minus(Duration.ofDays(3)));
    log(id, false, 300L, now.minus(Duration.ofDays(6)));
    log(id, true, 50L, now.minus(Duration.ofDays(10)));
    log(id + 1, true, 10L, now);

    DeliveryStats week = manager.stats(id);
    assertEquals(4, week.totalDeliveries());
    assertEquals(2, week.successfulDeliveries());
    assertEquals(2, week.failedDeliveries());
    assertEquals(0.5, week.successRate());
    assertEquals(200.0, week.averageDurationMs());
    assertEquals(7, week.periodDays());

    DeliveryStats day = manager.stats(id, 1);
    assertEquals(1, day.totalDeliveries());
    assertEquals(1.0, day.successRate());
  }

  @Test
  void statsOfIdleEndpointAreZero() {
    DeliveryStats stats = manager.stats(42L);
    assertEquals(0, stats.totalDeliveries());
    assertEquals(0.0, stats.successRate());
    assertThrows(IllegalArgumentException.class, () -> manager.stats(42L, 0));
  }

  @Test
  void databaseFailuresSurfaceAsIllegalState() {
    WebhookSender sender = WebhookSender.builder()
        .transport(transport)
        .connectionProvider(Connections.failingProvider())
        .deliveryStore(deliveries)
        .build();
    WebhookManager broken = new WebhookManager(Connections.failingProvider(), endpoints,
        deliveries, sender);

    assertThrows(IllegalStateException.class, () -> broken.createEndpoint(request("desk", null)));
    assertThrows(IllegalStateException.class, () -> broken.stats(1L));
  }

  private void log(long endpointId, boolean success, Long durationMs, Instant at) {
    deliveries.insert(null, new WebhookDelivery(null, endpointId, "e-" + at.toEpochMilli(),
        "https://example.com", Map.of(), "{}", success ? 200 : 500, null, Map.of(), durationMs,
        success, success ? null : "HTTP 500", at));
  }

  private static NewWebhookEndpoint request(String name, Long tenantId) {
    return NewWebhookEndpoint.builder()
        .name(name)
        .url("https://hooks.example.com/" + name)
        .secret("s3cr3t")
        .eventTypes("ticket.created")
        .tenantId(tenantId)
        .build();
  }
}
