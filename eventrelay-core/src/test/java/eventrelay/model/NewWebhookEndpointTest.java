package eventrelay.model;

import eventrelay.DomainEventType;
import eventrelay.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NewWebhookEndpointTest {

  @Test
  void defaults() {
    NewWebhookEndpoint endpoint = NewWebhookEndpoint.builder()
        .url("https://hooks.example.com/desk")
        .eventTypes("ticket.created")
        .build();

    assertEquals("https://hooks.example.com/desk", endpoint.name());
    assertNull(endpoint.secret());
    assertTrue(endpoint.active());
    assertEquals(30, endpoint.timeoutSeconds());
    assertEquals(3, endpoint.maxRetries());
    assertNull(endpoint.tenantId());
  }

  @Test
  void blankEventTypesAreDroppedAndDuplicatesCollapsed() {
    NewWebhookEndpoint endpoint = NewWebhookEndpoint.builder()
        .url("http://localhost/hook")
        .eventTypes(List.of("ticket.created", " ", "ticket.created"))
        .eventType(DomainEventType.ASSET_CREATED)
        .build();
    assertEquals(Set.of("ticket.created", "asset.created"), endpoint.eventTypes());
  }

  @Test
  void emptySecretMeansUnsigned() {
    NewWebhookEndpoint endpoint = NewWebhookEndpoint.builder()
        .url("http://localhost/hook")
        .secret("")
        .eventTypes("ticket.created")
        .build();
    assertNull(endpoint.secret());
  }

  @Test
  void rejectsNonHttpUrls() {
    assertThrows(ValidationException.class, () -> NewWebhookEndpoint.builder()
        .url("ftp://example.com")
        .eventTypes("ticket.created")
        .build());
    assertThrows(ValidationException.class, () -> NewWebhookEndpoint.builder()
        .eventTypes("ticket.created")
        .build());
  }

  @Test
  void rejectsEmptySubscription() {
    ValidationException e = assertThrows(ValidationException.class,
        () -> NewWebhookEndpoint.builder().url("https://example.com").eventTypes(" ").build());
    assertEquals("At least one event type must be specified", e.getMessage());
  }

  @Test
  void rejectsOutOfRangeNumbers() {
    assertThrows(ValidationException.class, () -> NewWebhookEndpoint.builder()
        .url("https://example.com").eventTypes("a").timeoutSeconds(0).build());
    assertThrows(ValidationException.class, () -> NewWebhookEndpoint.builder()
        .url("https://example.com").eventTypes("a").maxRetries(-1).build());
  }
}
