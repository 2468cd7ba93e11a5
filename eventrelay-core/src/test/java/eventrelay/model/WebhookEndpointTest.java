package eventrelay.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WebhookEndpointTest {

  @Test
  void globalEndpointMatchesEveryTenant() {
    WebhookEndpoint global = endpoint(null);
    assertTrue(global.matches("ticket.created", 5L));
    assertTrue(global.matches("ticket.created", null));
  }

  @Test
  void tenantEndpointMatchesOnlyItsTenant() {
    assertTrue(endpoint(5L).matches("ticket.created", 5L));
    assertFalse(endpoint(7L).matches("ticket.created", 5L));
    assertFalse(endpoint(5L).matches("ticket.created", null));
  }

  @Test
  void unsubscribedTypeNeverMatches() {
    assertFalse(endpoint(null).matches("asset.created", 5L));
  }

  @Test
  void secretStaysOutOfToString() {
    WebhookEndpoint endpoint = new WebhookEndpoint(1, "desk", "https://example.com", "s3cr3t",
        Set.of("ticket.created"), true, 30, 3, null, Instant.now(), Instant.now());
    assertTrue(endpoint.signed());
    assertFalse(endpoint.toString().contains("s3cr3t"));
  }

  private static WebhookEndpoint endpoint(Long tenantId) {
    return new WebhookEndpoint(1, "desk", "https://example.com", null, Set.of("ticket.created"),
        true, 30, 3, tenantId, Instant.now(), Instant.now());
  }
}
