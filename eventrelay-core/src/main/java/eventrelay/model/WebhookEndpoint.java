package eventrelay.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;

/**
 * A registered webhook subscriber, as stored in {@code webhook_endpoint}.
 *
 * <p>An endpoint with a {@code null} tenant is global and receives the events of every tenant.
 * Endpoints scoped to a tenant only receive that tenant's events.
 *
 * @param id             generated identifier
 * @param name           display name
 * @param url            absolute {@code http://} or {@code https://} target
 * @param secret         HMAC signing key, or {@code null} for unsigned deliveries
 * @param eventTypes     subscribed event types (never empty)
 * @param active         whether the delivery worker considers this endpoint
 * @param timeoutSeconds per-request timeout
 * @param maxRetries     retries allowed after a failed first attempt, per event
 * @param tenantId       owning tenant, or {@code null} for a global endpoint
 * @param createdAt      creation time
 * @param updatedAt      last modification time
 */
public record WebhookEndpoint(
    long id,
    String name,
    String url,
    String secret,
    Set<String> eventTypes,
    boolean active,
    int timeoutSeconds,
    int maxRetries,
    Long tenantId,
    Instant createdAt,
    Instant updatedAt
) {

  public WebhookEndpoint {
    Objects.requireNonNull(url, "url");
    eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
  }

  /**
   * Returns whether this endpoint should receive an event of the given type and tenant.
   *
   * @param eventType      the event type
   * @param eventTenantId  the event's tenant, may be {@code null}
   * @return {@code true} if the type is subscribed and the tenant scope matches
   */
  public boolean matches(String eventType, Long eventTenantId) {
    if (!eventTypes.contains(eventType)) {
      return false;
    }
    return tenantId == null || tenantId.equals(eventTenantId);
  }

  public boolean signed() {
    return secret != null && !secret.isEmpty();
  }

  @Override
  public String toString() {
    // keep the secret out of logs
    return "WebhookEndpoint{id=" + id + ", name=" + name + ", url=" + url
        + ", eventTypes=" + eventTypes + ", active=" + active + ", tenantId=" + tenantId + '}';
  }
}
