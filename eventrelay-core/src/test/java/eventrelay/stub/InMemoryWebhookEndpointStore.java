package eventrelay.stub;

import eventrelay.model.NewWebhookEndpoint;
import eventrelay.model.WebhookEndpoint;
import eventrelay.spi.WebhookEndpointStore;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class InMemoryWebhookEndpointStore implements WebhookEndpointStore {
  private final Map<Long, WebhookEndpoint> endpoints = new TreeMap<>();
  private long nextId = 1;

  @Override
  public synchronized WebhookEndpoint insert(Connection conn, NewWebhookEndpoint endpoint,
      Instant now) {
    WebhookEndpoint stored = new WebhookEndpoint(nextId++, endpoint.name(), endpoint.url(),
        endpoint.secret(), endpoint.eventTypes(), endpoint.active(), endpoint.timeoutSeconds(),
        endpoint.maxRetries(), endpoint.tenantId(), now, now);
    endpoints.put(stored.id(), stored);
    return stored;
  }

  @Override
  public synchronized Optional<WebhookEndpoint> findById(Connection conn, long id) {
    return Optional.ofNullable(endpoints.get(id));
  }

  @Override
  public synchronized List<WebhookEndpoint> findActive(Connection conn) {
    return endpoints.values().stream().filter(WebhookEndpoint::active).toList();
  }

  @Override
  public synchronized List<WebhookEndpoint> findAll(Connection conn, Long tenantId) {
    return endpoints.values().stream()
        .filter(e -> tenantId == null || tenantId.equals(e.tenantId()))
        .toList();
  }

  @Override
  public synchronized int updateActive(Connection conn, long id, boolean active, Instant now) {
    WebhookEndpoint e = endpoints.get(id);
    if (e == null) {
      return 0;
    }
    endpoints.put(id, new WebhookEndpoint(e.id(), e.name(), e.url(), e.secret(), e.eventTypes(),
        active, e.timeoutSeconds(), e.maxRetries(), e.tenantId(), e.createdAt(), now));
    return 1;
  }

  @Override
  public synchronized int delete(Connection conn, long id) {
    return endpoints.remove(id) != null ? 1 : 0;
  }
}
