package eventrelay.spi;

import eventrelay.model.NewWebhookEndpoint;
import eventrelay.model.WebhookEndpoint;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for {@code webhook_endpoint} rows.
 */
public interface WebhookEndpointStore {

  WebhookEndpoint insert(Connection conn, NewWebhookEndpoint endpoint, Instant now);

  Optional<WebhookEndpoint> findById(Connection conn, long id);

  List<WebhookEndpoint> findActive(Connection conn);

  /**
   * Lists endpoints ordered by id.
   *
   * @param tenantId restrict to one tenant's endpoints; {@code null} lists all endpoints
   */
  List<WebhookEndpoint> findAll(Connection conn, Long tenantId);

  int updateActive(Connection conn, long id, boolean active, Instant now);

  int delete(Connection conn, long id);
}
