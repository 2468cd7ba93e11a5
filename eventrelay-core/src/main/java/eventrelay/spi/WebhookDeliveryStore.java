package eventrelay.spi;

import eventrelay.model.AttemptSummary;
import eventrelay.model.DeliveryTotals;
import eventrelay.model.WebhookDelivery;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persistence contract for the append-only {@code webhook_delivery} log.
 */
public interface WebhookDeliveryStore {

  /**
   * Appends one attempt.
   *
   * @return the generated row id
   */
  long insert(Connection conn, WebhookDelivery delivery);

  /**
   * Summarizes the attempts made for one event, keyed by endpoint id.
   */
  Map<Long, AttemptSummary> summarizeAttempts(Connection conn, String eventId);

  DeliveryTotals totals(Connection conn, long endpointId, Instant since);

  List<WebhookDelivery> findByEvent(Connection conn, String eventId);

  /**
   * Deletes attempts made before the cutoff.
   *
   * @return the number of rows deleted (at most {@code limit})
   */
  int purgeBefore(Connection conn, Instant before, int limit);
}
