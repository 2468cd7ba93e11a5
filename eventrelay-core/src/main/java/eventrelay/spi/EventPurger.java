package eventrelay.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes one batch of rows older than a cutoff.
 *
 * <p>Satisfied by {@link OutboxStore#purgePublished} and {@link WebhookDeliveryStore#purgeBefore}
 * method references.
 *
 * @see eventrelay.purge.PurgeScheduler
 */
@FunctionalInterface
public interface EventPurger {

  /**
   * @param conn   the JDBC connection (caller controls transaction)
   * @param before delete rows older than this instant
   * @param limit  maximum number of rows to delete in this batch
   * @return the number of rows actually deleted
   */
  int purge(Connection conn, Instant before, int limit);
}
