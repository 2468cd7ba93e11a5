package eventrelay.spi;

import eventrelay.model.OutboxRecord;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract for {@code outbox_event} rows.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls transaction
 * boundaries. Every status update is guarded by the legal source statuses of its target
 * (see {@link eventrelay.model.EventStatus#sourcesOf}) and returns the number of rows updated,
 * so an illegal or lost transition yields {@code 0}.
 *
 * @see eventrelay.jdbc.store.AbstractJdbcOutboxStore
 */
public interface OutboxStore {

  /**
   * Inserts a new record. The record's status is expected to be PENDING.
   *
   * @param conn   the JDBC connection (typically the caller's transaction)
   * @param record the record to persist
   */
  void insert(Connection conn, OutboxRecord record);

  Optional<OutboxRecord> findById(Connection conn, String eventId);

  /**
   * Returns PENDING records and RETRYING records that are due, oldest first.
   *
   * @param conn       the JDBC connection
   * @param now        reference time for {@code next_retry_at}
   * @param limit      maximum number of records
   * @param eventTypes optional type filter; {@code null} or empty for all types
   * @return eligible records ordered by {@code created_at}
   */
  List<OutboxRecord> listPending(Connection conn, Instant now, int limit,
      Collection<String> eventTypes);

  /**
   * Atomically moves eligible records to PROCESSING and returns them.
   *
   * <p>The default lists and claims row by row; only the rows whose conditional update succeeded
   * are returned. Database-specific stores override this with row-level locking.
   *
   * @param conn       the JDBC connection
   * @param now        claim time (also recorded as {@code locked_at})
   * @param limit      maximum number of records to claim
   * @param eventTypes optional type filter
   * @return the claimed records, with status PROCESSING
   */
  default List<OutboxRecord> claimPending(Connection conn, Instant now, int limit,
      Collection<String> eventTypes) {
    List<OutboxRecord> claimed = new ArrayList<>();
    for (OutboxRecord record : listPending(conn, now, limit, eventTypes)) {
      if (markProcessing(conn, record.eventId(), now) > 0) {
        findById(conn, record.eventId()).ifPresent(claimed::add);
      }
    }
    return claimed;
  }

  /** PENDING | RETRYING -&gt; PROCESSING, recording {@code locked_at}. */
  int markProcessing(Connection conn, String eventId, Instant now);

  /** PROCESSING -&gt; PUBLISHED, recording {@code processed_at}. */
  int markPublished(Connection conn, String eventId, Instant now);

  /**
   * PROCESSING -&gt; RETRYING. Implementations must increment {@code retry_count}.
   */
  int markRetrying(Connection conn, String eventId, Instant nextRetryAt, String error);

  /**
   * PROCESSING -&gt; FAILED. Implementations must increment {@code retry_count} and clear
   * {@code next_retry_at}.
   */
  int markFailed(Connection conn, String eventId, String error);

  /**
   * Moves PROCESSING records locked before {@code lockedBefore} to RETRYING, due at
   * {@code now}, without touching {@code retry_count}.
   *
   * @return the number of recovered records
   */
  int releaseStale(Connection conn, Instant lockedBefore, Instant now);

  /**
   * PROCESSING -&gt; RETRYING for one record, due at {@code now}, without touching
   * {@code retry_count}. Used to hand back a claimed record that was never processed.
   */
  int releaseClaim(Connection conn, String eventId, Instant now);

  /**
   * Returns PUBLISHED records whose webhook fan-out has not completed and whose
   * {@code next_delivery_at} is null or not after {@code now}, oldest first.
   */
  List<OutboxRecord> listUndelivered(Connection conn, Instant now, int limit);

  /**
   * Sets {@code next_delivery_at} on a PUBLISHED record whose fan-out is still incomplete.
   *
   * @return the number of rows updated
   */
  int scheduleDelivery(Connection conn, String eventId, Instant nextDeliveryAt);

  /** Sets {@code delivered_at} on a PUBLISHED record. */
  int markDelivered(Connection conn, String eventId, Instant now);

  List<OutboxRecord> queryFailed(Connection conn, String eventType, int limit);

  int countFailed(Connection conn, String eventType);

  /**
   * FAILED -&gt; PENDING with {@code retry_count} reset and the error cleared.
   *
   * @return the number of rows updated (0 if missing or not FAILED)
   */
  int replayFailed(Connection conn, String eventId);

  /**
   * Deletes PUBLISHED records processed before the cutoff.
   *
   * @return the number of rows deleted (at most {@code limit})
   */
  int purgePublished(Connection conn, Instant before, int limit);
}
