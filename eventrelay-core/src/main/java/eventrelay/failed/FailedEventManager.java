package eventrelay.failed;

import eventrelay.model.OutboxRecord;
import eventrelay.spi.ConnectionProvider;
import eventrelay.spi.OutboxStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade for records that exhausted their retries.
 *
 * <p>Replaying moves a FAILED record back to PENDING with a fresh retry budget, so the poller
 * picks it up again. Manages connection lifecycle internally using a {@link ConnectionProvider}.
 *
 * @see OutboxStore#queryFailed
 * @see OutboxStore#replayFailed
 * @see OutboxStore#countFailed
 */
public final class FailedEventManager {
  private static final Logger logger = Logger.getLogger(FailedEventManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final OutboxStore outboxStore;

  public FailedEventManager(ConnectionProvider connectionProvider, OutboxStore outboxStore) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
  }

  /**
   * Queries FAILED records.
   *
   * @param eventType optional event type filter ({@code null} for all)
   * @param limit     maximum number of records to return
   * @return failed records, oldest first
   */
  public List<OutboxRecord> query(String eventType, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return outboxStore.queryFailed(conn, eventType, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to query failed events", e);
      return List.of();
    }
  }

  /**
   * Replays a single FAILED record.
   *
   * @param eventId the record to replay
   * @return {@code true} if replayed, {@code false} if missing or not FAILED
   */
  public boolean replay(String eventId) {
    try (Connection conn = connectionProvider.getConnection()) {
      boolean replayed = outboxStore.replayFailed(conn, eventId) > 0;
      if (replayed) {
        logger.log(Level.INFO, "Replayed failed event {0}", eventId);
      }
      return replayed;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to replay failed event: " + eventId, e);
      return false;
    }
  }

  /**
   * Replays every FAILED record of a type, in batches.
   *
   * @param eventType optional event type filter ({@code null} for all)
   * @param batchSize records per batch
   * @return total number of records replayed
   */
  public int replayAll(String eventType, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int totalReplayed = 0;
    List<OutboxRecord> batch;
    do {
      int batchReplayed = 0;
      try (Connection conn = connectionProvider.getConnection()) {
        batch = outboxStore.queryFailed(conn, eventType, batchSize);
        for (OutboxRecord record : batch) {
          if (outboxStore.replayFailed(conn, record.eventId()) > 0) {
            batchReplayed++;
          }
        }
      } catch (SQLException e) {
        logger.log(Level.SEVERE, "Failed to replay failed events batch", e);
        break;
      }
      totalReplayed += batchReplayed;
    } while (batch.size() >= batchSize);
    return totalReplayed;
  }

  /**
   * Counts FAILED records.
   *
   * @param eventType optional event type filter ({@code null} for all)
   * @return the number of failed records
   */
  public int count(String eventType) {
    try (Connection conn = connectionProvider.getConnection()) {
      return outboxStore.countFailed(conn, eventType);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count failed events", e);
      return 0;
    }
  }
}
