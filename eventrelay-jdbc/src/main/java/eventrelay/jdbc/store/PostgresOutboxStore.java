package eventrelay.jdbc.store;

import eventrelay.jdbc.JdbcTemplate;
import eventrelay.model.EventStatus;
import eventrelay.model.OutboxRecord;
import eventrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * PostgreSQL outbox store.
 *
 * <p>Claims with {@code FOR UPDATE SKIP LOCKED} and {@code RETURNING} in a single round-trip,
 * so several poller instances can share one table.
 */
public final class PostgresOutboxStore extends AbstractJdbcOutboxStore {

  public PostgresOutboxStore() {
    super();
  }

  public PostgresOutboxStore(String tableName) {
    super(tableName);
  }

  public PostgresOutboxStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcOutboxStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresOutboxStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<OutboxRecord> claimPending(Connection conn, Instant now, int limit,
      Collection<String> eventTypes) {
    List<Object> params = new ArrayList<>();
    params.add(Timestamp.from(now));
    params.add(Timestamp.from(now));
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.PROCESSING.code() + ", locked_at=?" +
        " WHERE event_id IN (" +
        "SELECT event_id FROM " + tableName() +
        " WHERE " + eligibleClause() + typeFilter(eventTypes, params) +
        " ORDER BY created_at LIMIT ?" +
        " FOR UPDATE SKIP LOCKED" +
        ") RETURNING " + COLUMNS;
    params.add(limit);
    return JdbcTemplate.updateReturning(conn, sql, this::mapRecord, params.toArray());
  }
}
