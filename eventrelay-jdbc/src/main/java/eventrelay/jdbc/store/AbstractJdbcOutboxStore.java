package eventrelay.jdbc.store;

import eventrelay.jdbc.JdbcTemplate;
import eventrelay.jdbc.TableNames;
import eventrelay.model.EventStatus;
import eventrelay.model.OutboxRecord;
import eventrelay.spi.OutboxStore;
import eventrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Base JDBC outbox store with standard SQL implementations.
 *
 * <p>Every status update carries a {@code status IN (...)} guard built from
 * {@link EventStatus#sourcesOf(EventStatus)}. Subclasses override {@link #claimPending} and
 * {@link #purgePublished} where the database offers better syntax. Register custom
 * implementations via {@code META-INF/services/eventrelay.jdbc.store.AbstractJdbcOutboxStore}.
 *
 * @see JdbcOutboxStores
 */
public abstract class AbstractJdbcOutboxStore implements OutboxStore {

  protected static final String COLUMNS =
      "event_id, event_type, aggregate_type, aggregate_id, payload, metadata, tenant_id, " +
      "occurred_at, status, retry_count, max_retries, created_at, processed_at, next_retry_at, " +
      "last_error, locked_at, delivered_at, next_delivery_at";

  private final String tableName;
  private final JsonCodec jsonCodec;

  protected AbstractJdbcOutboxStore() {
    this(TableNames.OUTBOX_EVENT);
  }

  protected AbstractJdbcOutboxStore(String tableName) {
    this(tableName, JsonCodec.getDefault());
  }

  protected AbstractJdbcOutboxStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /**
   * Unique identifier for this outbox store (e.g., "mysql", "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this outbox store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Returns a copy of this store that serializes payloads with the given codec.
   */
  public abstract AbstractJdbcOutboxStore withJsonCodec(JsonCodec jsonCodec);

  protected String tableName() {
    return tableName;
  }

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  /** Renders {@code (c1,c2,...)} for the statuses a transition into {@code target} may start from. */
  protected static String sourcesIn(EventStatus target) {
    StringJoiner joiner = new StringJoiner(",", "(", ")");
    for (EventStatus status : EventStatus.sourcesOf(target)) {
      joiner.add(Integer.toString(status.code()));
    }
    return joiner.toString();
  }

  /**
   * Eligibility predicate shared by {@link #listPending} and the claim implementations: PENDING,
   * or RETRYING and due. Binds one parameter ({@code now}).
   */
  protected static String eligibleClause() {
    return "(status=" + EventStatus.PENDING.code() +
        " OR (status=" + EventStatus.RETRYING.code() +
        " AND (next_retry_at IS NULL OR next_retry_at <= ?)))";
  }

  /** Appends {@code AND event_type IN (?,...)} and its parameters when a filter is given. */
  protected static String typeFilter(Collection<String> eventTypes, List<Object> params) {
    if (eventTypes == null || eventTypes.isEmpty()) {
      return "";
    }
    StringJoiner joiner = new StringJoiner(",", " AND event_type IN (", ")");
    for (String type : eventTypes) {
      joiner.add("?");
      params.add(type);
    }
    return joiner.toString();
  }

  protected OutboxRecord mapRecord(ResultSet rs) throws SQLException {
    return new OutboxRecord(
        rs.getString("event_id"),
        rs.getString("event_type"),
        rs.getString("aggregate_type"),
        rs.getString("aggregate_id"),
        jsonCodec.parseObject(rs.getString("payload")),
        jsonCodec.parseObject(rs.getString("metadata")),
        JdbcTemplate.nullableLong(rs, "tenant_id"),
        JdbcTemplate.instant(rs, "occurred_at"),
        EventStatus.fromCode(rs.getInt("status")),
        rs.getInt("retry_count"),
        rs.getInt("max_retries"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "processed_at"),
        JdbcTemplate.instant(rs, "next_retry_at"),
        rs.getString("last_error"),
        JdbcTemplate.instant(rs, "locked_at"),
        JdbcTemplate.instant(rs, "delivered_at"),
        JdbcTemplate.instant(rs, "next_delivery_at"));
  }

  @Override
  public void insert(Connection conn, OutboxRecord record) {
    String sql = "INSERT INTO " + tableName() + " (" + COLUMNS + ") " +
        "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        record.eventId(), record.eventType(), record.aggregateType(), record.aggregateId(),
        jsonCodec.toJson(record.payload()), jsonCodec.toJson(record.metadata()),
        record.tenantId(), Timestamp.from(record.occurredAt()),
        record.status().code(), record.retryCount(), record.maxRetries(),
        Timestamp.from(record.createdAt()), JdbcTemplate.timestamp(record.processedAt()),
        JdbcTemplate.timestamp(record.nextRetryAt()), OutboxRecord.truncateError(record.lastError()),
        JdbcTemplate.timestamp(record.lockedAt()), JdbcTemplate.timestamp(record.deliveredAt()),
        JdbcTemplate.timestamp(record.nextDeliveryAt()));
  }

  @Override
  public Optional<OutboxRecord> findById(Connection conn, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() + " WHERE event_id=?";
    return JdbcTemplate.query(conn, sql, this::mapRecord, eventId).stream().findFirst();
  }

  @Override
  public List<OutboxRecord> listPending(Connection conn, Instant now, int limit,
      Collection<String> eventTypes) {
    List<Object> params = new ArrayList<>();
    params.add(Timestamp.from(now));
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE " + eligibleClause() + typeFilter(eventTypes, params) +
        " ORDER BY created_at, event_id LIMIT ?";
    params.add(limit);
    return JdbcTemplate.query(conn, sql, this::mapRecord, params.toArray());
  }

  @Override
  public int markProcessing(Connection conn, String eventId, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.PROCESSING.code() + ", locked_at=?" +
        " WHERE event_id=? AND status IN " + sourcesIn(EventStatus.PROCESSING);
    return JdbcTemplate.update(conn, sql, Timestamp.from(now), eventId);
  }

  @Override
  public int markPublished(Connection conn, String eventId, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.PUBLISHED.code() +
        ", processed_at=?, next_retry_at=NULL, locked_at=NULL" +
        " WHERE event_id=? AND status IN " + sourcesIn(EventStatus.PUBLISHED);
    return JdbcTemplate.update(conn, sql, Timestamp.from(now), eventId);
  }

  @Override
  public int markRetrying(Connection conn, String eventId, Instant nextRetryAt, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.RETRYING.code() +
        ", retry_count=retry_count+1, next_retry_at=?, last_error=?, locked_at=NULL" +
        " WHERE event_id=? AND status IN " + sourcesIn(EventStatus.RETRYING);
    return JdbcTemplate.update(conn, sql,
        Timestamp.from(nextRetryAt), OutboxRecord.truncateError(error), eventId);
  }

  @Override
  public int markFailed(Connection conn, String eventId, String error) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.FAILED.code() +
        ", retry_count=retry_count+1, next_retry_at=NULL, last_error=?, locked_at=NULL" +
        " WHERE event_id=? AND status IN " + sourcesIn(EventStatus.FAILED);
    return JdbcTemplate.update(conn, sql, OutboxRecord.truncateError(error), eventId);
  }

  @Override
  public int releaseStale(Connection conn, Instant lockedBefore, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.RETRYING.code() + ", next_retry_at=?, locked_at=NULL" +
        " WHERE status=" + EventStatus.PROCESSING.code() + " AND locked_at < ?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(now), Timestamp.from(lockedBefore));
  }

  @Override
  public int releaseClaim(Connection conn, String eventId, Instant now) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.RETRYING.code() + ", next_retry_at=?, locked_at=NULL" +
        " WHERE event_id=? AND status=" + EventStatus.PROCESSING.code();
    return JdbcTemplate.update(conn, sql, Timestamp.from(now), eventId);
  }

  @Override
  public List<OutboxRecord> listUndelivered(Connection conn, Instant now, int limit) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName() +
        " WHERE status=" + EventStatus.PUBLISHED.code() + " AND delivered_at IS NULL" +
        " AND (next_delivery_at IS NULL OR next_delivery_at <= ?)" +
        " ORDER BY created_at, event_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapRecord, Timestamp.from(now), limit);
  }

  @Override
  public int scheduleDelivery(Connection conn, String eventId, Instant nextDeliveryAt) {
    String sql = "UPDATE " + tableName() + " SET next_delivery_at=?" +
        " WHERE event_id=? AND status=" + EventStatus.PUBLISHED.code() +
        " AND delivered_at IS NULL";
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(nextDeliveryAt), eventId);
  }

  @Override
  public int markDelivered(Connection conn, String eventId, Instant now) {
    String sql = "UPDATE " + tableName() + " SET delivered_at=?, next_delivery_at=NULL" +
        " WHERE event_id=? AND status=" + EventStatus.PUBLISHED.code() +
        " AND delivered_at IS NULL";
    return JdbcTemplate.update(conn, sql, Timestamp.from(now), eventId);
  }

  @Override
  public List<OutboxRecord> queryFailed(Connection conn, String eventType, int limit) {
    List<Object> params = new ArrayList<>();
    StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS).append(" FROM ")
        .append(tableName()).append(" WHERE status=").append(EventStatus.FAILED.code());
    if (eventType != null) {
      sql.append(" AND event_type=?");
      params.add(eventType);
    }
    sql.append(" ORDER BY created_at, event_id LIMIT ?");
    params.add(limit);
    return JdbcTemplate.query(conn, sql.toString(), this::mapRecord, params.toArray());
  }

  @Override
  public int countFailed(Connection conn, String eventType) {
    String sql = "SELECT COUNT(*) FROM " + tableName() +
        " WHERE status=" + EventStatus.FAILED.code() + (eventType != null ? " AND event_type=?" : "");
    Object[] params = eventType != null ? new Object[]{eventType} : new Object[0];
    List<Integer> counts = JdbcTemplate.query(conn, sql, rs -> rs.getInt(1), params);
    return counts.isEmpty() ? 0 : counts.get(0);
  }

  @Override
  public int replayFailed(Connection conn, String eventId) {
    String sql = "UPDATE " + tableName() +
        " SET status=" + EventStatus.PENDING.code() +
        ", retry_count=0, next_retry_at=NULL, last_error=NULL, locked_at=NULL" +
        " WHERE event_id=? AND status IN " + sourcesIn(EventStatus.PENDING);
    return JdbcTemplate.update(conn, sql, eventId);
  }

  /**
   * Deletes PUBLISHED records processed before {@code before}, up to {@code limit} rows.
   *
   * <p>Default implementation uses a subquery to limit the batch size, which works for H2 and
   * PostgreSQL. MySQL overrides with {@code DELETE ... ORDER BY ... LIMIT}.
   */
  @Override
  public int purgePublished(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() + " WHERE event_id IN (" +
        "SELECT event_id FROM " + tableName() +
        " WHERE status=" + EventStatus.PUBLISHED.code() + " AND processed_at < ?" +
        " ORDER BY processed_at LIMIT ?)";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }
}
