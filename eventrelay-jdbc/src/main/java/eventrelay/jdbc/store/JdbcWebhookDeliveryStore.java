package eventrelay.jdbc.store;

import eventrelay.jdbc.JdbcTemplate;
import eventrelay.jdbc.TableNames;
import eventrelay.model.AttemptSummary;
import eventrelay.model.DeliveryTotals;
import eventrelay.model.OutboxRecord;
import eventrelay.model.WebhookDelivery;
import eventrelay.spi.WebhookDeliveryStore;
import eventrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * {@link WebhookDeliveryStore} over the append-only {@code webhook_delivery} table.
 *
 * <p>Request and response headers are stored as JSON objects. Purging selects the ids first and
 * deletes them by key, which keeps the statement portable across H2, MySQL and PostgreSQL.
 */
public final class JdbcWebhookDeliveryStore implements WebhookDeliveryStore {

  private static final String COLUMNS =
      "id, endpoint_id, event_id, url, request_headers, payload, status_code, response_body, " +
      "response_headers, duration_ms, success, error_message, attempted_at";

  private final String tableName;
  private final JsonCodec jsonCodec;

  public JdbcWebhookDeliveryStore() {
    this(TableNames.WEBHOOK_DELIVERY, JsonCodec.getDefault());
  }

  public JdbcWebhookDeliveryStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public long insert(Connection conn, WebhookDelivery delivery) {
    String sql = "INSERT INTO " + tableName + " (" +
        "endpoint_id, event_id, url, request_headers, payload, status_code, response_body, " +
        "response_headers, duration_ms, success, error_message, attempted_at" +
        ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)";
    return JdbcTemplate.insertReturningKey(conn, sql,
        delivery.endpointId(), delivery.eventId(), delivery.url(),
        jsonCodec.toJson(delivery.headers()), delivery.payload(),
        delivery.statusCode(), delivery.responseBody(),
        jsonCodec.toJson(delivery.responseHeaders()), delivery.durationMs(),
        delivery.success(), OutboxRecord.truncateError(delivery.errorMessage()),
        Timestamp.from(delivery.attemptedAt()));
  }

  @Override
  public Map<Long, AttemptSummary> summarizeAttempts(Connection conn, String eventId) {
    String sql = "SELECT endpoint_id," +
        " SUM(CASE WHEN success THEN 0 ELSE 1 END) AS failures," +
        " SUM(CASE WHEN success THEN 1 ELSE 0 END) AS successes," +
        " MAX(attempted_at) AS last_attempt" +
        " FROM " + tableName + " WHERE event_id=? GROUP BY endpoint_id";
    Map<Long, AttemptSummary> summaries = new LinkedHashMap<>();
    JdbcTemplate.query(conn, sql, rs -> new AttemptSummary(
        rs.getLong("endpoint_id"),
        rs.getInt("failures"),
        rs.getInt("successes") > 0,
        JdbcTemplate.instant(rs, "last_attempt")), eventId)
        .forEach(summary -> summaries.put(summary.endpointId(), summary));
    return summaries;
  }

  @Override
  public DeliveryTotals totals(Connection conn, long endpointId, Instant since) {
    String sql = "SELECT COUNT(*) AS total," +
        " SUM(CASE WHEN success THEN 1 ELSE 0 END) AS successful," +
        " AVG(duration_ms) AS avg_duration" +
        " FROM " + tableName + " WHERE endpoint_id=? AND attempted_at >= ?";
    List<DeliveryTotals> rows = JdbcTemplate.query(conn, sql, rs -> new DeliveryTotals(
        rs.getLong("total"),
        rs.getLong("successful"),
        rs.getDouble("avg_duration")), endpointId, Timestamp.from(since));
    return rows.isEmpty() ? DeliveryTotals.EMPTY : rows.get(0);
  }

  @Override
  public List<WebhookDelivery> findByEvent(Connection conn, String eventId) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName +
        " WHERE event_id=? ORDER BY attempted_at, id";
    return JdbcTemplate.query(conn, sql, this::mapDelivery, eventId);
  }

  @Override
  public int purgeBefore(Connection conn, Instant before, int limit) {
    List<Long> ids = JdbcTemplate.query(conn,
        "SELECT id FROM " + tableName + " WHERE attempted_at < ? ORDER BY id LIMIT ?",
        rs -> rs.getLong(1), Timestamp.from(before), limit);
    if (ids.isEmpty()) {
      return 0;
    }
    StringJoiner in = new StringJoiner(",", "(", ")");
    ids.forEach(id -> in.add("?"));
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE id IN " + in,
        ids.toArray());
  }

  private WebhookDelivery mapDelivery(ResultSet rs) throws SQLException {
    return new WebhookDelivery(
        rs.getLong("id"),
        rs.getLong("endpoint_id"),
        rs.getString("event_id"),
        rs.getString("url"),
        jsonCodec.parseStringMap(rs.getString("request_headers")),
        rs.getString("payload"),
        JdbcTemplate.nullableInt(rs, "status_code"),
        rs.getString("response_body"),
        jsonCodec.parseStringMap(rs.getString("response_headers")),
        JdbcTemplate.nullableLong(rs, "duration_ms"),
        rs.getBoolean("success"),
        rs.getString("error_message"),
        JdbcTemplate.instant(rs, "attempted_at"));
  }
}
