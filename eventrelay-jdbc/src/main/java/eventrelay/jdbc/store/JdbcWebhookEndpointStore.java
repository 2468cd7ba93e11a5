package eventrelay.jdbc.store;

import eventrelay.jdbc.JdbcTemplate;
import eventrelay.jdbc.TableNames;
import eventrelay.model.NewWebhookEndpoint;
import eventrelay.model.WebhookEndpoint;
import eventrelay.spi.WebhookEndpointStore;
import eventrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * {@link WebhookEndpointStore} over the {@code webhook_endpoint} table. Subscribed event types
 * are stored as a JSON array. Portable across H2, MySQL and PostgreSQL.
 */
public final class JdbcWebhookEndpointStore implements WebhookEndpointStore {

  private static final String COLUMNS =
      "id, name, url, secret, event_types, active, timeout_seconds, max_retries, tenant_id, " +
      "created_at, updated_at";

  private final String tableName;
  private final JsonCodec jsonCodec;

  public JdbcWebhookEndpointStore() {
    this(TableNames.WEBHOOK_ENDPOINT, JsonCodec.getDefault());
  }

  public JdbcWebhookEndpointStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public WebhookEndpoint insert(Connection conn, NewWebhookEndpoint endpoint, Instant now) {
    Instant createdAt = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "INSERT INTO " + tableName + " (" +
        "name, url, secret, event_types, active, timeout_seconds, max_retries, tenant_id, " +
        "created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?,?)";
    long id = JdbcTemplate.insertReturningKey(conn, sql,
        endpoint.name(), endpoint.url(), endpoint.secret(),
        jsonCodec.toJson(new TreeSet<>(endpoint.eventTypes())),
        endpoint.active(), endpoint.timeoutSeconds(), endpoint.maxRetries(), endpoint.tenantId(),
        Timestamp.from(createdAt), Timestamp.from(createdAt));
    return new WebhookEndpoint(id, endpoint.name(), endpoint.url(), endpoint.secret(),
        endpoint.eventTypes(), endpoint.active(), endpoint.timeoutSeconds(),
        endpoint.maxRetries(), endpoint.tenantId(), createdAt, createdAt);
  }

  @Override
  public Optional<WebhookEndpoint> findById(Connection conn, long id) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE id=?";
    return JdbcTemplate.query(conn, sql, this::mapEndpoint, id).stream().findFirst();
  }

  @Override
  public List<WebhookEndpoint> findActive(Connection conn) {
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE active=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, this::mapEndpoint, Boolean.TRUE);
  }

  @Override
  public List<WebhookEndpoint> findAll(Connection conn, Long tenantId) {
    if (tenantId == null) {
      return JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY id", this::mapEndpoint);
    }
    String sql = "SELECT " + COLUMNS + " FROM " + tableName + " WHERE tenant_id=? ORDER BY id";
    return JdbcTemplate.query(conn, sql, this::mapEndpoint, tenantId);
  }

  @Override
  public int updateActive(Connection conn, long id, boolean active, Instant now) {
    String sql = "UPDATE " + tableName + " SET active=?, updated_at=? WHERE id=?";
    return JdbcTemplate.update(conn, sql, active, Timestamp.from(now), id);
  }

  @Override
  public int delete(Connection conn, long id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE id=?", id);
  }

  private WebhookEndpoint mapEndpoint(ResultSet rs) throws SQLException {
    return new WebhookEndpoint(
        rs.getLong("id"),
        rs.getString("name"),
        rs.getString("url"),
        rs.getString("secret"),
        new LinkedHashSet<>(jsonCodec.parseStringList(rs.getString("event_types"))),
        rs.getBoolean("active"),
        rs.getInt("timeout_seconds"),
        rs.getInt("max_retries"),
        JdbcTemplate.nullableLong(rs, "tenant_id"),
        JdbcTemplate.instant(rs, "created_at"),
        JdbcTemplate.instant(rs, "updated_at"));
  }
}
