package eventrelay.jdbc.store;

import eventrelay.jdbc.JdbcTemplate;
import eventrelay.model.EventStatus;
import eventrelay.util.JsonCodec;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/**
 * MySQL outbox store. Also compatible with TiDB and MariaDB.
 *
 * <p>Claims row by row through the conditional status update, which is safe for concurrent
 * pollers but may hand fewer rows than {@code limit} to each. Purges with
 * {@code DELETE ... ORDER BY ... LIMIT}, since MySQL rejects {@code LIMIT} inside an
 * {@code IN} subquery.
 */
public final class MySqlOutboxStore extends AbstractJdbcOutboxStore {

  public MySqlOutboxStore() {
    super();
  }

  public MySqlOutboxStore(String tableName) {
    super(tableName);
  }

  public MySqlOutboxStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcOutboxStore withJsonCodec(JsonCodec jsonCodec) {
    return new MySqlOutboxStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  public int purgePublished(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + tableName() +
        " WHERE status=" + EventStatus.PUBLISHED.code() + " AND processed_at < ?" +
        " ORDER BY processed_at LIMIT ?";
    return JdbcTemplate.update(conn, sql, Timestamp.from(before), limit);
  }
}
