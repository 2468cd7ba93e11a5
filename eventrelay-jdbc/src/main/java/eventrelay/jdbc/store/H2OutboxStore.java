package eventrelay.jdbc.store;

import eventrelay.util.JsonCodec;

import java.util.List;

/**
 * H2 outbox store. Primarily for testing.
 *
 * <p>Uses the default list-then-claim strategy of {@link eventrelay.spi.OutboxStore}.
 */
public final class H2OutboxStore extends AbstractJdbcOutboxStore {

  public H2OutboxStore() {
    super();
  }

  public H2OutboxStore(String tableName) {
    super(tableName);
  }

  public H2OutboxStore(String tableName, JsonCodec jsonCodec) {
    super(tableName, jsonCodec);
  }

  @Override
  public AbstractJdbcOutboxStore withJsonCodec(JsonCodec jsonCodec) {
    return new H2OutboxStore(tableName(), jsonCodec);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
