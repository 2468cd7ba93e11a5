package eventrelay.jdbc.tx;

import eventrelay.spi.TxContext;

import java.sql.Connection;

/**
 * {@link TxContext} that keeps the current transaction's connection in a {@link ThreadLocal}.
 *
 * <p>Bound and unbound by {@link JdbcTransactionManager}.
 */
public final class ThreadLocalTxContext implements TxContext {
  private final ThreadLocal<Connection> current = new ThreadLocal<>();

  @Override
  public boolean isTransactionActive() {
    return current.get() != null;
  }

  @Override
  public Connection currentConnection() {
    Connection connection = current.get();
    if (connection == null) {
      throw new IllegalStateException("No active transaction");
    }
    return connection;
  }

  void bind(Connection connection) {
    if (current.get() != null) {
      throw new IllegalStateException("Transaction already active");
    }
    current.set(connection);
  }

  void unbind() {
    current.remove();
  }
}
