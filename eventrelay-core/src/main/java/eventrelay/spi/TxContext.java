package eventrelay.spi;

import java.sql.Connection;

/**
 * Exposes the caller's transaction so outbox writes join it instead of opening their own.
 *
 * <p>Implementations: {@code eventrelay.jdbc.tx.ThreadLocalTxContext} (manual JDBC),
 * {@code eventrelay.spring.SpringTxContext} (Spring-managed).
 */
public interface TxContext {

  /**
   * Returns {@code true} if a transaction is currently active on this thread.
   */
  boolean isTransactionActive();

  /**
   * Returns the JDBC connection bound to the current transaction.
   *
   * @throws IllegalStateException if no transaction is active
   */
  Connection currentConnection();
}
