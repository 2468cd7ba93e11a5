package eventrelay.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for work done outside the caller's transaction
 * (status updates, polling, webhook bookkeeping).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see eventrelay.jdbc.DataSourceConnectionProvider
 */
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
