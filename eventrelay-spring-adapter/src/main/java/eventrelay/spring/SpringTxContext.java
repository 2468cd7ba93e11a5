package eventrelay.spring;

import eventrelay.spi.TxContext;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.Objects;

/**
 * {@link TxContext} backed by Spring's transaction infrastructure.
 *
 * <p>The connection comes from {@link DataSourceUtils}, so outbox writes land on the same
 * connection as the surrounding {@code @Transactional} method or {@code TransactionTemplate}
 * callback. The {@link DataSource} must be the one the transaction manager manages.
 *
 * @see TxContext
 */
public final class SpringTxContext implements TxContext {
  private final DataSource dataSource;

  public SpringTxContext(DataSource dataSource) {
    this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
  }

  @Override
  public boolean isTransactionActive() {
    return TransactionSynchronizationManager.isActualTransactionActive();
  }

  @Override
  public Connection currentConnection() {
    if (!isTransactionActive()) {
      throw new IllegalStateException("No active transaction");
    }
    return DataSourceUtils.getConnection(dataSource);
  }
}
