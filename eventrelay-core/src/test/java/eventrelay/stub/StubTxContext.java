package eventrelay.stub;

import eventrelay.spi.TxContext;

import java.sql.Connection;

/**
 * A {@link TxContext} whose transaction is switched on and off by the test.
 */
public final class StubTxContext implements TxContext {
  private final Connection connection = Connections.dummy();
  private volatile boolean active;

  public StubTxContext active(boolean active) {
    this.active = active;
    return this;
  }

  @Override
  public boolean isTransactionActive() {
    return active;
  }

  @Override
  public Connection currentConnection() {
    if (!active) {
      throw new IllegalStateException("No active transaction");
    }
    return connection;
  }
}
