package eventrelay.jdbc;

/**
 * Unchecked exception wrapping JDBC errors thrown by the JDBC stores.
 */
public final class OutboxStoreException extends RuntimeException {
  public OutboxStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
