/**
 * Manual JDBC transaction management.
 *
 * <p>{@link eventrelay.jdbc.tx.JdbcTransactionManager} provides a try-with-resources API over
 * {@link eventrelay.jdbc.tx.ThreadLocalTxContext}.
 */
package eventrelay.jdbc.tx;
