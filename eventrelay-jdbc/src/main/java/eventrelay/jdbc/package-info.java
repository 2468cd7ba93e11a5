/**
 * JDBC implementations of the EventRelay stores.
 *
 * <p>{@link eventrelay.jdbc.JdbcTemplate} holds the shared statement plumbing. Outbox stores
 * live in {@code eventrelay.jdbc.store}, one per database, and are discovered with
 * {@link eventrelay.jdbc.store.JdbcOutboxStores#detect(javax.sql.DataSource)}. DDL for every
 * supported database ships under {@code eventrelay/jdbc/schema/}.
 */
package eventrelay.jdbc;
