/**
 * JDBC {@link eventrelay.spi.OutboxStore} implementations plus the webhook endpoint and
 * delivery-log stores.
 *
 * <p>{@link eventrelay.jdbc.store.AbstractJdbcOutboxStore} holds the shared SQL and row
 * mapping. Database-specific subclasses: H2 (default claim), MySQL
 * ({@code DELETE ... ORDER BY ... LIMIT} purge) and PostgreSQL
 * ({@code FOR UPDATE SKIP LOCKED} claim).
 *
 * @see eventrelay.jdbc.store.JdbcOutboxStores
 * @see eventrelay.jdbc.store.JdbcWebhookEndpointStore
 * @see eventrelay.jdbc.store.JdbcWebhookDeliveryStore
 */
package eventrelay.jdbc.store;
