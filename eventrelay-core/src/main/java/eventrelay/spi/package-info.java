/**
 * Service Provider Interfaces (SPI) for plugging in transaction management, connection
 * provisioning, persistence and metrics.
 *
 * @see eventrelay.spi.TxContext
 * @see eventrelay.spi.ConnectionProvider
 * @see eventrelay.spi.OutboxStore
 * @see eventrelay.spi.WebhookEndpointStore
 * @see eventrelay.spi.WebhookDeliveryStore
 * @see eventrelay.spi.MetricsExporter
 */
package eventrelay.spi;
