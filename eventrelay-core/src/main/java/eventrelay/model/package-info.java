/**
 * Persisted records of the outbox and webhook delivery tables.
 *
 * @see eventrelay.model.OutboxRecord
 * @see eventrelay.model.EventStatus
 * @see eventrelay.model.WebhookEndpoint
 * @see eventrelay.model.WebhookDelivery
 */
package eventrelay.model;
