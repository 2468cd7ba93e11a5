/**
 * Signed, tenant-scoped HTTP webhook delivery.
 *
 * <p>{@link eventrelay.webhook.WebhookDeliveryWorker} fans PUBLISHED outbox records out to the
 * matching endpoints with bounded concurrency. {@link eventrelay.webhook.WebhookSender} builds
 * the body, signs it with {@link eventrelay.webhook.WebhookSigner}, posts it through a
 * {@link eventrelay.webhook.WebhookTransport} and logs every attempt.
 * {@link eventrelay.webhook.WebhookManager} administers endpoints.
 *
 * <h2>Wire format</h2>
 * <pre>
 * POST {endpoint.url}
 * Content-Type: application/json
 * User-Agent: EventRelay-Webhook/1.0
 * X-Webhook-Delivery: 1718000000
 * X-Hub-Signature-256: sha256=5d1c...   (only when a secret is configured)
 *
 * {"event_id":"...","event_type":"ticket.created","aggregate_type":"ticket",
 *  "aggregate_id":"42","payload":{...},"metadata":{...},
 *  "timestamp":"2024-06-10T08:00:00Z","tenant_id":1}
 * </pre>
 */
package eventrelay.webhook;
