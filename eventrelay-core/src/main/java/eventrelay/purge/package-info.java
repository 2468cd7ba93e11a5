/**
 * Retention of the outbox table and the webhook delivery log.
 */
package eventrelay.purge;
