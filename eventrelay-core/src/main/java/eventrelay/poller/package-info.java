/**
 * Scheduled consumption of ready outbox records.
 *
 * @see eventrelay.poller.OutboxPoller
 */
package eventrelay.poller;
