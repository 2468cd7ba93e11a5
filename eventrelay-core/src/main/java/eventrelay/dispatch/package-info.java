/**
 * Transactional event publication and in-process handler dispatch.
 *
 * <p>{@link eventrelay.dispatch.EventDispatcher} writes outbox records inside the caller's
 * transaction and later drives each record through PROCESSING to PUBLISHED, RETRYING or
 * FAILED, with linear backoff between retries.
 *
 * @see eventrelay.dispatch.EventDispatcher
 * @see eventrelay.dispatch.RetryPolicy
 */
package eventrelay.dispatch;
