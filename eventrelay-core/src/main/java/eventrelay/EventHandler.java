package eventrelay;

import eventrelay.model.OutboxRecord;

/**
 * In-process subscriber invoked by {@link eventrelay.dispatch.EventDispatcher#process} for each
 * outbox record of a registered event type.
 *
 * <p>Handlers for one type run sequentially in registration order. The first handler that
 * throws aborts the remaining handlers and the record is scheduled for retry (or marked FAILED
 * once its retry budget is spent). Handlers may see the same record more than once; use
 * {@link OutboxRecord#eventId()} to deduplicate.
 *
 * <p>The registry is not persisted: handlers must be registered again after every restart,
 * before the poller starts.
 *
 * @see eventrelay.registry.HandlerRegistry
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Handles one outbox record.
   *
   * @param event the record being processed (status PROCESSING)
   * @throws Exception if handling fails; the message becomes the record's {@code lastError}
   */
  void handle(OutboxRecord event) throws Exception;
}
