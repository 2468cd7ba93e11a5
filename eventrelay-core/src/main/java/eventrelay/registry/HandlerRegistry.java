package eventrelay.registry;

import eventrelay.EventHandler;

import java.util.List;

/**
 * Process-local mapping from event type to in-process handlers.
 *
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

  /**
   * Registers a handler for an event type, or for every type with {@code "*"}.
   *
   * @param eventType the event type, or {@link DefaultHandlerRegistry#ALL_EVENTS}
   * @param handler   the handler
   * @return this registry for chaining
   */
  HandlerRegistry register(String eventType, EventHandler handler);

  /**
   * Returns the handlers to run for an event type, in execution order.
   *
   * @param eventType the event type
   * @return handlers (never {@code null}, possibly empty)
   */
  List<EventHandler> handlersFor(String eventType);
}
