package eventrelay.registry;

import eventrelay.EventHandler;
import eventrelay.EventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe registry for event handlers.
 *
 * <p>Supports registration by specific event type or wildcard ("*") for all events.
 * Type-specific handlers run first, in registration order, followed by wildcard handlers.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * HandlerRegistry registry = new DefaultHandlerRegistry()
 *     .register("ticket.created", event -> notifier.ticketOpened(event))
 *     .register(DomainEventType.TICKET_STATUS_CHANGED, event -> sla.recalculate(event))
 *     .registerAll(event -> audit.log(event));
 * }</pre>
 *
 * @see EventHandler
 * @see HandlerRegistry
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {
  public static final String ALL_EVENTS = "*";

  private final Map<String, CopyOnWriteArrayList<EventHandler>> handlers = new ConcurrentHashMap<>();

  public DefaultHandlerRegistry register(EventType eventType, EventHandler handler) {
    return register(eventType.value(), handler);
  }

  @Override
  public DefaultHandlerRegistry register(String eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    handlers.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    return this;
  }

  /**
   * Registers a handler for all event types (wildcard).
   *
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultHandlerRegistry registerAll(EventHandler handler) {
    return register(ALL_EVENTS, handler);
  }

  @Override
  public List<EventHandler> handlersFor(String eventType) {
    List<EventHandler> result = new ArrayList<>();
    CopyOnWriteArrayList<EventHandler> specific = handlers.get(eventType);
    if (specific != null) {
      result.addAll(specific);
    }
    CopyOnWriteArrayList<EventHandler> all = handlers.get(ALL_EVENTS);
    if (all != null && !ALL_EVENTS.equals(eventType)) {
      result.addAll(all);
    }
    return Collections.unmodifiableList(result);
  }
}
