package eventrelay;

/**
 * Represents an event type identifier.
 *
 * <p>Event types are dot-namespaced strings such as {@code "ticket.created"}. Implementations
 * are typically enums; see {@link DomainEventType} for the built-in catalogue.
 */
public interface EventType {

  /**
   * Returns the persisted string form of this event type. This value is stored in the outbox,
   * used for handler routing and matched against webhook endpoint subscriptions.
   *
   * @return the event type value, never null
   */
  String value();
}
