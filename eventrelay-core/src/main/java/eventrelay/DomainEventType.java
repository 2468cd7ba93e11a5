package eventrelay;

/**
 * Catalogue of the domain event types raised by the helpdesk, inventory and asset subsystems.
 *
 * <p>Producers are free to publish other dot-namespaced types; this enum only names the ones
 * the business modules emit today.
 */
public enum DomainEventType implements EventType {
  INVENTORY_ITEM_CREATED("inventory.item.created"),
  INVENTORY_ITEM_UPDATED("inventory.item.updated"),
  INVENTORY_ITEM_DELETED("inventory.item.deleted"),

  ASSET_CREATED("asset.created"),
  ASSET_UPDATED("asset.updated"),
  ASSET_STATUS_CHANGED("asset.status.changed"),
  ASSET_ASSIGNED("asset.assigned"),

  TICKET_CREATED("ticket.created"),
  TICKET_UPDATED("ticket.updated"),
  TICKET_STATUS_CHANGED("ticket.status.changed"),
  TICKET_ASSIGNED("ticket.assigned"),
  TICKET_RESOLVED("ticket.resolved"),
  TICKET_CLOSED("ticket.closed"),
  TICKET_SLA_BREACHED("ticket.sla.breached"),

  SERVICE_ORDER_CREATED("service_order.created"),
  SERVICE_ORDER_UPDATED("service_order.updated"),
  SERVICE_ORDER_STATUS_CHANGED("service_order.status.changed"),
  SERVICE_ORDER_ACTIVITY_ADDED("service_order.activity.added"),
  SERVICE_ORDER_COMPLETED("service_order.completed"),

  USER_CREATED("user.created"),
  USER_UPDATED("user.updated"),
  USER_LOGIN("user.login"),

  COMPANY_CREATED("company.created"),
  COMPANY_UPDATED("company.updated"),

  /** Synthetic type used by endpoint connectivity tests; never written to the outbox. */
  WEBHOOK_TEST("webhook.test");

  private final String value;

  DomainEventType(String value) {
    this.value = value;
  }

  @Override
  public String value() {
    return value;
  }

  /**
   * Looks up a catalogue entry by its persisted value.
   *
   * @param value the dot-namespaced type
   * @return the matching constant, or {@code null} if the type is not catalogued
   */
  public static DomainEventType fromValue(String value) {
    for (DomainEventType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return value;
  }
}
