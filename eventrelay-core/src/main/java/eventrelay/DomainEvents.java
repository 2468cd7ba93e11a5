package eventrelay;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory methods for the events the business modules raise most often.
 *
 * <p>Each method returns a fully populated {@link EventEnvelope} whose payload carries the
 * identifying fields first, followed by any caller-supplied {@code extra} entries. Extra entries
 * never override the identifying fields.
 *
 * <pre>{@code
 * dispatcher.publish(DomainEvents.ticketCreated(42L, 1L, "T-0042", "Printer jammed", Map.of()));
 * }</pre>
 */
public final class DomainEvents {

  private DomainEvents() {}

  public static EventEnvelope inventoryItemCreated(
      long itemId, Long tenantId, long catalogId, int quantity, Map<String, ?> extra) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("item_id", itemId);
    payload.put("catalog_id", catalogId);
    payload.put("quantity", quantity);
    return envelope(DomainEventType.INVENTORY_ITEM_CREATED, "inventory_item", itemId, tenantId,
        payload, extra);
  }

  public static EventEnvelope assetCreated(
      long assetId, Long tenantId, String serialNumber, Map<String, ?> extra) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("asset_id", assetId);
    payload.put("serial_number", serialNumber);
    return envelope(DomainEventType.ASSET_CREATED, "asset", assetId, tenantId, payload, extra);
  }

  public static EventEnvelope ticketCreated(
      long ticketId, Long tenantId, String number, String title, Map<String, ?> extra) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("ticket_id", ticketId);
    payload.put("number", number);
    payload.put("title", title);
    return envelope(DomainEventType.TICKET_CREATED, "ticket", ticketId, tenantId, payload, extra);
  }

  public static EventEnvelope ticketStatusChanged(
      long ticketId, Long tenantId, String oldStatus, String newStatus, Map<String, ?> extra) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("ticket_id", ticketId);
    payload.put("old_status", oldStatus);
    payload.put("new_status", newStatus);
    return envelope(DomainEventType.TICKET_STATUS_CHANGED, "ticket", ticketId, tenantId,
        payload, extra);
  }

  public static EventEnvelope serviceOrderCreated(
      long serviceOrderId, Long tenantId, String orderNumber, Map<String, ?> extra) {
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("service_order_id", serviceOrderId);
    payload.put("order_number", orderNumber);
    return envelope(DomainEventType.SERVICE_ORDER_CREATED, "service_order", serviceOrderId,
        tenantId, payload, extra);
  }

  private static EventEnvelope envelope(EventType type, String aggregateType, long aggregateId,
      Long tenantId, Map<String, Object> payload, Map<String, ?> extra) {
    if (extra != null) {
      extra.forEach(payload::putIfAbsent);
    }
    return EventEnvelope.builder(type)
        .aggregateType(aggregateType)
        .aggregateId(Long.toString(aggregateId))
        .tenantId(tenantId)
        .payload(payload)
        .build();
  }
}
