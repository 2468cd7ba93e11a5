package eventrelay.model;

import java.time.Instant;
import java.util.Map;

/**
 * Read-only view of a persisted {@code outbox_event} row.
 *
 * <p>{@code processedAt} is only set once the record is PUBLISHED. {@code lockedAt} is the time
 * the record last entered PROCESSING and {@code deliveredAt} marks completion of the webhook
 * fan-out. While the fan-out is incomplete, {@code nextDeliveryAt} holds the earliest time one of
 * its endpoints is due for a retry ({@code null} means due now).
 *
 * @see eventrelay.spi.OutboxStore
 */
public record OutboxRecord(
    String eventId,
    String eventType,
    String aggregateType,
    String aggregateId,
    Map<String, Object> payload,
    Map<String, Object> metadata,
    Long tenantId,
    Instant occurredAt,
    EventStatus status,
    int retryCount,
    int maxRetries,
    Instant createdAt,
    Instant processedAt,
    Instant nextRetryAt,
    String lastError,
    Instant lockedAt,
    Instant deliveredAt,
    Instant nextDeliveryAt
) {

  /** Maximum stored length of {@link #lastError()}. */
  public static final int MAX_ERROR_LENGTH = 4000;

  public OutboxRecord {
    payload = payload == null ? Map.of() : payload;
    metadata = metadata == null ? Map.of() : metadata;
  }

  /**
   * Truncates an error message to {@link #MAX_ERROR_LENGTH} characters.
   *
   * @param error the error text, may be {@code null}
   * @return the truncated text, or {@code null}
   */
  public static String truncateError(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
