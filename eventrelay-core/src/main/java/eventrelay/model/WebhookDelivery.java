package eventrelay.model;

import java.time.Instant;
import java.util.Map;

/**
 * One logged delivery attempt, as stored in the append-only {@code webhook_delivery} table.
 *
 * <p>{@code statusCode}, {@code responseBody} and {@code durationMs} are {@code null} when the
 * attempt never produced an HTTP response (timeout or transport error).
 */
public record WebhookDelivery(
    Long id,
    long endpointId,
    String eventId,
    String url,
    Map<String, String> headers,
    String payload,
    Integer statusCode,
    String responseBody,
    Map<String, String> responseHeaders,
    Long durationMs,
    boolean success,
    String errorMessage,
    Instant attemptedAt
) {

  /** Maximum stored length of {@link #responseBody()}. */
  public static final int MAX_RESPONSE_BODY_LENGTH = 4000;

  public WebhookDelivery {
    headers = headers == null ? Map.of() : headers;
    responseHeaders = responseHeaders == null ? Map.of() : responseHeaders;
    if (responseBody != null && responseBody.length() > MAX_RESPONSE_BODY_LENGTH) {
      responseBody = responseBody.substring(0, MAX_RESPONSE_BODY_LENGTH);
    }
  }
}
