package eventrelay.model;

/**
 * Outcome of a single webhook POST.
 *
 * @param deliveryId   id of the logged {@code webhook_delivery} row, or {@code null} if logging failed
 * @param success      {@code true} for a 2xx response
 * @param statusCode   HTTP status, or {@code null} when no response was received
 * @param responseBody response text (truncated), or {@code null}
 * @param durationMs   round-trip time, or {@code null} when no response was received
 * @param errorMessage failure description, or {@code null} on success
 * @param timedOut     whether the request exceeded the endpoint timeout
 */
public record DeliveryResult(
    Long deliveryId,
    boolean success,
    Integer statusCode,
    String responseBody,
    Long durationMs,
    String errorMessage,
    boolean timedOut
) {}
