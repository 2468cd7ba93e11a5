package eventrelay.model;

/**
 * Raw delivery counts for one endpoint over a time window, as computed by the store.
 *
 * @param total             attempts in the window
 * @param successful        successful attempts in the window
 * @param averageDurationMs mean {@code duration_ms} over attempts that recorded one, or 0
 */
public record DeliveryTotals(long total, long successful, double averageDurationMs) {

  public static final DeliveryTotals EMPTY = new DeliveryTotals(0, 0, 0.0);
}
