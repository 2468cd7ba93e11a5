package eventrelay.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Delivery statistics of one endpoint over the trailing {@code periodDays}.
 *
 * <p>{@code successRate} is a fraction in {@code [0, 1]} and is 0 when there were no attempts.
 * {@code averageDurationMs} is rounded to two decimals and ignores attempts without a duration.
 */
public record DeliveryStats(
    long endpointId,
    long totalDeliveries,
    long successfulDeliveries,
    long failedDeliveries,
    double successRate,
    double averageDurationMs,
    int periodDays
) {

  public static DeliveryStats from(long endpointId, DeliveryTotals totals, int periodDays) {
    long total = totals.total();
    long successful = totals.successful();
    double rate = total > 0 ? (double) successful / total : 0.0;
    double average = BigDecimal.valueOf(totals.averageDurationMs())
        .setScale(2, RoundingMode.HALF_EVEN)
        .doubleValue();
    return new DeliveryStats(endpointId, total, successful, total - successful, rate, average,
        periodDays);
  }
}
