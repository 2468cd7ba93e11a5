package eventrelay.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DeliveryStatsTest {

  @Test
  void ratesAndRounding() {
    DeliveryStats stats = DeliveryStats.from(3L, new DeliveryTotals(4, 3, 123.4567), 7);
    assertEquals(3L, stats.endpointId());
    assertEquals(4, stats.totalDeliveries());
    assertEquals(3, stats.successfulDeliveries());
    assertEquals(1, stats.failedDeliveries());
    assertEquals(0.75, stats.successRate());
    assertEquals(123.46, stats.averageDurationMs());
    assertEquals(7, stats.periodDays());
  }

  @Test
  void emptyWindowHasZeroRate() {
    DeliveryStats stats = DeliveryStats.from(3L, DeliveryTotals.EMPTY, 7);
    assertEquals(0, stats.totalDeliveries());
    assertEquals(0.0, stats.successRate());
    assertEquals(0.0, stats.averageDurationMs());
  }
}
