package com.hedgebot.core.ladder;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Decimal-odds price ladder of the exchange.
 *
 * Valid prices run from 1.01 to 1000 in bands, each band with its own increment.
 * A price that sits exactly on a band limit belongs to the lower band.
 */
public final class PriceLadder {

  public static final double MIN_PRICE = 1.01;
  public static final double MAX_PRICE = 1000.0;

  private static final Band[] BANDS = {
      new Band(1.0, 2.0, 0.01),
      new Band(2.0, 3.0, 0.02),
      new Band(3.0, 4.0, 0.05),
      new Band(4.0, 6.0, 0.1),
      new Band(6.0, 10.0, 0.2),
      new Band(10.0, 20.0, 0.5),
      new Band(20.0, 30.0, 1.0),
      new Band(30.0, 50.0, 2.0),
      new Band(50.0, 100.0, 5.0),
      new Band(100.0, 1000.0, 10.0),
  };

  private PriceLadder() {
  }

  /**
   * Snap an arbitrary price to the nearest valid ladder price (half-up), clamped to [1.01, 1000].
   * Increments are counted from the floor of the band the price falls in.
   */
  public static double snap(double price) {
    if (Double.isNaN(price)) {
      throw new IllegalArgumentException("price must be a number");
    }
    double clamped = Math.max(MIN_PRICE, Math.min(price, MAX_PRICE));
    Band band = bandFor(clamped);
    BigDecimal step = BigDecimal.valueOf(band.step());
    BigDecimal floor = BigDecimal.valueOf(band.floor());
    BigDecimal ticks = BigDecimal.valueOf(clamped).subtract(floor)
        .divide(step, 0, RoundingMode.HALF_UP);
    BigDecimal snapped = floor.add(ticks.multiply(step)).setScale(2, RoundingMode.HALF_UP);
    return Math.max(MIN_PRICE, Math.min(snapped.doubleValue(), MAX_PRICE));
  }

  public static boolean isValid(double price) {
    return price >= MIN_PRICE && price <= MAX_PRICE && Double.compare(snap(price), price) == 0;
  }

  /**
   * Move {@code ticks} steps up the ladder. Crossing a band limit switches to the upper band's step.
   */
  public static double ticksAbove(double price, int ticks) {
    double current = snap(price);
    for (int i = 0; i < ticks && current < MAX_PRICE; i++) {
      current = snap(current + stepAbove(current));
    }
    return current;
  }

  /**
   * Move {@code ticks} steps down the ladder. Stops at 1.01.
   */
  public static double ticksBelow(double price, int ticks) {
    double current = snap(price);
    for (int i = 0; i < ticks && current > MIN_PRICE; i++) {
      current = snap(current - bandFor(current).step());
    }
    return current;
  }

  /**
   * Number of ladder ticks between two prices (order-insensitive).
   */
  public static int ticksBetween(double price1, double price2) {
    double low = snap(Math.min(price1, price2));
    double high = snap(Math.max(price1, price2));
    int count = 0;
    while (low < high) {
      low = ticksAbove(low, 1);
      count++;
    }
    return count;
  }

  public static boolean isWithinTicks(double price1, double price2, int maxTicks) {
    return ticksBetween(price1, price2) <= maxTicks;
  }

  /**
   * Price between best back and best lay: the lay price when it is exactly one tick above,
   * otherwise the snapped midpoint.
   */
  public static double middlePrice(double backPrice, double layPrice) {
    if (Double.compare(ticksAbove(backPrice, 1), snap(layPrice)) == 0) {
      return snap(layPrice);
    }
    return snap((backPrice + layPrice) / 2.0);
  }

  private static double stepAbove(double price) {
    for (Band band : BANDS) {
      if (price < band.limit()) {
        return band.step();
      }
    }
    return BANDS[BANDS.length - 1].step();
  }

  private static Band bandFor(double price) {
    for (Band band : BANDS) {
      if (price <= band.limit()) {
        return band;
      }
    }
    return BANDS[BANDS.length - 1];
  }

  private record Band(double floor, double limit, double step) {}
}
