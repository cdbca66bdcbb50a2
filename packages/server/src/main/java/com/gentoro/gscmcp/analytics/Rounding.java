package com.gentoro.gscmcp.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;

final class Rounding {
  private Rounding() {}

  /**
   * Fixed-point rounding of the exact binary value, half away from zero: 0.125 (exact) gives 0.13
   * while 1.005 (stored as 1.00499...) gives 1.0.
   */
  static double round(double value, int places) {
    if (Double.isNaN(value) || Double.isInfinite(value)) return value;
    return new BigDecimal(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
  }
}
