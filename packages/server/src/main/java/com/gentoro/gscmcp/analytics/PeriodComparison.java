package com.gentoro.gscmcp.analytics;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Result of comparing two periods row by row, plus period totals. */
public record PeriodComparison(List<Row> comparison, Summary summary) {

  /**
   * @param position average position, one decimal
   * @param ctr CTR in percent, two decimals
   */
  public record Metrics(long clicks, long impressions, double position, double ctr) {
    public static final Metrics ZERO = new Metrics(0, 0, 0, 0);
  }

  /**
   * @param clicksPercent click change relative to the previous period, one decimal; null when the
   *     previous period had no clicks
   * @param position previous minus current position; positive means the page moved up
   */
  public record Change(
      long clicks,
      @JsonInclude(JsonInclude.Include.ALWAYS) Double clicksPercent,
      long impressions,
      double position,
      double ctr) {}

  public record Row(List<String> keys, Metrics current, Metrics previous, Change change) {}

  public record Totals(String start, String end, long clicks, long impressions) {}

  public record TotalsChange(
      long clicks,
      @JsonInclude(JsonInclude.Include.ALWAYS) Double clicksPercent,
      long impressions) {}

  public record Summary(Totals currentPeriod, Totals previousPeriod, TotalsChange change) {}
}
