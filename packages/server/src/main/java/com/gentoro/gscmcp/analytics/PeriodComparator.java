package com.gentoro.gscmcp.analytics;

import com.gentoro.gscmcp.searchconsole.SearchAnalyticsRow;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins current-period rows with previous-period rows on their dimension keys.
 *
 * <p>Every current row appears exactly once; a row without a previous counterpart is compared
 * against zeros. Rows are ordered by click gain, largest first, ties in join order. Totals cover
 * all rows of each period, matched or not.
 */
public final class PeriodComparator {
  static final String KEY_SEPARATOR = "|";

  private PeriodComparator() {}

  public static PeriodComparison compare(
      String currentStart,
      String currentEnd,
      List<SearchAnalyticsRow> currentRows,
      String previousStart,
      String previousEnd,
      List<SearchAnalyticsRow> previousRows) {
    Map<String, SearchAnalyticsRow> previousByKey = new HashMap<>();
    for (SearchAnalyticsRow row : previousRows) {
      previousByKey.put(joinKey(row), row);
    }

    List<PeriodComparison.Row> rows = new ArrayList<>(currentRows.size());
    for (SearchAnalyticsRow current : currentRows) {
      rows.add(compareRow(current, previousByKey.get(joinKey(current))));
    }
    rows.sort(
        Comparator.comparingLong((PeriodComparison.Row r) -> r.change().clicks()).reversed());

    long currentClicks = currentRows.stream().mapToLong(SearchAnalyticsRow::getClicks).sum();
    long currentImpressions =
        currentRows.stream().mapToLong(SearchAnalyticsRow::getImpressions).sum();
    long previousClicks = previousRows.stream().mapToLong(SearchAnalyticsRow::getClicks).sum();
    long previousImpressions =
        previousRows.stream().mapToLong(SearchAnalyticsRow::getImpressions).sum();

    PeriodComparison.Summary summary =
        new PeriodComparison.Summary(
            new PeriodComparison.Totals(currentStart, currentEnd, currentClicks, currentImpressions),
            new PeriodComparison.Totals(
                previousStart, previousEnd, previousClicks, previousImpressions),
            new PeriodComparison.TotalsChange(
                currentClicks - previousClicks,
                percentChange(currentClicks, previousClicks),
                currentImpressions - previousImpressions));
    return new PeriodComparison(List.copyOf(rows), summary);
  }

  static String joinKey(SearchAnalyticsRow row) {
    return String.join(KEY_SEPARATOR, row.getKeys());
  }

  /** Percent change rounded to one decimal, null when {@code previous} is not positive. */
  static Double percentChange(long current, long previous) {
    if (previous <= 0) return null;
    return Rounding.round((current - previous) / (double) previous * 100, 1);
  }

  private static PeriodComparison.Row compareRow(
      SearchAnalyticsRow current, SearchAnalyticsRow previous) {
    long previousClicks = previous == null ? 0 : previous.getClicks();
    long previousImpressions = previous == null ? 0 : previous.getImpressions();
    double previousPosition = previous == null ? 0 : previous.getPosition();
    double previousCtr = previous == null ? 0 : previous.getCtr() * 100;
    double currentCtr = current.getCtr() * 100;

    PeriodComparison.Metrics currentMetrics =
        new PeriodComparison.Metrics(
            current.getClicks(),
            current.getImpressions(),
            Rounding.round(current.getPosition(), 1),
            Rounding.round(currentCtr, 2));
    PeriodComparison.Metrics previousMetrics =
        previous == null
            ? PeriodComparison.Metrics.ZERO
            : new PeriodComparison.Metrics(
                previousClicks,
                previousImpressions,
                Rounding.round(previousPosition, 1),
                Rounding.round(previousCtr, 2));

    PeriodComparison.Change change =
        new PeriodComparison.Change(
            current.getClicks() - previousClicks,
            percentChange(current.getClicks(), previousClicks),
            current.getImpressions() - previousImpressions,
            Rounding.round(previousPosition - current.getPosition(), 1),
            Rounding.round(currentCtr - previousCtr, 2));

    return new PeriodComparison.Row(
        new ArrayList<>(current.getKeys()), currentMetrics, previousMetrics, change);
  }
}
