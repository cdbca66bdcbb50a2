package com.gentoro.gscmcp.analytics;

import com.gentoro.gscmcp.searchconsole.SearchAnalyticsRow;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Ranks query/page rows that rank well enough to be seen but get few clicks.
 *
 * <p>Each kept row is measured against a target CTR for its position bracket (8% up to position
 * 5, 5% up to 10, 3% beyond) and ranked by the clicks it would gain. Ties keep input order.
 */
public final class QuickWinDetector {
  static final String MISSING_KEY = "N/A";

  private QuickWinDetector() {}

  /** @param rows rows keyed by {@code [query, page]} */
  public static List<QuickWin> detect(List<SearchAnalyticsRow> rows, QuickWinThresholds thresholds) {
    List<QuickWin> quickWins = new ArrayList<>();
    for (SearchAnalyticsRow row : rows) {
      double ctrPercent = row.getCtr() * 100;
      if (thresholds.accepts(row.getImpressions(), ctrPercent, row.getPosition())) {
        quickWins.add(toQuickWin(row, ctrPercent));
      }
    }
    // List.sort is stable
    quickWins.sort(Comparator.comparingLong(QuickWin::additionalClicks).reversed());
    int limit = Math.max(0, Math.min(thresholds.limit(), quickWins.size()));
    return List.copyOf(quickWins.subList(0, limit));
  }

  static int targetCtrPercent(double position) {
    if (position <= 5) return 8;
    if (position <= 10) return 5;
    return 3;
  }

  private static QuickWin toQuickWin(SearchAnalyticsRow row, double ctrPercent) {
    double position = row.getPosition();
    int targetCtr = targetCtrPercent(position);
    long potentialClicks = Math.round(row.getImpressions() * targetCtr / 100.0);
    long additionalClicks = Math.max(0, potentialClicks - row.getClicks());
    double roundedPosition = Rounding.round(position, 1);

    return new QuickWin(
        keyOrPlaceholder(row.key(0)),
        keyOrPlaceholder(row.key(1)),
        roundedPosition,
        row.getImpressions(),
        row.getClicks(),
        Rounding.round(ctrPercent, 2),
        potentialClicks,
        additionalClicks,
        Opportunity.forAdditionalClicks(additionalClicks),
        String.format(
            Locale.ROOT, "Position %.1f → Target top 3 for %d%% CTR", roundedPosition, targetCtr));
  }

  private static String keyOrPlaceholder(String key) {
    return key == null || key.isEmpty() ? MISSING_KEY : key;
  }
}
