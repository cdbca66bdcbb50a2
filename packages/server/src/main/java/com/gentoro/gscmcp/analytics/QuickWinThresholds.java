package com.gentoro.gscmcp.analytics;

/**
 * Filter applied before ranking quick wins.
 *
 * @param minImpressions rows need at least this many impressions
 * @param maxCtrPercent rows need a CTR at or below this percentage (3.0 means 3%)
 * @param positionMin lowest (best) average position kept, inclusive
 * @param positionMax highest average position kept, inclusive
 * @param limit maximum number of quick wins returned
 */
public record QuickWinThresholds(
    long minImpressions, double maxCtrPercent, double positionMin, double positionMax, int limit) {

  public static final QuickWinThresholds DEFAULTS = new QuickWinThresholds(100, 3.0, 4, 20, 50);

  boolean accepts(long impressions, double ctrPercent, double position) {
    return impressions >= minImpressions
        && ctrPercent <= maxCtrPercent
        && position >= positionMin
        && position <= positionMax;
  }
}
