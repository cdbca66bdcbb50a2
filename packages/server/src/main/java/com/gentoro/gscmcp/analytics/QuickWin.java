package com.gentoro.gscmcp.analytics;

/**
 * A query/page pair with clicks left on the table.
 *
 * @param currentPosition average position, one decimal
 * @param currentCtr CTR in percent, two decimals
 * @param potentialClicks clicks expected at the target CTR for the position bracket
 * @param additionalClicks {@code potentialClicks - currentClicks}, never negative
 */
public record QuickWin(
    String query,
    String page,
    double currentPosition,
    long impressions,
    long currentClicks,
    double currentCtr,
    long potentialClicks,
    long additionalClicks,
    Opportunity opportunity,
    String optimizationNote) {}
