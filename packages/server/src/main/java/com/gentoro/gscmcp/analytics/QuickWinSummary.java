package com.gentoro.gscmcp.analytics;

import java.util.List;

public record QuickWinSummary(
    int totalQuickWins, long highOpportunities, long potentialAdditionalClicks) {

  public static QuickWinSummary of(List<QuickWin> quickWins) {
    return new QuickWinSummary(
        quickWins.size(),
        quickWins.stream().filter(q -> q.opportunity() == Opportunity.HIGH).count(),
        quickWins.stream().mapToLong(QuickWin::additionalClicks).sum());
  }
}
