package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.analytics.QuickWin;
import com.gentoro.gscmcp.analytics.QuickWinSummary;
import com.gentoro.gscmcp.analytics.QuickWinThresholds;
import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Pages ranking just below the top positions with a low click-through rate. */
public class DetectQuickWinsTool extends GscTool {

  public DetectQuickWinsTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    QuickWinThresholds defaults = QuickWinThresholds.DEFAULTS;
    return ToolDefinition.builder()
        .name("detect_quick_wins")
        .description(
            "Find SEO quick wins: queries ranking in positions 4-20 with high impressions and low CTR")
        .property(accountProperty())
        .property(siteUrlProperty())
        .property(
            ToolProperty.string("startDate").description("Start date in YYYY-MM-DD format").required())
        .property(
            ToolProperty.string("endDate").description("End date in YYYY-MM-DD format").required())
        .property(
            ToolProperty.number("minImpressions")
                .description("Minimum impressions threshold")
                .defaultValue(defaults.minImpressions()))
        .property(
            ToolProperty.number("maxCtr")
                .description("Maximum CTR percentage")
                .defaultValue(defaults.maxCtrPercent()))
        .property(
            ToolProperty.number("positionRangeMin")
                .description("Minimum position (default: 4)")
                .defaultValue(defaults.positionMin()))
        .property(
            ToolProperty.number("positionRangeMax")
                .description("Maximum position (default: 20)")
                .defaultValue(defaults.positionMax()))
        .property(
            ToolProperty.integer("limit")
                .description("Maximum quick wins to return")
                .minimum(0)
                .defaultValue(defaults.limit()))
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    QuickWinThresholds defaults = QuickWinThresholds.DEFAULTS;
    String accountSelector = arguments.optionalString("account");
    String siteUrl = arguments.requiredString("siteUrl");
    String startDate = arguments.requiredDate("startDate");
    String endDate = arguments.requiredDate("endDate");
    double minImpressions = arguments.optionalDouble("minImpressions", defaults.minImpressions());
    double maxCtr = arguments.optionalDouble("maxCtr", defaults.maxCtrPercent());
    double positionMin = arguments.optionalDouble("positionRangeMin", defaults.positionMin());
    double positionMax = arguments.optionalDouble("positionRangeMax", defaults.positionMax());
    Integer limit = arguments.optionalInt("limit", defaults.limit(), 0, null);
    arguments.ensureValid();

    // impressions are whole numbers, so ">= 100.5" and ">= 101" select the same rows
    QuickWinThresholds thresholds =
        new QuickWinThresholds(
            (long) Math.ceil(minImpressions), maxCtr, positionMin, positionMax, limit);

    Session session = open(accountSelector);
    List<QuickWin> quickWins =
        session.service().detectQuickWins(siteUrl, startDate, endDate, thresholds);

    Map<String, Object> appliedThresholds = new LinkedHashMap<>();
    appliedThresholds.put("minImpressions", minImpressions);
    appliedThresholds.put("maxCtr", maxCtr);
    appliedThresholds.put("positionRange", plain(positionMin) + "-" + plain(positionMax));

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("account", session.account().email());
    result.put("siteUrl", siteUrl);
    result.put("dateRange", dateRange(startDate, endDate));
    result.put("thresholds", appliedThresholds);
    result.put("summary", QuickWinSummary.of(quickWins));
    result.put("quickWins", quickWins);
    return result;
  }

  /** 4.0 renders as "4", 4.5 as "4.5". */
  static String plain(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
