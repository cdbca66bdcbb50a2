package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.analytics.PeriodComparison;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ComparePeriodsTool extends GscTool {
  static final List<String> DEFAULT_DIMENSIONS = List.of("query");
  static final int DEFAULT_ROW_LIMIT = 100;

  public ComparePeriodsTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("compare_periods")
        .description("Compare search performance between two date ranges")
        .property(accountProperty())
        .property(siteUrlProperty())
        .property(
            ToolProperty.string("currentStartDate")
                .description("Current period start date (YYYY-MM-DD)")
                .required())
        .property(
            ToolProperty.string("currentEndDate")
                .description("Current period end date (YYYY-MM-DD)")
                .required())
        .property(
            ToolProperty.string("previousStartDate")
                .description("Previous period start date (YYYY-MM-DD)")
                .required())
        .property(
            ToolProperty.string("previousEndDate")
                .description("Previous period end date (YYYY-MM-DD)")
                .required())
        .property(
            ToolProperty.string("dimensions")
                .description("Comma-separated dimensions to compare by (default: query)"))
        .property(
            ToolProperty.integer("rowLimit")
                .description("Maximum rows to fetch per period")
                .minimum(1)
                .maximum(SearchAnalyticsTool.MAX_ROW_LIMIT)
                .defaultValue(DEFAULT_ROW_LIMIT))
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String accountSelector = arguments.optionalString("account");
    String siteUrl = arguments.requiredString("siteUrl");
    String currentStart = arguments.requiredDate("currentStartDate");
    String currentEnd = arguments.requiredDate("currentEndDate");
    String previousStart = arguments.requiredDate("previousStartDate");
    String previousEnd = arguments.requiredDate("previousEndDate");
    List<String> dimensions =
        arguments.optionalCsv("dimensions", SearchAnalyticsTool.DIMENSIONS, DEFAULT_DIMENSIONS);
    Integer rowLimit =
        arguments.optionalInt(
            "rowLimit", DEFAULT_ROW_LIMIT, 1, SearchAnalyticsTool.MAX_ROW_LIMIT);
    arguments.ensureValid();

    Session session = open(accountSelector);
    PeriodComparison comparison =
        session
            .service()
            .comparePeriods(
                siteUrl, currentStart, currentEnd, previousStart, previousEnd, dimensions, rowLimit);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("account", session.account().email());
    result.put("siteUrl", siteUrl);
    result.put("comparison", comparison.comparison());
    result.put("summary", comparison.summary());
    return result;
  }
}
