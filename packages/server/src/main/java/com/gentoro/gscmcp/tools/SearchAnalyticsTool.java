package com.gentoro.gscmcp.tools;

import com.gentoro.gscmcp.GscMcp;
import com.gentoro.gscmcp.searchconsole.DimensionFilter;
import com.gentoro.gscmcp.searchconsole.DimensionFilterGroup;
import com.gentoro.gscmcp.searchconsole.SearchAnalyticsRequest;
import com.gentoro.gscmcp.searchconsole.SearchAnalyticsResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Raw Search Analytics query with optional dimension filters. */
public class SearchAnalyticsTool extends GscTool {
  static final List<String> DIMENSIONS =
      List.of("query", "page", "country", "device", "searchAppearance", "date");
  static final List<String> SEARCH_TYPES =
      List.of("web", "image", "video", "news", "discover", "googleNews");
  static final List<String> AGGREGATION_TYPES =
      List.of("auto", "byNewsShowcasePanel", "byProperty", "byPage");
  static final List<String> DATA_STATES = List.of("all", "final");
  static final List<String> DEVICES = List.of("DESKTOP", "MOBILE", "TABLET");
  static final List<String> FILTER_OPERATORS =
      List.of("equals", "contains", "notEquals", "notContains", "includingRegex", "excludingRegex");

  static final int DEFAULT_ROW_LIMIT = 1000;
  static final int MAX_ROW_LIMIT = 25_000;

  public SearchAnalyticsTool(GscMcp context) {
    super(context);
  }

  @Override
  public ToolDefinition definition() {
    return ToolDefinition.builder()
        .name("search_analytics")
        .description(
            "Query search performance data (clicks, impressions, CTR, position) for a site")
        .property(accountProperty())
        .property(siteUrlProperty())
        .property(
            ToolProperty.string("startDate").description("Start date in YYYY-MM-DD format").required())
        .property(
            ToolProperty.string("endDate").description("End date in YYYY-MM-DD format").required())
        .property(
            ToolProperty.string("dimensions")
                .description(
                    "Comma-separated dimensions: query, page, country, device, searchAppearance, date"))
        .property(
            ToolProperty.string("type").description("Search type filter").enumValues(SEARCH_TYPES))
        .property(
            ToolProperty.string("aggregationType")
                .description("Aggregation type")
                .enumValues(AGGREGATION_TYPES))
        .property(
            ToolProperty.integer("rowLimit")
                .description("Maximum rows to return (up to 25,000)")
                .minimum(1)
                .maximum(MAX_ROW_LIMIT)
                .defaultValue(DEFAULT_ROW_LIMIT))
        .property(
            ToolProperty.integer("startRow").description("Starting row for pagination").minimum(0))
        .property(
            ToolProperty.string("dataState")
                .description("Data freshness: \"all\" for latest data, \"final\" for finalized data")
                .enumValues(DATA_STATES)
                .defaultValue("all"))
        .property(ToolProperty.string("pageFilter").description("Filter by page URL"))
        .property(ToolProperty.string("queryFilter").description("Filter by search query"))
        .property(
            ToolProperty.string("countryFilter")
                .description("Filter by country (ISO 3166-1 alpha-3)"))
        .property(
            ToolProperty.string("deviceFilter").description("Filter by device").enumValues(DEVICES))
        .property(
            ToolProperty.string("filterOperator")
                .description("Operator for page and query filters")
                .enumValues(FILTER_OPERATORS)
                .defaultValue("contains"))
        .build();
  }

  @Override
  public Object call(ToolArguments arguments) {
    String accountSelector = arguments.optionalString("account");
    String siteUrl = arguments.requiredString("siteUrl");
    String startDate = arguments.requiredDate("startDate");
    String endDate = arguments.requiredDate("endDate");
    List<String> dimensions = arguments.optionalCsv("dimensions", DIMENSIONS, null);
    String type = arguments.optionalEnum("type", SEARCH_TYPES, null);
    String aggregationType = arguments.optionalEnum("aggregationType", AGGREGATION_TYPES, null);
    Integer rowLimit = arguments.optionalInt("rowLimit", DEFAULT_ROW_LIMIT, 1, MAX_ROW_LIMIT);
    Integer startRow = arguments.optionalInt("startRow", null, 0, null);
    String dataState = arguments.optionalEnum("dataState", DATA_STATES, "all");
    String pageFilter = arguments.optionalString("pageFilter");
    String queryFilter = arguments.optionalString("queryFilter");
    String countryFilter = arguments.optionalString("countryFilter");
    String deviceFilter = arguments.optionalEnum("deviceFilter", DEVICES, null);
    String operator = arguments.optionalEnum("filterOperator", FILTER_OPERATORS, "contains");
    arguments.ensureValid();

    List<DimensionFilter> filters = new ArrayList<>();
    if (pageFilter != null) filters.add(new DimensionFilter("page", operator, pageFilter));
    if (queryFilter != null) filters.add(new DimensionFilter("query", operator, queryFilter));
    if (countryFilter != null) filters.add(new DimensionFilter("country", "equals", countryFilter));
    if (deviceFilter != null) filters.add(new DimensionFilter("device", "equals", deviceFilter));

    SearchAnalyticsRequest request =
        SearchAnalyticsRequest.builder()
            .startDate(startDate)
            .endDate(endDate)
            .dimensions(dimensions)
            .type(type)
            .aggregationType(aggregationType)
            .rowLimit(rowLimit)
            .startRow(startRow)
            .dataState(dataState)
            .dimensionFilterGroups(
                filters.isEmpty() ? null : List.of(DimensionFilterGroup.and(filters)))
            .build();

    Session session = open(accountSelector);
    SearchAnalyticsResponse response = session.service().searchAnalytics(siteUrl, request);

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("account", session.account().email());
    result.put("siteUrl", siteUrl);
    result.put("dateRange", dateRange(startDate, endDate));
    result.put("rowCount", response.getRows().size());
    result.put("data", response);
    return result;
  }
}
