package com.gentoro.gscmcp.searchconsole;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/** Body of {@code searchAnalytics/query}. Null fields are left out of the request. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SearchAnalyticsRequest {
  private final String startDate;
  private final String endDate;
  private final List<String> dimensions;
  private final String type;
  private final String aggregationType;
  private final Integer rowLimit;
  private final Integer startRow;
  private final String dataState;
  private final List<DimensionFilterGroup> dimensionFilterGroups;

  private SearchAnalyticsRequest(Builder b) {
    this.startDate = b.startDate;
    this.endDate = b.endDate;
    this.dimensions = b.dimensions == null ? null : List.copyOf(b.dimensions);
    this.type = b.type;
    this.aggregationType = b.aggregationType;
    this.rowLimit = b.rowLimit;
    this.startRow = b.startRow;
    this.dataState = b.dataState;
    this.dimensionFilterGroups =
        b.dimensionFilterGroups == null || b.dimensionFilterGroups.isEmpty()
            ? null
            : List.copyOf(b.dimensionFilterGroups);
  }

  public String getStartDate() {
    return startDate;
  }

  public String getEndDate() {
    return endDate;
  }

  public List<String> getDimensions() {
    return dimensions;
  }

  public String getType() {
    return type;
  }

  public String getAggregationType() {
    return aggregationType;
  }

  public Integer getRowLimit() {
    return rowLimit;
  }

  public Integer getStartRow() {
    return startRow;
  }

  public String getDataState() {
    return dataState;
  }

  public List<DimensionFilterGroup> getDimensionFilterGroups() {
    return dimensionFilterGroups;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String startDate;
    private String endDate;
    private List<String> dimensions;
    private String type;
    private String aggregationType;
    private Integer rowLimit;
    private Integer startRow;
    private String dataState;
    private List<DimensionFilterGroup> dimensionFilterGroups;

    public Builder startDate(String startDate) {
      this.startDate = startDate;
      return this;
    }

    public Builder endDate(String endDate) {
      this.endDate = endDate;
      return this;
    }

    public Builder dimensions(List<String> dimensions) {
      this.dimensions = dimensions;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder aggregationType(String aggregationType) {
      this.aggregationType = aggregationType;
      return this;
    }

    public Builder rowLimit(Integer rowLimit) {
      this.rowLimit = rowLimit;
      return this;
    }

    public Builder startRow(Integer startRow) {
      this.startRow = startRow;
      return this;
    }

    public Builder dataState(String dataState) {
      this.dataState = dataState;
      return this;
    }

    public Builder dimensionFilterGroups(List<DimensionFilterGroup> groups) {
      this.dimensionFilterGroups = groups;
      return this;
    }

    public SearchAnalyticsRequest build() {
      return new SearchAnalyticsRequest(this);
    }
  }
}
