package com.gentoro.gscmcp.searchconsole;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchAnalyticsResponse {
  private List<SearchAnalyticsRow> rows = new ArrayList<>();
  private String responseAggregationType;

  public SearchAnalyticsResponse() {}

  public SearchAnalyticsResponse(List<SearchAnalyticsRow> rows) {
    this.rows = rows == null ? new ArrayList<>() : new ArrayList<>(rows);
  }

  /** Never null; the API omits {@code rows} when nothing matched. */
  public List<SearchAnalyticsRow> getRows() {
    return rows;
  }

  public void setRows(List<SearchAnalyticsRow> rows) {
    this.rows = rows == null ? new ArrayList<>() : rows;
  }

  public String getResponseAggregationType() {
    return responseAggregationType;
  }

  public void setResponseAggregationType(String responseAggregationType) {
    this.responseAggregationType = responseAggregationType;
  }
}
