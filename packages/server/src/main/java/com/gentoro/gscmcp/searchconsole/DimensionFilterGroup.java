package com.gentoro.gscmcp.searchconsole;

import java.util.List;

/** Filters combined with {@code groupType} (the API only supports {@code and}). */
public record DimensionFilterGroup(String groupType, List<DimensionFilter> filters) {

  public static DimensionFilterGroup and(List<DimensionFilter> filters) {
    return new DimensionFilterGroup("and", List.copyOf(filters));
  }
}
