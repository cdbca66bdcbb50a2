package com.gentoro.gscmcp.searchconsole;

/**
 * One filter of a Search Analytics query, e.g. {@code page contains /blog/}.
 *
 * @param dimension query, page, country, device or searchAppearance
 * @param operator equals, contains, notEquals, notContains, includingRegex or excludingRegex
 * @param expression value compared against the dimension
 */
public record DimensionFilter(String dimension, String operator, String expression) {}
