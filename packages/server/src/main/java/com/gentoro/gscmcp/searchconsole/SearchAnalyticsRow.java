package com.gentoro.gscmcp.searchconsole;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.ArrayList;
import java.util.List;

/**
 * One row of a Search Analytics answer. {@code keys} follow the requested dimensions in order;
 * {@code ctr} is a fraction (0..1) and {@code position} a 1-based, possibly fractional rank.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchAnalyticsRow {
  private List<String> keys = new ArrayList<>();
  private long clicks;
  private long impressions;
  private double ctr;
  private double position;

  public SearchAnalyticsRow() {}

  public SearchAnalyticsRow(
      List<String> keys, long clicks, long impressions, double ctr, double position) {
    this.keys = keys == null ? new ArrayList<>() : new ArrayList<>(keys);
    this.clicks = clicks;
    this.impressions = impressions;
    this.ctr = ctr;
    this.position = position;
  }

  public List<String> getKeys() {
    return keys;
  }

  public void setKeys(List<String> keys) {
    this.keys = keys == null ? new ArrayList<>() : keys;
  }

  public long getClicks() {
    return clicks;
  }

  public void setClicks(long clicks) {
    this.clicks = clicks;
  }

  public long getImpressions() {
    return impressions;
  }

  public void setImpressions(long impressions) {
    this.impressions = impressions;
  }

  public double getCtr() {
    return ctr;
  }

  public void setCtr(double ctr) {
    this.ctr = ctr;
  }

  public double getPosition() {
    return position;
  }

  public void setPosition(double position) {
    this.position = position;
  }

  /** Key at {@code index}, or null when the row has fewer keys. */
  public String key(int index) {
    return index < keys.size() ? keys.get(index) : null;
  }
}
