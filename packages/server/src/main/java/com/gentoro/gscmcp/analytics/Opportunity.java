package com.gentoro.gscmcp.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

/** Size of a quick win, by additional clicks at the target CTR. */
public enum Opportunity {
  HIGH("High"),
  MEDIUM("Medium"),
  LOW("Low");

  private final String label;

  Opportunity(String label) {
    this.label = label;
  }

  @JsonValue
  public String label() {
    return label;
  }

  static Opportunity forAdditionalClicks(long additionalClicks) {
    if (additionalClicks >= 100) return HIGH;
    if (additionalClicks >= 30) return MEDIUM;
    return LOW;
  }
}
