package io.intellixity.ssrm.filter;

import io.intellixity.ssrm.error.UnsupportedFeatureException;

/** Column filter families understood by the engine (the {@code filterType} wire field). */
public enum FilterType {
  TEXT("text"),
  NUMBER("number"),
  DATE("date"),
  SET("set");

  private final String wireName;

  FilterType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  public static FilterType parse(String raw) {
    for (FilterType t : values()) {
      if (t.wireName.equals(raw)) return t;
    }
    throw new UnsupportedFeatureException("filterType:" + raw, "Filter type '" + raw + "' is not supported");
  }
}
