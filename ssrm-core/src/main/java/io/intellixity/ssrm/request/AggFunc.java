package io.intellixity.ssrm.request;

import io.intellixity.ssrm.error.UnsupportedFeatureException;

import java.util.Locale;

/** Closed set of aggregation functions a value column may request. */
public enum AggFunc {
  SUM("sum"),
  AVG("avg"),
  MIN("min"),
  MAX("max"),
  COUNT("count");

  private final String wireName;

  AggFunc(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  /** Value used for a pivot slice that has no documents. */
  public Object neutralValue() {
    return (this == SUM || this == COUNT) ? (Object) 0 : null;
  }

  /** Null or blank means {@link #SUM}. */
  public static AggFunc parse(String raw) {
    if (raw == null || raw.isBlank()) return SUM;
    String s = raw.trim().toLowerCase(Locale.ROOT);
    for (AggFunc f : values()) {
      if (f.wireName.equals(s)) return f;
    }
    throw new UnsupportedFeatureException("aggFunc:" + raw, "Aggregation function '" + raw + "' is not supported");
  }
}
