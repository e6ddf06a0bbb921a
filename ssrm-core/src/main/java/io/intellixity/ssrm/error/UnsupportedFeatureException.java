package io.intellixity.ssrm.error;

/** Aggregation function, filter type or filter operator outside the supported closed sets. */
public final class UnsupportedFeatureException extends SsrmException {
  private final String feature;

  public UnsupportedFeatureException(String feature, String message) {
    super(message);
    this.feature = feature;
  }

  public String feature() { return feature; }
}
