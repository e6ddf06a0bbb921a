package io.intellixity.ssrm.exec;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One page of grid rows. {@code lastRow} is the row count at the current grouping level under the active
 * filter, or {@link #UNKNOWN_LAST_ROW}.
 */
public record SsrmResult(List<Map<String, Object>> rows, long lastRow, List<String> pivotKeys) {
  public static final long UNKNOWN_LAST_ROW = -1L;

  public SsrmResult {
    rows = List.copyOf(Objects.requireNonNull(rows, "rows"));
    pivotKeys = List.copyOf(Objects.requireNonNull(pivotKeys, "pivotKeys"));
  }
}
