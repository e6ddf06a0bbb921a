package io.intellixity.ssrm.request;

import java.util.Objects;

public record SortModelItem(String colId, Direction sort) {
  public enum Direction { ASC, DESC }

  /** Column id prefix the grid uses for its auto group column. */
  public static final String AUTO_COLUMN_PREFIX = "ag-Grid-AutoColumn";

  public SortModelItem {
    Objects.requireNonNull(colId, "colId");
    Objects.requireNonNull(sort, "sort");
  }

  public boolean isAutoGroupColumn() {
    return colId.startsWith(AUTO_COLUMN_PREFIX);
  }
}
