package io.intellixity.ssrm.request;

import io.intellixity.ssrm.filter.FilterElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Validated SSRM request. Built by {@link SsrmRequestParser}; every list is non-null and unmodifiable.
 * <p>
 * The row window is half-open: {@code [startRow, endRow)}. {@code groupKeys} may hold nulls (a null group
 * value is a real group). {@code filter} is null when no filter applies; {@code fields} is empty when leaf
 * rows are not projected; {@code database} and {@code collection} are null unless the caller overrides them.
 */
public record SsrmRequest(
    int startRow,
    int endRow,
    List<ColumnSpec> rowGroupCols,
    List<ColumnSpec> valueCols,
    List<ColumnSpec> pivotCols,
    boolean pivotMode,
    List<Object> groupKeys,
    FilterElement filter,
    List<SortModelItem> sortModel,
    List<String> fields,
    String database,
    String collection
) {
  public SsrmRequest {
    if (startRow < 0 || endRow < startRow) {
      throw new IllegalArgumentException("Invalid row window [" + startRow + ", " + endRow + ")");
    }
    rowGroupCols = List.copyOf(Objects.requireNonNull(rowGroupCols, "rowGroupCols"));
    valueCols = List.copyOf(Objects.requireNonNull(valueCols, "valueCols"));
    pivotCols = List.copyOf(Objects.requireNonNull(pivotCols, "pivotCols"));
    groupKeys = Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(groupKeys, "groupKeys")));
    sortModel = List.copyOf(Objects.requireNonNull(sortModel, "sortModel"));
    fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    if (groupKeys.size() > rowGroupCols.size()) {
      throw new IllegalArgumentException("groupKeys exceed rowGroupCols");
    }
  }

  public int depth() { return groupKeys.size(); }

  public boolean isLeafLevel() { return groupKeys.size() == rowGroupCols.size(); }

  public int pageSize() { return endRow - startRow; }

  /** Pivot mode with at least one pivot column; pivot keys are resolved whenever this holds. */
  public boolean isPivotActive() {
    return pivotMode && !pivotCols.isEmpty();
  }

  /** Pivot grouping applies only at group levels. */
  public boolean hasPivot() {
    return isPivotActive() && !isLeafLevel();
  }

  /** Row-group column grouped at the current level; null at leaf level. */
  public ColumnSpec currentGroupCol() {
    return isLeafLevel() ? null : rowGroupCols.get(depth());
  }
}
