package io.intellixity.ssrm.request;

import java.util.Objects;

/**
 * Grid column descriptor. {@code aggFunc} is only set on value columns.
 */
public record ColumnSpec(String id, String displayName, String field, AggFunc aggFunc) {
  public ColumnSpec {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(field, "field");
    if (displayName == null) displayName = id;
  }
}
