package io.intellixity.ssrm.filter;

import io.intellixity.ssrm.error.UnsupportedFeatureException;

/**
 * Closed operator set, keyed by the grid's {@code type} wire names.
 * <p>
 * {@link #appliesTo(FilterType)} decides which operators a column family accepts; anything else is rejected
 * while parsing, so renderers can switch over this enum exhaustively.
 */
public enum FilterOperator {
  EQUALS("equals"),
  NOT_EQUAL("notEqual"),
  CONTAINS("contains"),
  NOT_CONTAINS("notContains"),
  STARTS_WITH("startsWith"),
  ENDS_WITH("endsWith"),
  LESS_THAN("lessThan"),
  LESS_THAN_OR_EQUAL("lessThanOrEqual"),
  GREATER_THAN("greaterThan"),
  GREATER_THAN_OR_EQUAL("greaterThanOrEqual"),
  IN_RANGE("inRange"),
  BLANK("blank"),
  NOT_BLANK("notBlank"),
  IN("in");

  private final String wireName;

  FilterOperator(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  /** True for operators that take no operand. */
  public boolean isNullary() {
    return this == BLANK || this == NOT_BLANK;
  }

  public boolean appliesTo(FilterType type) {
    return switch (type) {
      case TEXT -> switch (this) {
        case EQUALS, NOT_EQUAL, CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, BLANK, NOT_BLANK -> true;
        default -> false;
      };
      case NUMBER, DATE -> switch (this) {
        case EQUALS, NOT_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, GREATER_THAN, GREATER_THAN_OR_EQUAL,
            IN_RANGE, BLANK, NOT_BLANK -> true;
        default -> false;
      };
      case SET -> this == IN;
    };
  }

  public static FilterOperator parse(FilterType type, String raw) {
    for (FilterOperator op : values()) {
      if (op.wireName.equals(raw) && op.appliesTo(type)) return op;
    }
    throw new UnsupportedFeatureException("filterOperator:" + raw,
        "Filter operator '" + raw + "' is not supported for " + type.wireName() + " filters");
  }
}
