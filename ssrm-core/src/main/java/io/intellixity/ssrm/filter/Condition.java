package io.intellixity.ssrm.filter;

import java.util.Objects;

/**
 * Single-column predicate.
 * <p>
 * Operand types follow the filter family: {@code String} for text, {@code Number} for number,
 * {@link java.time.LocalDate} for date and {@code List<Object>} for set. {@code valueTo} is only set for
 * {@link FilterOperator#IN_RANGE}.
 */
public final class Condition implements FilterElement {
  private final String field;
  private final FilterType type;
  private final FilterOperator operator;
  private final Object value;
  private final Object valueTo;

  public Condition(String field, FilterType type, FilterOperator operator, Object value, Object valueTo) {
    this.field = Objects.requireNonNull(field, "field");
    this.type = Objects.requireNonNull(type, "type");
    this.operator = Objects.requireNonNull(operator, "operator");
    if (!operator.appliesTo(type)) {
      throw new IllegalArgumentException(operator + " does not apply to " + type);
    }
    this.value = value;
    this.valueTo = valueTo;
  }

  public String field() { return field; }
  public FilterType type() { return type; }
  public FilterOperator operator() { return operator; }
  public Object value() { return value; }
  public Object valueTo() { return valueTo; }

  public static Condition of(String field, FilterType type, FilterOperator operator, Object value) {
    return new Condition(field, type, operator, value, null);
  }

  public static Condition range(String field, FilterType type, Object from, Object to) {
    return new Condition(field, type, FilterOperator.IN_RANGE, from, to);
  }

  @Override
  public String toString() {
    return field + " " + operator.wireName() + " " + value + (valueTo == null ? "" : ".." + valueTo);
  }
}
