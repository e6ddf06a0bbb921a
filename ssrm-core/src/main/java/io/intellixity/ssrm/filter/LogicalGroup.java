package io.intellixity.ssrm.filter;

import java.util.List;
import java.util.Objects;

public final class LogicalGroup implements FilterElement {
  private final Clause clause;
  private final List<FilterElement> elements;

  public LogicalGroup(Clause clause, List<FilterElement> elements) {
    this.clause = Objects.requireNonNull(clause, "clause");
    this.elements = (elements == null) ? List.of() : List.copyOf(elements);
  }

  public Clause clause() { return clause; }
  public List<FilterElement> elements() { return elements; }

  public static LogicalGroup and(List<FilterElement> elements) {
    return new LogicalGroup(Clause.AND, elements);
  }

  @Override
  public String toString() {
    return clause + elements.toString();
  }
}
