package io.intellixity.ssrm.filter;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.ssrm.error.ValidationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Parses the grid {@code filterModel} into a {@link FilterElement} tree.
 * <p>
 * Accepted shapes:
 * <ul>
 *   <li>column map: {@code {colId: condition, ...}}, columns combined with AND</li>
 *   <li>simple condition: {@code {filterType, type, filter, filterTo, dateFrom, dateTo, values}}</li>
 *   <li>combined condition: {@code {filterType, operator, conditions: [...]}} or legacy
 *       {@code {filterType, operator, condition1, condition2}}</li>
 *   <li>advanced model: {@code {filterType: "join", type: "AND"|"OR", conditions: [...]}} with {@code colId}
 *       on every leaf</li>
 * </ul>
 */
public final class FilterModelParser {
  private static final String JOIN = "join";

  /** Returns null for an absent, null or empty model. */
  public FilterElement parse(JsonNode model) {
    if (model == null || model.isNull() || model.isMissingNode()) return null;
    if (!model.isObject()) throw new ValidationException("filterModel must be an object or null");
    if (model.isEmpty()) return null;

    if (JOIN.equals(model.path("filterType").asText(null))) {
      return parseJoin(model);
    }

    List<FilterElement> columns = new ArrayList<>();
    Iterator<Map.Entry<String, JsonNode>> it = model.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      FilterElement el = parseColumn(e.getKey(), e.getValue());
      if (el != null) columns.add(el);
    }
    if (columns.isEmpty()) return null;
    return columns.size() == 1 ? columns.get(0) : LogicalGroup.and(columns);
  }

  private FilterElement parseColumn(String colId, JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (!n.isObject()) throw new ValidationException("filterModel." + colId + " must be an object");
    FilterType type = FilterType.parse(requireText(n.get("filterType"), "filterModel." + colId + ".filterType"));

    if (n.has("conditions")) {
      JsonNode conditions = n.get("conditions");
      if (!conditions.isArray()) throw new ValidationException("filterModel." + colId + ".conditions must be an array");
      List<FilterElement> parts = new ArrayList<>();
      for (JsonNode c : conditions) parts.add(parseChild(colId, type, c));
      return group(Clause.parse(n.path("operator").asText(null), Clause.AND), parts);
    }

    if (n.has("condition1")) {
      List<FilterElement> parts = new ArrayList<>();
      parts.add(parseChild(colId, type, n.get("condition1")));
      if (n.hasNonNull("condition2")) parts.add(parseChild(colId, type, n.get("condition2")));
      return group(Clause.parse(n.path("operator").asText(null), Clause.AND), parts);
    }

    return parseSimple(colId, type, n);
  }

  private FilterElement parseChild(String colId, FilterType parentType, JsonNode n) {
    if (n == null || !n.isObject()) throw new ValidationException("filterModel." + colId + " conditions must be objects");
    String raw = n.path("filterType").asText(null);
    FilterType type = (raw == null) ? parentType : FilterType.parse(raw);
    return parseSimple(colId, type, n);
  }

  private FilterElement parseJoin(JsonNode n) {
    JsonNode conditions = n.get("conditions");
    if (conditions == null || !conditions.isArray()) {
      throw new ValidationException("Advanced filter join requires a conditions array");
    }
    List<FilterElement> parts = new ArrayList<>();
    for (JsonNode c : conditions) {
      if (c == null || !c.isObject()) throw new ValidationException("Advanced filter conditions must be objects");
      String filterType = requireText(c.get("filterType"), "advanced filter filterType");
      if (JOIN.equals(filterType)) {
        parts.add(parseJoin(c));
        continue;
      }
      String colId = requireText(c.get("colId"), "advanced filter colId");
      parts.add(parseSimple(colId, FilterType.parse(filterType), c));
    }
    return group(Clause.parse(n.path("type").asText(null), Clause.AND), parts);
  }

  private static FilterElement group(Clause clause, List<FilterElement> parts) {
    if (parts.size() == 1) return parts.get(0);
    return new LogicalGroup(clause, parts);
  }

  private static Condition parseSimple(String colId, FilterType type, JsonNode n) {
    String label = "filterModel." + colId;
    if (colId.isBlank() || colId.startsWith("$")) {
      throw new ValidationException("Invalid filter column id '" + colId + "'");
    }
    return switch (type) {
      case TEXT -> {
        FilterOperator op = FilterOperator.parse(type, n.path("type").asText("contains"));
        Object value = op.isNullary() ? null : FilterValues.text(n.get("filter"), label + ".filter");
        yield Condition.of(colId, type, op, value);
      }
      case NUMBER -> {
        FilterOperator op = FilterOperator.parse(type, n.path("type").asText("equals"));
        if (op.isNullary()) yield Condition.of(colId, type, op, null);
        Number value = FilterValues.number(n.get("filter"), label + ".filter");
        Number to = (op == FilterOperator.IN_RANGE) ? FilterValues.number(n.get("filterTo"), label + ".filterTo") : null;
        yield new Condition(colId, type, op, value, to);
      }
      case DATE -> {
        JsonNode from = n.hasNonNull("dateFrom") ? n.get("dateFrom") : n.get("filter");
        JsonNode to = n.hasNonNull("dateTo") ? n.get("dateTo") : n.get("filterTo");
        String defaultType = (to != null && !to.isNull()) ? "inRange" : "equals";
        FilterOperator op = FilterOperator.parse(type, n.path("type").asText(defaultType));
        if (op.isNullary()) yield Condition.of(colId, type, op, null);
        yield new Condition(colId, type, op,
            FilterValues.date(from, label + ".dateFrom"),
            (op == FilterOperator.IN_RANGE) ? FilterValues.date(to, label + ".dateTo") : null);
      }
      case SET -> {
        JsonNode values = n.get("values");
        if (values == null || !values.isArray()) throw new ValidationException(label + ".values must be an array");
        List<Object> out = new ArrayList<>();
        for (JsonNode v : values) out.add(FilterValues.scalar(v, label + ".values[]"));
        yield Condition.of(colId, type, FilterOperator.IN, out);
      }
    };
  }

  private static String requireText(JsonNode n, String label) {
    if (n == null || n.isNull() || !n.isTextual() || n.asText().isBlank()) {
      throw new ValidationException(label + " is required");
    }
    return n.asText();
  }
}
