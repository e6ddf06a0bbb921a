package io.intellixity.ssrm.mongo;

import io.intellixity.ssrm.filter.Clause;
import io.intellixity.ssrm.filter.Condition;
import io.intellixity.ssrm.filter.FilterElement;
import io.intellixity.ssrm.filter.FilterOperator;
import io.intellixity.ssrm.filter.LogicalGroup;
import org.bson.Document;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders the filter AST to a {@code $match} document.
 * <p>
 * Text matching is case-insensitive and literal. Negated operators wrap the positive form in {@code $nor},
 * so documents missing the field match {@code notEqual}/{@code notContains}. Dates are compared as whole
 * UTC days.
 */
final class MongoFilterRenderer {
  private MongoFilterRenderer() {}

  static Document toBson(FilterElement filter) {
    if (filter == null) return new Document();
    return render(filter);
  }

  private static Document render(FilterElement el) {
    if (el instanceof LogicalGroup g) {
      List<Document> parts = new ArrayList<>();
      for (FilterElement child : g.elements()) {
        Document d = render(child);
        if (!d.isEmpty()) parts.add(d);
      }
      if (parts.isEmpty()) return new Document();
      if (parts.size() == 1) return parts.get(0);
      return new Document(g.clause() == Clause.OR ? "$or" : "$and", parts);
    }
    if (!(el instanceof Condition c)) {
      throw new IllegalArgumentException("Unsupported filter element: " + el.getClass().getName());
    }
    return switch (c.type()) {
      case TEXT -> text(c);
      case NUMBER -> number(c);
      case DATE -> date(c);
      case SET -> new Document(c.field(), new Document("$in", c.value()));
    };
  }

  private static Document text(Condition c) {
    String f = c.field();
    String v = (c.value() == null) ? "" : Pattern.quote(String.valueOf(c.value()));
    return switch (c.operator()) {
      case EQUALS -> regex(f, "^" + v + "$");
      case NOT_EQUAL -> nor(regex(f, "^" + v + "$"));
      case CONTAINS -> regex(f, v);
      case NOT_CONTAINS -> nor(regex(f, v));
      case STARTS_WITH -> regex(f, "^" + v);
      case ENDS_WITH -> regex(f, v + "$");
      case BLANK -> blank(f);
      case NOT_BLANK -> nor(blank(f));
      default -> throw new IllegalArgumentException("Unsupported text operator: " + c.operator());
    };
  }

  private static Document number(Condition c) {
    String f = c.field();
    Object v = c.value();
    return switch (c.operator()) {
      case EQUALS -> new Document(f, v);
      case NOT_EQUAL -> new Document(f, new Document("$ne", v));
      case LESS_THAN -> new Document(f, new Document("$lt", v));
      case LESS_THAN_OR_EQUAL -> new Document(f, new Document("$lte", v));
      case GREATER_THAN -> new Document(f, new Document("$gt", v));
      case GREATER_THAN_OR_EQUAL -> new Document(f, new Document("$gte", v));
      case IN_RANGE -> new Document(f, new Document("$gte", v).append("$lte", c.valueTo()));
      case BLANK -> new Document(f, null);
      case NOT_BLANK -> new Document(f, new Document("$ne", null));
      default -> throw new IllegalArgumentException("Unsupported number operator: " + c.operator());
    };
  }

  private static Document date(Condition c) {
    String f = c.field();
    if (c.operator() == FilterOperator.BLANK) return new Document(f, null);
    if (c.operator() == FilterOperator.NOT_BLANK) return new Document(f, new Document("$ne", null));

    LocalDate day = (LocalDate) c.value();
    Date start = startOf(day);
    Date next = startOf(day.plusDays(1));
    return switch (c.operator()) {
      case EQUALS -> new Document(f, new Document("$gte", start).append("$lt", next));
      case NOT_EQUAL -> nor(new Document(f, new Document("$gte", start).append("$lt", next)));
      case LESS_THAN -> new Document(f, new Document("$lt", start));
      case LESS_THAN_OR_EQUAL -> new Document(f, new Document("$lt", next));
      case GREATER_THAN -> new Document(f, new Document("$gte", next));
      case GREATER_THAN_OR_EQUAL -> new Document(f, new Document("$gte", start));
      case IN_RANGE -> new Document(f, new Document("$gte", start)
          .append("$lt", startOf(((LocalDate) c.valueTo()).plusDays(1))));
      default -> throw new IllegalArgumentException("Unsupported date operator: " + c.operator());
    };
  }

  static Date startOf(LocalDate day) {
    return Date.from(day.atStartOfDay(ZoneOffset.UTC).toInstant());
  }

  private static Document regex(String field, String pattern) {
    return new Document(field, new Document("$regex", pattern).append("$options", "i"));
  }

  private static Document blank(String field) {
    return new Document(field, new Document("$in", Arrays.asList(null, "")));
  }

  private static Document nor(Document positive) {
    return new Document("$nor", List.of(positive));
  }
}
