package io.intellixity.ssrm.mongo;

import io.intellixity.ssrm.exec.GridRows;
import io.intellixity.ssrm.request.AggFunc;
import io.intellixity.ssrm.request.ColumnSpec;
import io.intellixity.ssrm.request.SortModelItem;
import io.intellixity.ssrm.request.SsrmRequest;
import org.bson.Document;
import org.bson.types.ObjectId;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Builds the page pipeline for one request.
 * <p>
 * Shape: base stages, one equality {@code $match} per selected group key, the filter {@code $match}, the
 * grouping stages for the current level (none at leaf level), then a {@code $facet} with a {@code rows}
 * branch (sort, skip, limit, optional projection) and a {@code total} branch ({@code $count: "n"}).
 * <p>
 * Pivot grouping runs in two passes: first by (row group value, pivot tuple) into internal accumulators,
 * then by row group value, pushing one {@code {k, v}} slice per pivot key and re-aggregating the totals.
 * Internal fields are prefixed with {@value #INTERNAL} and projected away.
 */
final class MongoPipelineBuilder {
  static final String DELIMITER = "`";
  static final String FACET_ROWS = "rows";
  static final String FACET_TOTAL = "total";
  static final String COUNT_FIELD = "n";

  private static final String INTERNAL = "__";
  private static final String SLICES = INTERNAL + "slices";
  private static final String DOC_COUNT = INTERNAL + "count";

  private final SsrmRequest request;
  private final List<Document> base;

  MongoPipelineBuilder(SsrmRequest request, List<Document> base) {
    this.request = Objects.requireNonNull(request, "request");
    this.base = (base == null) ? List.of() : base;
  }

  List<Document> build() {
    List<Document> p = scopeStages(request, base);

    if (!request.isLeafLevel()) {
      if (request.hasPivot()) pivotGroup(p);
      else p.add(new Document("$group", plainGroup()));
    }

    List<Document> rows = new ArrayList<>();
    rows.add(new Document("$sort", sortSpec()));
    if (request.startRow() > 0) rows.add(new Document("$skip", request.startRow()));
    rows.add(new Document("$limit", Math.max(1, request.pageSize())));
    if (request.isLeafLevel() && !request.fields().isEmpty()) {
      Document proj = new Document();
      for (String f : request.fields()) proj.append(f, 1);
      rows.add(new Document("$project", proj));
    }

    p.add(new Document("$facet", new Document(FACET_ROWS, rows)
        .append(FACET_TOTAL, List.of(new Document("$count", COUNT_FIELD)))));
    return p;
  }

  /** Base stages, group key matches and the filter match. */
  static List<Document> scopeStages(SsrmRequest request, List<Document> base) {
    List<Document> p = new ArrayList<>();
    if (base != null) p.addAll(base);
    for (int i = 0; i < request.depth(); i++) {
      p.add(new Document("$match", groupKeyMatch(request.rowGroupCols().get(i).field(), request.groupKeys().get(i))));
    }
    Document filter = MongoFilterRenderer.toBson(request.filter());
    if (!filter.isEmpty()) p.add(new Document("$match", filter));
    return p;
  }

  /**
   * Equality on a group value sent back by the grid. Dates and ObjectIds reach the grid as ISO instants and
   * hex strings, so such keys match either the raw string or the decoded value.
   */
  static Document groupKeyMatch(String field, Object key) {
    if (key instanceof String s) {
      Object decoded = decodeGroupKey(s);
      if (decoded != null) return new Document(field, new Document("$in", List.of(s, decoded)));
    }
    return new Document(field, key);
  }

  private static Object decodeGroupKey(String s) {
    if (ObjectId.isValid(s)) return new ObjectId(s);
    if (s.length() < 20 || s.charAt(10) != 'T') return null;
    try {
      return Date.from(Instant.parse(s));
    } catch (DateTimeParseException e) {
      return null;
    }
  }

  /**
   * String key for a pivot tuple held in {@code prefix0..prefix(n-1)}: each part {@code $toString}-ed, null
   * and missing become {@code ""}, parts joined by the backtick delimiter.
   */
  static Object pivotKeyExpression(String prefix, int n) {
    List<Object> parts = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (i > 0) parts.add(DELIMITER);
      parts.add(new Document("$ifNull", Arrays.asList(new Document("$toString", prefix + i), "")));
    }
    return new Document("$concat", parts);
  }

  private Document plainGroup() {
    Document g = new Document(GridRows.ID, ref(request.currentGroupCol().field()));
    for (ColumnSpec v : request.valueCols()) {
      g.append(v.id(), accumulator(v.aggFunc(), ref(v.field())));
    }
    g.append(GridRows.CHILD_COUNT, new Document("$sum", 1));
    return g;
  }

  private void pivotGroup(List<Document> p) {
    List<ColumnSpec> values = request.valueCols();
    int pivots = request.pivotCols().size();

    Document id = new Document("r", ref(request.currentGroupCol().field()));
    for (int i = 0; i < pivots; i++) id.append("p" + i, ref(request.pivotCols().get(i).field()));

    Document first = new Document(GridRows.ID, id).append(DOC_COUNT, new Document("$sum", 1));
    for (int i = 0; i < values.size(); i++) {
      ColumnSpec v = values.get(i);
      String src = ref(v.field());
      if (v.aggFunc() == AggFunc.AVG) {
        first.append(sumField(i), new Document("$sum", src));
        first.append(numField(i), new Document("$sum", cond(new Document("$isNumber", src), 1, 0)));
      } else {
        first.append(valueField(i), accumulator(v.aggFunc(), src));
      }
    }
    p.add(new Document("$group", first));

    Document slice = new Document();
    Document second = new Document(GridRows.ID, "$_id.r")
        .append(GridRows.CHILD_COUNT, new Document("$sum", "$" + DOC_COUNT));
    Document fill = new Document(GridRows.PIVOT, new Document("$arrayToObject", "$" + SLICES));
    Document cleanup = new Document(SLICES, 0);

    for (int i = 0; i < values.size(); i++) {
      ColumnSpec v = values.get(i);
      switch (v.aggFunc()) {
        case AVG -> {
          slice.append(v.id(), average("$" + sumField(i), "$" + numField(i)));
          second.append(sumField(i), new Document("$sum", "$" + sumField(i)));
          second.append(numField(i), new Document("$sum", "$" + numField(i)));
          fill.append(v.id(), average("$" + sumField(i), "$" + numField(i)));
          cleanup.append(sumField(i), 0).append(numField(i), 0);
        }
        case MIN -> {
          slice.append(v.id(), "$" + valueField(i));
          second.append(v.id(), new Document("$min", "$" + valueField(i)));
        }
        case MAX -> {
          slice.append(v.id(), "$" + valueField(i));
          second.append(v.id(), new Document("$max", "$" + valueField(i)));
        }
        case SUM, COUNT -> {
          slice.append(v.id(), "$" + valueField(i));
          second.append(v.id(), new Document("$sum", "$" + valueField(i)));
        }
      }
    }
    second.append(SLICES, new Document("$push",
        new Document("k", pivotKeyExpression("$_id.p", pivots)).append("v", slice)));

    p.add(new Document("$group", second));
    p.add(new Document("$addFields", fill));
    p.add(new Document("$project", cleanup));
  }

  private Document sortSpec() {
    Document sort = new Document();
    for (SortModelItem item : request.sortModel()) {
      String path = sortPath(item);
      if (path != null && !sort.containsKey(path)) sort.append(path, item.sort() == SortModelItem.Direction.DESC ? -1 : 1);
    }
    if (!sort.containsKey(GridRows.ID)) sort.append(GridRows.ID, 1);
    return sort;
  }

  /** Null means the column does not exist at this level and is skipped. */
  private String sortPath(SortModelItem item) {
    String colId = item.colId();
    if (colId.startsWith("$")) return null;

    if (!request.isLeafLevel()) {
      ColumnSpec current = request.currentGroupCol();
      if (item.isAutoGroupColumn() || colId.equals(current.id()) || colId.equals(current.field())) {
        return GridRows.ID;
      }
      for (ColumnSpec v : request.valueCols()) {
        if (v.id().equals(colId)) return v.id();
      }
      if (GridRows.CHILD_COUNT.equals(colId)) return GridRows.CHILD_COUNT;
      return null;
    }

    if (item.isAutoGroupColumn()) return null;
    for (ColumnSpec c : request.rowGroupCols()) if (c.id().equals(colId)) return c.field();
    for (ColumnSpec c : request.valueCols()) if (c.id().equals(colId)) return c.field();
    for (ColumnSpec c : request.pivotCols()) if (c.id().equals(colId)) return c.field();
    return colId;
  }

  private static Object accumulator(AggFunc f, String src) {
    return switch (f) {
      case SUM -> new Document("$sum", src);
      case AVG -> new Document("$avg", src);
      case MIN -> new Document("$min", numericOnly(src));
      case MAX -> new Document("$max", numericOnly(src));
      case COUNT -> new Document("$sum", 1);
    };
  }

  private static Document numericOnly(String src) {
    return cond(new Document("$isNumber", src), src, null);
  }

  private static Document average(String sum, String count) {
    return cond(new Document("$gt", Arrays.asList(count, 0)), new Document("$divide", Arrays.asList(sum, count)), null);
  }

  private static Document cond(Object test, Object then, Object otherwise) {
    return new Document("$cond", Arrays.asList(test, then, otherwise));
  }

  private static String ref(String field) {
    return "$" + field;
  }

  private static String valueField(int i) { return INTERNAL + "v" + i; }
  private static String sumField(int i) { return INTERNAL + "s" + i; }
  private static String numField(int i) { return INTERNAL + "n" + i; }
}
