package io.intellixity.ssrm.mongo;

import io.intellixity.ssrm.exec.GridRows;
import io.intellixity.ssrm.exec.SsrmResult;
import io.intellixity.ssrm.request.ColumnSpec;
import io.intellixity.ssrm.request.SsrmRequest;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Turns the {@code $facet} output document into grid rows plus {@code lastRow}. */
final class MongoResultShaper {
  private static final Logger log = LoggerFactory.getLogger(MongoResultShaper.class);

  private final SsrmRequest request;

  MongoResultShaper(SsrmRequest request) {
    this.request = Objects.requireNonNull(request, "request");
  }

  SsrmResult shape(Document facet, List<String> pivotKeys) {
    List<String> keys = (pivotKeys == null) ? List.of() : pivotKeys;
    if (facet == null) return new SsrmResult(List.of(), SsrmResult.UNKNOWN_LAST_ROW, keys);

    List<Map<String, Object>> rows = new ArrayList<>();
    for (Document d : documents(facet.get(MongoPipelineBuilder.FACET_ROWS))) {
      if (rows.size() >= request.pageSize()) break;
      rows.add(request.isLeafLevel() ? BsonValues.plainMap(d) : groupRow(d, keys));
    }
    return new SsrmResult(rows, lastRow(facet), keys);
  }

  private Map<String, Object> groupRow(Document d, List<String> pivotKeys) {
    Map<String, Object> row = new LinkedHashMap<>();
    for (int i = 0; i < request.depth(); i++) {
      row.put(request.rowGroupCols().get(i).field(), request.groupKeys().get(i));
    }
    row.put(request.currentGroupCol().field(), BsonValues.plain(d.get(GridRows.ID)));
    row.put(GridRows.GROUP, true);
    row.put(GridRows.CHILD_COUNT, count(d.get(GridRows.CHILD_COUNT)));
    for (ColumnSpec v : request.valueCols()) {
      row.put(v.id(), BsonValues.plain(d.get(v.id())));
    }
    if (request.hasPivot()) row.put(GridRows.PIVOT, pivot(d.get(GridRows.PIVOT), pivotKeys));
    return row;
  }

  private Map<String, Object> pivot(Object raw, List<String> pivotKeys) {
    Map<?, ?> slices = (raw instanceof Map<?, ?> m) ? m : Map.of();
    Map<String, Object> out = new LinkedHashMap<>();
    for (String key : pivotKeys) {
      Map<?, ?> slice = (slices.get(key) instanceof Map<?, ?> s) ? s : null;
      Map<String, Object> values = new LinkedHashMap<>();
      for (ColumnSpec v : request.valueCols()) {
        Object value = (slice == null) ? null : BsonValues.plain(slice.get(v.id()));
        values.put(v.id(), value == null ? v.aggFunc().neutralValue() : value);
      }
      out.put(key, values);
    }
    if (log.isDebugEnabled() && slices.size() > 0) {
      for (Object k : slices.keySet()) {
        if (!out.containsKey(String.valueOf(k))) {
          log.debug("ssrm.mongo op=shape droppedPivotKey={}", k);
        }
      }
    }
    return out;
  }

  private static long lastRow(Document facet) {
    Object total = facet.get(MongoPipelineBuilder.FACET_TOTAL);
    if (!(total instanceof List<?> l)) return SsrmResult.UNKNOWN_LAST_ROW;
    if (l.isEmpty()) return 0;
    Object first = l.get(0);
    if (!(first instanceof Map<?, ?> m)) return SsrmResult.UNKNOWN_LAST_ROW;
    return (m.get(MongoPipelineBuilder.COUNT_FIELD) instanceof Number n) ? n.longValue() : SsrmResult.UNKNOWN_LAST_ROW;
  }

  private static Object count(Object v) {
    return (v instanceof Number n) ? n.longValue() : 0L;
  }

  private static List<Document> documents(Object v) {
    List<Document> out = new ArrayList<>();
    if (v instanceof List<?> l) {
      for (Object o : l) {
        if (o instanceof Document d) out.add(d);
        else if (o instanceof Map<?, ?> m) out.add(new Document(BsonValues.plainMap(m)));
      }
    }
    return out;
  }
}
