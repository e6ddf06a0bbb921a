package io.intellixity.ssrm.mongo;

import org.bson.types.Decimal128;
import org.bson.types.ObjectId;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Converts driver values into plain JSON-friendly Java values. */
final class BsonValues {
  private BsonValues() {}

  static Object plain(Object v) {
    if (v == null) return null;
    if (v instanceof ObjectId id) return id.toHexString();
    if (v instanceof Date d) return d.toInstant();
    if (v instanceof Decimal128 dec) {
      // NaN and infinities have no BigDecimal form
      if (dec.isNaN() || dec.isInfinite()) return dec.toString();
      return dec.bigDecimalValue();
    }
    if (v instanceof Map<?, ?> m) return plainMap(m);
    if (v instanceof List<?> l) {
      List<Object> out = new ArrayList<>(l.size());
      for (Object o : l) out.add(plain(o));
      return out;
    }
    return v;
  }

  static Map<String, Object> plainMap(Map<?, ?> m) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<?, ?> e : m.entrySet()) out.put(String.valueOf(e.getKey()), plain(e.getValue()));
    return out;
  }
}
