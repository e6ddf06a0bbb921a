package io.intellixity.ssrm.filter;

import io.intellixity.ssrm.error.ValidationException;

public enum Clause {
  AND,
  OR;

  static Clause parse(String raw, Clause def) {
    if (raw == null || raw.isBlank()) return def;
    try {
      return Clause.valueOf(raw.trim().toUpperCase());
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Filter operator must be AND or OR but was '" + raw + "'");
    }
  }
}
