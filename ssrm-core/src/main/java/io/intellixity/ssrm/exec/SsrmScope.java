package io.intellixity.ssrm.exec;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Where a request runs: the target namespace plus the caller-owned stages prepended to every pipeline
 * (tenant scoping, pre-filters).
 */
public record SsrmScope(String database, String collection, List<Map<String, Object>> basePipeline) {
  public SsrmScope {
    Objects.requireNonNull(database, "database");
    Objects.requireNonNull(collection, "collection");
    basePipeline = (basePipeline == null) ? List.of() : List.copyOf(basePipeline);
  }

  public static SsrmScope of(String database, String collection) {
    return new SsrmScope(database, collection, List.of());
  }
}
