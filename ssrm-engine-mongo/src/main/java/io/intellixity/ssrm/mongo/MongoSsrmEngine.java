package io.intellixity.ssrm.mongo;

import com.mongodb.MongoException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import io.intellixity.ssrm.error.ConnectivityException;
import io.intellixity.ssrm.error.DriverException;
import io.intellixity.ssrm.error.ValidationException;
import io.intellixity.ssrm.exec.SsrmEngine;
import io.intellixity.ssrm.exec.SsrmResult;
import io.intellixity.ssrm.exec.SsrmScope;
import io.intellixity.ssrm.exec.handle.ConnectionProvider;
import io.intellixity.ssrm.request.SsrmRequest;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * MongoDB implementation of {@link SsrmEngine}.
 * <p>
 * One aggregation per call, plus one pivot key lookup in pivot mode. Nothing is retried; driver failures are
 * mapped to {@link ConnectivityException} (timeouts, socket and auth failures) or {@link DriverException}.
 */
public final class MongoSsrmEngine implements SsrmEngine {
  private static final Logger log = LoggerFactory.getLogger(MongoSsrmEngine.class);

  private final ConnectionProvider<MongoClient> connections;
  private final MongoPivotKeyResolver pivotKeys = new MongoPivotKeyResolver();

  public MongoSsrmEngine(ConnectionProvider<MongoClient> connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  @Override
  public SsrmResult fetchRows(SsrmScope scope, SsrmRequest request) {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(request, "request");

    MongoClient client = connections.getClient();
    MongoCollection<Document> col;
    try {
      col = client.getDatabase(scope.database()).getCollection(scope.collection());
    } catch (IllegalArgumentException e) {
      throw new ValidationException("Invalid database or collection name '" + scope.database() + "." + scope.collection() + "'", e);
    }

    List<Document> base = toDocuments(scope.basePipeline());
    try {
      List<String> keys = request.isPivotActive() ? pivotKeys.resolve(col, request, base) : List.of();
      List<Document> pipeline = new MongoPipelineBuilder(request, base).build();
      if (log.isDebugEnabled()) {
        log.debug("ssrm.mongo op=aggregate provider={} collection={}.{} depth={} leaf={} pivot={} stages={} window=[{},{})",
            connections.id(), scope.database(), scope.collection(), request.depth(), request.isLeafLevel(),
            request.hasPivot(), pipeline.size(), request.startRow(), request.endRow());
      }
      Document facet = col.aggregate(pipeline).allowDiskUse(true).first();
      SsrmResult result = new MongoResultShaper(request).shape(facet, keys);
      if (log.isDebugEnabled()) {
        log.debug("ssrm.mongo op=aggregate rows={} lastRow={} pivotKeys={}", result.rows().size(), result.lastRow(), keys.size());
      }
      return result;
    } catch (MongoTimeoutException | MongoSocketException | MongoSecurityException e) {
      throw new ConnectivityException("Unable to reach MongoDB: " + e.getMessage(), e);
    } catch (MongoException e) {
      throw new DriverException("MongoDB aggregation failed: " + e.getMessage(), e);
    }
  }

  private static List<Document> toDocuments(List<Map<String, Object>> stages) {
    List<Document> out = new ArrayList<>(stages.size());
    for (Map<String, Object> s : stages) out.add(s instanceof Document d ? d : new Document(s));
    return out;
  }
}
