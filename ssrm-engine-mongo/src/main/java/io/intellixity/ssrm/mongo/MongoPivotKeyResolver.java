package io.intellixity.ssrm.mongo;

import com.mongodb.client.MongoCollection;
import io.intellixity.ssrm.request.SsrmRequest;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Resolves the canonical pivot key list for a filter scope.
 * <p>
 * Group keys are deliberately not applied, so every level of the same grid sees the same columns.
 */
final class MongoPivotKeyResolver {
  private static final Logger log = LoggerFactory.getLogger(MongoPivotKeyResolver.class);

  List<String> resolve(MongoCollection<Document> collection, SsrmRequest request, List<Document> base) {
    List<Document> pipeline = pipeline(request, base);
    if (log.isDebugEnabled()) {
      log.debug("ssrm.mongo op=pivotKeys collection={} stages={}", collection.getNamespace().getFullName(), pipeline.size());
    }
    List<String> keys = keysOf(collection.aggregate(pipeline).allowDiskUse(true));
    if (log.isDebugEnabled()) {
      log.debug("ssrm.mongo op=pivotKeys resolved={}", keys.size());
    }
    return keys;
  }

  static List<Document> pipeline(SsrmRequest request, List<Document> base) {
    List<Document> p = new ArrayList<>();
    if (base != null) p.addAll(base);
    Document filter = MongoFilterRenderer.toBson(request.filter());
    if (!filter.isEmpty()) p.add(new Document("$match", filter));

    int n = request.pivotCols().size();
    Document tuple = new Document();
    for (int i = 0; i < n; i++) tuple.append("p" + i, "$" + request.pivotCols().get(i).field());
    p.add(new Document("$group", new Document("_id", tuple)));
    p.add(new Document("$group", new Document("_id", MongoPipelineBuilder.pivotKeyExpression("$_id.p", n))));
    p.add(new Document("$sort", new Document("_id", 1)));
    return p;
  }

  static List<String> keysOf(Iterable<Document> docs) {
    TreeSet<String> keys = new TreeSet<>();
    for (Document d : docs) {
      Object k = d.get("_id");
      keys.add(k == null ? "" : String.valueOf(k));
    }
    return new ArrayList<>(keys);
  }
}
