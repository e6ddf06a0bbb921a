package io.intellixity.ssrm.server.service;

import io.intellixity.ssrm.exec.SsrmEngine;
import io.intellixity.ssrm.exec.SsrmResult;
import io.intellixity.ssrm.exec.SsrmScope;
import io.intellixity.ssrm.request.SsrmRequest;
import io.intellixity.ssrm.server.config.SsrmProperties;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public final class SsrmService {
  private final SsrmEngine engine;
  private final SsrmProperties props;

  public SsrmService(SsrmEngine engine, SsrmProperties props) {
    this.engine = engine;
    this.props = props;
  }

  /** Runs the request against its own namespace override or the configured default. */
  public SsrmResult fetchRows(SsrmRequest request, List<Map<String, Object>> basePipeline) {
    String database = (request.database() != null) ? request.database() : props.getMongo().getDatabase();
    String collection = (request.collection() != null) ? request.collection() : props.getMongo().getCollection();
    return engine.fetchRows(new SsrmScope(database, collection, basePipeline), request);
  }
}
