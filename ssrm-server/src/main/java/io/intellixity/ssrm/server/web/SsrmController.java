package io.intellixity.ssrm.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.ssrm.exec.SsrmResult;
import io.intellixity.ssrm.request.SsrmRequest;
import io.intellixity.ssrm.request.SsrmRequestParser;
import io.intellixity.ssrm.server.service.SsrmService;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/** Grid endpoint. The body is read raw so that parse failures map to 400 with our own message. */
@RestController
public final class SsrmController {
  private static final Logger log = LoggerFactory.getLogger(SsrmController.class);

  private final SsrmRequestParser parser;
  private final BasePipelineResolver basePipelines;
  private final SsrmService service;

  public SsrmController(SsrmRequestParser parser, BasePipelineResolver basePipelines, SsrmService service) {
    this.parser = parser;
    this.basePipelines = basePipelines;
    this.service = service;
  }

  @PostMapping(path = "/ssrm", produces = MediaType.APPLICATION_JSON_VALUE)
  public SsrmResult fetchRows(@RequestBody(required = false) String body, HttpServletRequest http) {
    JsonNode root = parser.readTree(body);
    SsrmRequest request = parser.parse(root);
    List<Map<String, Object>> base = basePipelines.resolve(root.get("basePipeline"), http::getHeader);
    if (log.isDebugEnabled()) {
      log.debug("ssrm.http op=fetchRows depth={} window=[{},{}) baseStages={}",
          request.depth(), request.startRow(), request.endRow(), base.size());
    }
    return service.fetchRows(request, base);
  }
}
