package io.intellixity.ssrm.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.ssrm.error.ConnectivityException;
import io.intellixity.ssrm.exec.SsrmEngine;
import io.intellixity.ssrm.exec.SsrmResult;
import io.intellixity.ssrm.exec.SsrmScope;
import io.intellixity.ssrm.request.SsrmRequest;
import io.intellixity.ssrm.request.SsrmRequestParser;
import io.intellixity.ssrm.server.config.SsrmProperties;
import io.intellixity.ssrm.server.service.SsrmService;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

final class SsrmControllerTest {
  private static final String BY_REGION = """
      {"startRow":0,"endRow":100,
       "rowGroupCols":[{"id":"region","field":"region"}],
       "valueCols":[{"id":"amount","field":"amount","aggFunc":"sum"}],
       "sortModel":[{"colId":"amount","sort":"desc"}]}
      """;

  private static final class StubEngine implements SsrmEngine {
    final List<SsrmScope> scopes = new ArrayList<>();
    Supplier<SsrmResult> answer = () -> new SsrmResult(List.of(row("North", 405)), 3, List.of());

    @Override
    public SsrmResult fetchRows(SsrmScope scope, SsrmRequest request) {
      scopes.add(scope);
      return answer.get();
    }
  }

  private static Map<String, Object> row(String region, int amount) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("region", region);
    m.put("group", true);
    m.put("amount", amount);
    return m;
  }

  private final StubEngine engine = new StubEngine();

  private MockMvc mvc(String tenantField) {
    SsrmProperties props = new SsrmProperties();
    ObjectMapper mapper = new ObjectMapper();
    SsrmController controller = new SsrmController(
        new SsrmRequestParser(mapper, props.getMaxPageSize()),
        new BasePipelineResolver(mapper, tenantField, BasePipelineResolver.DEFAULT_TENANT_HEADER),
        new SsrmService(engine, props));
    return MockMvcBuilders.standaloneSetup(controller).setControllerAdvice(new SsrmExceptionHandler()).build();
  }

  @Test
  void validRequest_returnsRowsAndLastRow() throws Exception {
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(BY_REGION))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.rows[0].region").value("North"))
        .andExpect(jsonPath("$.rows[0].amount").value(405))
        .andExpect(jsonPath("$.lastRow").value(3))
        .andExpect(jsonPath("$.pivotKeys").isEmpty());

    assertEquals(1, engine.scopes.size());
    assertEquals("goflow", engine.scopes.get(0).database());
    assertEquals("events", engine.scopes.get(0).collection());
    assertTrue(engine.scopes.get(0).basePipeline().isEmpty());
  }

  @Test
  void namespaceOverride_isForwarded() throws Exception {
    String body = BY_REGION.replace("\"startRow\":0", "\"startRow\":0,\"database\":\"ssrm_test\",\"collection\":\"orders\"");
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk());

    assertEquals("ssrm_test", engine.scopes.get(0).database());
    assertEquals("orders", engine.scopes.get(0).collection());
  }

  @Test
  void malformedJson_is400() throws Exception {
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content("{\"startRow\":"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", containsString("parse")));
    assertTrue(engine.scopes.isEmpty());
  }

  @Test
  void emptyBody_is400() throws Exception {
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON))
        .andExpect(status().isBadRequest());
  }

  @Test
  void unsupportedAggFunc_is501() throws Exception {
    String body = BY_REGION.replace("\"aggFunc\":\"sum\"", "\"aggFunc\":\"median\"");
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isNotImplemented())
        .andExpect(jsonPath("$.error", containsString("not supported")));
  }

  @Test
  void connectivityFailure_is500_andNotRetried() throws Exception {
    engine.answer = () -> {
      throw new ConnectivityException("MongoDB connection string is not configured (ssrm.mongo.uri)");
    };
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(BY_REGION))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error", containsString("not configured")));
    assertEquals(1, engine.scopes.size());
  }

  @Test
  void unexpectedFailure_is500() throws Exception {
    engine.answer = () -> {
      throw new IllegalStateException();
    };
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(BY_REGION))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.error").value(SsrmExceptionHandler.UNKNOWN_ERROR));
  }

  @Test
  void basePipelineMatch_isForwarded() throws Exception {
    String body = BY_REGION.replace("\"startRow\":0", "\"startRow\":0,\"basePipeline\":[{\"$match\":{\"status\":\"open\"}}]");
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isOk());

    assertEquals(List.of(Map.of("$match", Map.of("status", "open"))), engine.scopes.get(0).basePipeline());
  }

  @Test
  void basePipelineNonMatchStage_is400() throws Exception {
    String body = BY_REGION.replace("\"startRow\":0", "\"startRow\":0,\"basePipeline\":[{\"$out\":\"x\"}]");
    mvc(null).perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(body))
        .andExpect(status().isBadRequest());
    assertTrue(engine.scopes.isEmpty());
  }

  @Test
  void tenantScope_requiresHeader() throws Exception {
    mvc("tenantId").perform(post("/ssrm").contentType(MediaType.APPLICATION_JSON).content(BY_REGION))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error", containsString("X-Tenant-Id")));
  }

  @Test
  void tenantScope_prependsMatch() throws Exception {
    mvc("tenantId").perform(post("/ssrm").header("X-Tenant-Id", "acme")
            .contentType(MediaType.APPLICATION_JSON).content(BY_REGION))
        .andExpect(status().isOk());

    assertEquals(List.of(Map.of("$match", Map.of("tenantId", "acme"))), engine.scopes.get(0).basePipeline());
  }

  @Test
  void wrongMethod_is405_not500() throws Exception {
    mvc(null).perform(get("/ssrm"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(jsonPath("$.error", containsString("GET")));
    assertTrue(engine.scopes.isEmpty());
  }

  @Test
  void unknownPath_is404_not500() throws Exception {
    mvc(null).perform(post("/nope").contentType(MediaType.APPLICATION_JSON).content(BY_REGION))
        .andExpect(status().isNotFound());
  }
}
