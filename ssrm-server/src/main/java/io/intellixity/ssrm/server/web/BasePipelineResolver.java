package io.intellixity.ssrm.server.web;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.ssrm.error.ValidationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Builds the caller-owned stages prepended to every pipeline: the tenant scope {@code $match} (when a tenant
 * field is configured) followed by the request's own {@code basePipeline}, which may only hold
 * {@code $match} stages.
 */
public final class BasePipelineResolver {
  public static final String DEFAULT_TENANT_HEADER = "X-Tenant-Id";

  private static final TypeReference<LinkedHashMap<String, Object>> STAGE = new TypeReference<>() {};

  private final ObjectMapper mapper;
  private final String tenantField;
  private final String tenantHeader;

  public BasePipelineResolver(ObjectMapper mapper, String tenantField, String tenantHeader) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    this.tenantField = (tenantField == null || tenantField.isBlank()) ? null : tenantField.trim();
    this.tenantHeader = (tenantHeader == null || tenantHeader.isBlank()) ? DEFAULT_TENANT_HEADER : tenantHeader.trim();
  }

  public List<Map<String, Object>> resolve(JsonNode basePipeline, Function<String, String> headers) {
    List<Map<String, Object>> stages = new ArrayList<>();

    if (tenantField != null) {
      String tenantId = headers.apply(tenantHeader);
      if (tenantId == null || tenantId.isBlank()) {
        throw new ValidationException("Missing required header: " + tenantHeader);
      }
      Map<String, Object> match = new LinkedHashMap<>();
      match.put(tenantField, tenantId.trim());
      stages.add(Map.of("$match", match));
    }

    if (basePipeline == null || basePipeline.isNull() || basePipeline.isMissingNode()) return stages;
    if (!basePipeline.isArray()) throw new ValidationException("basePipeline must be an array");
    int i = 0;
    for (JsonNode stage : basePipeline) {
      if (!stage.isObject() || stage.size() != 1 || !stage.has("$match") || !stage.get("$match").isObject()) {
        throw new ValidationException("Invalid basePipeline stage " + i + ": only {\"$match\": {...}} stages are allowed");
      }
      stages.add(mapper.convertValue(stage, STAGE));
      i++;
    }
    return stages;
  }
}
