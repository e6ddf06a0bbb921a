package io.intellixity.ssrm.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.ssrm.error.ValidationException;
import io.intellixity.ssrm.filter.FilterElement;
import io.intellixity.ssrm.filter.FilterModelParser;
import io.intellixity.ssrm.filter.FilterValues;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Turns a raw grid payload into a validated {@link SsrmRequest}.
 * <p>
 * Stateless and side-effect free. Every structural problem is reported as a {@link ValidationException};
 * aggregation functions, filter types and operators outside the closed sets as
 * {@link io.intellixity.ssrm.error.UnsupportedFeatureException}.
 */
public final class SsrmRequestParser {
  public static final int DEFAULT_MAX_PAGE_SIZE = 1000;

  /** Output keys the row shaper writes itself. */
  public static final Set<String> RESERVED_IDS = Set.of("_id", "group", "childCount", "pivot");

  private final ObjectMapper mapper;
  private final int maxPageSize;
  private final FilterModelParser filters = new FilterModelParser();

  public SsrmRequestParser() {
    this(new ObjectMapper(), DEFAULT_MAX_PAGE_SIZE);
  }

  public SsrmRequestParser(ObjectMapper mapper, int maxPageSize) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
    if (maxPageSize <= 0) throw new IllegalArgumentException("maxPageSize must be > 0");
    this.maxPageSize = maxPageSize;
  }

  public int maxPageSize() { return maxPageSize; }

  /** Reads the body into a JSON object node. */
  public JsonNode readTree(String body) {
    if (body == null || body.isBlank()) {
      throw new ValidationException("Unable to parse SSRM request payload: empty body");
    }
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Unable to parse SSRM request payload", e);
    }
    if (root == null || !root.isObject()) {
      throw new ValidationException("Invalid SSRM request payload: expected a JSON object");
    }
    return root;
  }

  public SsrmRequest parse(String body) {
    return parse(readTree(body));
  }

  public SsrmRequest parse(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new ValidationException("Invalid SSRM request payload: expected a JSON object");
    }

    int startRow = optionalRow(root, "startRow", 0);
    int endRow = optionalRow(root, "endRow", (int) Math.min((long) startRow + maxPageSize, Integer.MAX_VALUE));
    if (endRow < startRow) {
      throw new ValidationException("endRow (" + endRow + ") must not be less than startRow (" + startRow + ")");
    }
    if (endRow - startRow > maxPageSize) {
      endRow = startRow + maxPageSize;
    }

    List<ColumnSpec> rowGroupCols = columns(root, "rowGroupCols", false);
    List<ColumnSpec> valueCols = columns(root, "valueCols", true);
    List<ColumnSpec> pivotCols = columns(root, "pivotCols", false);
    for (ColumnSpec c : valueCols) checkValueId(c.id());

    boolean pivotMode = false;
    JsonNode pm = root.get("pivotMode");
    if (pm != null && !pm.isNull()) {
      if (!pm.isBoolean()) throw new ValidationException("pivotMode must be a boolean");
      pivotMode = pm.booleanValue();
    }

    List<Object> groupKeys = new ArrayList<>();
    for (JsonNode k : array(root, "groupKeys")) groupKeys.add(FilterValues.scalar(k, "groupKeys[]"));
    if (groupKeys.size() > rowGroupCols.size()) {
      throw new ValidationException("groupKeys has " + groupKeys.size() + " entries but only "
          + rowGroupCols.size() + " rowGroupCols are defined");
    }

    FilterElement filter = filters.parse(root.get("filterModel"));

    List<SortModelItem> sortModel = new ArrayList<>();
    for (JsonNode s : array(root, "sortModel")) sortModel.add(sortItem(s));

    List<String> fields = new ArrayList<>();
    for (JsonNode f : array(root, "fields")) {
      if (!f.isTextual() || f.asText().isBlank()) throw new ValidationException("fields must contain non-empty strings");
      fields.add(f.asText());
    }

    return new SsrmRequest(startRow, endRow, rowGroupCols, valueCols, pivotCols, pivotMode, groupKeys,
        filter, sortModel, fields, optionalName(root, "database"), optionalName(root, "collection"));
  }

  private static int optionalRow(JsonNode root, String name, int def) {
    JsonNode n = root.get(name);
    if (n == null || n.isNull()) return def;
    if (!n.isIntegralNumber() || !n.canConvertToInt() || n.intValue() < 0) {
      throw new ValidationException(name + " must be a non-negative integer");
    }
    return n.intValue();
  }

  private static Iterable<JsonNode> array(JsonNode root, String name) {
    JsonNode n = root.get(name);
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) throw new ValidationException(name + " must be an array");
    return n;
  }

  private static List<ColumnSpec> columns(JsonNode root, String name, boolean withAgg) {
    List<ColumnSpec> out = new ArrayList<>();
    int i = 0;
    for (JsonNode c : array(root, name)) {
      String label = name + "[" + i++ + "]";
      if (!c.isObject()) throw new ValidationException(label + " must be an object");
      String id = text(c, "id", label);
      String field = text(c, "field", label);
      if (id == null && field == null) throw new ValidationException(label + " requires an id or a field");
      if (id == null) id = field;
      if (field == null) field = id;
      String displayName = text(c, "displayName", label);
      AggFunc agg = withAgg ? AggFunc.parse(text(c, "aggFunc", label)) : null;
      out.add(new ColumnSpec(id, displayName, field, agg));
    }
    return out;
  }

  private static String text(JsonNode obj, String name, String label) {
    JsonNode n = obj.get(name);
    if (n == null || n.isNull()) return null;
    if (!n.isTextual()) throw new ValidationException(label + "." + name + " must be a string");
    String s = n.asText();
    return s.isEmpty() ? null : s;
  }

  private static String optionalName(JsonNode root, String name) {
    JsonNode n = root.get(name);
    if (n == null || n.isNull()) return null;
    if (!n.isTextual()) throw new ValidationException(name + " must be a string");
    return n.asText().isBlank() ? null : n.asText().trim();
  }

  private static SortModelItem sortItem(JsonNode s) {
    if (!s.isObject()) throw new ValidationException("sortModel entries must be objects");
    JsonNode colId = s.get("colId");
    if (colId == null || !colId.isTextual() || colId.asText().isBlank()) {
      throw new ValidationException("sortModel entry requires a colId");
    }
    JsonNode sort = s.get("sort");
    String dir = (sort == null || !sort.isTextual()) ? "" : sort.asText().toLowerCase(Locale.ROOT);
    SortModelItem.Direction d = switch (dir) {
      case "asc" -> SortModelItem.Direction.ASC;
      case "desc" -> SortModelItem.Direction.DESC;
      default -> throw new ValidationException("sortModel." + colId.asText() + ".sort must be 'asc' or 'desc'");
    };
    return new SortModelItem(colId.asText(), d);
  }

  private static void checkValueId(String id) {
    if (RESERVED_IDS.contains(id) || id.contains(".") || id.startsWith("$")) {
      throw new ValidationException("Value column id '" + id + "' is reserved or not a valid output key");
    }
  }
}
