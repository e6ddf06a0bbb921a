package io.intellixity.ssrm.request;

import io.intellixity.ssrm.error.UnsupportedFeatureException;
import io.intellixity.ssrm.error.ValidationException;
import io.intellixity.ssrm.filter.Condition;
import io.intellixity.ssrm.filter.FilterOperator;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SsrmRequestParserTest {
  private final SsrmRequestParser parser = new SsrmRequestParser();

  @Test
  void parse_fullPayload_populatesRequest() {
    SsrmRequest r = parser.parse("""
        {"startRow":0,"endRow":100,
         "rowGroupCols":[{"id":"region","displayName":"Region","field":"region"}],
         "valueCols":[{"id":"amount","field":"amount","aggFunc":"sum"},{"id":"quantity","field":"quantity"}],
         "pivotCols":[],"pivotMode":false,"groupKeys":[],"filterModel":null,
         "sortModel":[{"colId":"amount","sort":"desc"}],
         "database":"ssrm_test","collection":"orders"}
        """);

    assertEquals(0, r.startRow());
    assertEquals(100, r.endRow());
    assertEquals("region", r.rowGroupCols().get(0).field());
    assertEquals("Region", r.rowGroupCols().get(0).displayName());
    assertEquals(AggFunc.SUM, r.valueCols().get(1).aggFunc());
    assertEquals(SortModelItem.Direction.DESC, r.sortModel().get(0).sort());
    assertNull(r.filter());
    assertEquals("ssrm_test", r.database());
    assertEquals("orders", r.collection());
    assertEquals(0, r.depth());
    assertFalse(r.isLeafLevel());
  }

  @Test
  void parse_emptyObject_appliesDefaults() {
    SsrmRequest r = parser.parse("{}");

    assertEquals(0, r.startRow());
    assertEquals(SsrmRequestParser.DEFAULT_MAX_PAGE_SIZE, r.endRow());
    assertTrue(r.rowGroupCols().isEmpty());
    assertTrue(r.sortModel().isEmpty());
    assertFalse(r.pivotMode());
    assertTrue(r.isLeafLevel());
    assertNull(r.database());
  }

  @Test
  void parse_windowLargerThanMax_isClamped() {
    SsrmRequest r = new SsrmRequestParser(new com.fasterxml.jackson.databind.ObjectMapper(), 50)
        .parse("{\"startRow\":10,\"endRow\":500}");

    assertEquals(10, r.startRow());
    assertEquals(60, r.endRow());
    assertEquals(50, r.pageSize());
  }

  @Test
  void parse_columnFieldAndId_defaultToEachOther() {
    SsrmRequest r = parser.parse("{\"rowGroupCols\":[{\"id\":\"a\"},{\"field\":\"b.c\"}]}");

    assertEquals("a", r.rowGroupCols().get(0).field());
    assertEquals("b.c", r.rowGroupCols().get(1).id());
  }

  @Test
  void parse_groupKeys_keepNulls() {
    SsrmRequest r = parser.parse(
        "{\"rowGroupCols\":[{\"id\":\"a\"},{\"id\":\"b\"}],\"groupKeys\":[null]}");

    assertEquals(Arrays.asList((Object) null), r.groupKeys());
    assertEquals(1, r.depth());
  }

  @Test
  void parse_filterModel_becomesAst() {
    SsrmRequest r = parser.parse("{\"filterModel\":{\"amount\":{\"filterType\":\"number\",\"type\":\"greaterThan\",\"filter\":100}}}");

    Condition c = assertInstanceOf(Condition.class, r.filter());
    assertEquals(FilterOperator.GREATER_THAN, c.operator());
    assertEquals(100L, c.value());
  }

  @Test
  void parse_fields_areKept() {
    SsrmRequest r = parser.parse("{\"fields\":[\"region\",\"amount\"]}");
    assertEquals(List.of("region", "amount"), r.fields());
  }

  @Test
  void malformedJson_isValidationError() {
    ValidationException e = assertThrows(ValidationException.class, () -> parser.parse("{not json"));
    assertTrue(e.getMessage().contains("Unable to parse"));
  }

  @Test
  void nonObjectRoot_isValidationError() {
    ValidationException e = assertThrows(ValidationException.class, () -> parser.parse("[1,2]"));
    assertTrue(e.getMessage().startsWith("Invalid"));
  }

  @Test
  void invalidStructure_isValidationError() {
    for (String body : List.of(
        "{\"rowGroupCols\":{}}",
        "{\"rowGroupCols\":[\"region\"]}",
        "{\"rowGroupCols\":[{\"displayName\":\"x\"}]}",
        "{\"startRow\":-1}",
        "{\"startRow\":1.5}",
        "{\"startRow\":10,\"endRow\":5}",
        "{\"groupKeys\":[\"x\"]}",
        "{\"pivotMode\":\"yes\"}",
        "{\"filterModel\":[]}",
        "{\"sortModel\":[{\"colId\":\"a\",\"sort\":\"up\"}]}",
        "{\"sortModel\":[{\"sort\":\"asc\"}]}",
        "{\"valueCols\":[{\"id\":\"pivot\"}]}",
        "{\"valueCols\":[{\"id\":\"a.b\"}]}",
        "{\"valueCols\":[{\"id\":\"$x\"}]}")) {
      assertThrows(ValidationException.class, () -> parser.parse(body), body);
    }
  }

  @Test
  void unknownAggFunc_isUnsupported() {
    UnsupportedFeatureException e = assertThrows(UnsupportedFeatureException.class,
        () -> parser.parse("{\"valueCols\":[{\"id\":\"amount\",\"aggFunc\":\"median\"}]}"));
    assertEquals("aggFunc:median", e.feature());
  }

  @Test
  void autoGroupColumn_isRecognised() {
    SsrmRequest r = parser.parse("{\"sortModel\":[{\"colId\":\"ag-Grid-AutoColumn\",\"sort\":\"asc\"}]}");
    assertTrue(r.sortModel().get(0).isAutoGroupColumn());
  }

  @Test
  void pivot_onlyAtGroupLevels() {
    SsrmRequest group = parser.parse(
        "{\"rowGroupCols\":[{\"id\":\"region\"}],\"pivotCols\":[{\"id\":\"status\"}],\"pivotMode\":true}");
    SsrmRequest leaf = parser.parse(
        "{\"rowGroupCols\":[{\"id\":\"region\"}],\"pivotCols\":[{\"id\":\"status\"}],\"pivotMode\":true,\"groupKeys\":[\"North\"]}");

    assertTrue(group.hasPivot());
    assertTrue(leaf.isPivotActive());
    assertFalse(leaf.hasPivot());
  }

  @Test
  void parse_largeStartRowWithoutEndRow_doesNotOverflow() {
    SsrmRequest r = parser.parse("{\"startRow\":2147483000}");

    assertEquals(2147483000, r.startRow());
    assertEquals(Integer.MAX_VALUE, r.endRow());
  }
}
