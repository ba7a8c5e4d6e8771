package io.intellixity.slicequery.query;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.slicequery.query.fragment.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryAssemblerJsonTest {
  private static final ObjectMapper JSON = new ObjectMapper();

  @Test
  void readsDefinitionAndCompiles() throws Exception {
    String s = """
        {
          "table": "events",
          "timeGrain": { "column": "ts", "grain": "day", "label": "day" },
          "slices": [ { "column": "country" } ],
          "measures": [ { "expression": "count(*)", "label": "total" } ],
          "filters": [ { "column": "status", "kind": "list", "values": ["ok"] } ]
        }
        """;
    QueryAssembler qa = JSON.readValue(s, QueryAssembler.class);
    assertEquals("""
        SELECT
          date_trunc('day', ts) AS "day",
          country AS "country",
          count(*) AS "total"
        FROM events
        WHERE TRUE AND
          status IN ('ok')

        GROUP BY 1, 2
        ORDER BY 1 DESC, 2""", qa.compile());
  }

  @Test
  void readsOptionalFieldsWithDefaults() throws Exception {
    String s = """
        {
          "table": "orders",
          "slices": [ { "column": "os", "label": "platform" } ],
          "ratios": [ { "numerator": "sum(paid)", "denominator": "count(*)", "label": "paid_rate" } ],
          "filters": [
            { "column": "region", "values": ["eu", "us"] },
            { "column": "amount", "kind": "custom", "expression": "amount > 0" }
          ]
        }
        """;
    QueryAssembler qa = JSON.readValue(s, QueryAssembler.class);
    assertNull(qa.timeGrain());
    assertEquals(new Slice("os", "platform"), qa.slices().get(0));
    assertEquals(new Ratio("sum(paid)", "count(*)", "paid_rate"), qa.ratios().get(0));
    assertEquals("list", qa.filters().get(0).kind());
    assertEquals("amount > 0", qa.filters().get(1).render());
    assertThrows(MissingTimeGrainException.class, qa::compile);
  }

  @Test
  void badFilterSurfacesOnCompile() throws Exception {
    String unknownKind = """
        {
          "table": "t",
          "timeGrain": { "column": "ts", "grain": "day", "label": "day" },
          "filters": [ { "column": "x", "kind": "regex", "values": ["a.*"] } ]
        }
        """;
    QueryAssembler qa = JSON.readValue(unknownKind, QueryAssembler.class);
    assertThrows(UnsupportedFilterKindException.class, qa::compile);

    String scalarValue = """
        {
          "table": "t",
          "timeGrain": { "column": "ts", "grain": "day", "label": "day" },
          "filters": [ { "column": "x", "kind": "list", "values": "a" } ]
        }
        """;
    QueryAssembler qa2 = JSON.readValue(scalarValue, QueryAssembler.class);
    assertThrows(InvalidFilterValueException.class, qa2::compile);

    String numbers = """
        {
          "table": "t",
          "timeGrain": { "column": "ts", "grain": "day", "label": "day" },
          "filters": [ { "column": "x", "values": [1, 2] } ]
        }
        """;
    QueryAssembler qa3 = JSON.readValue(numbers, QueryAssembler.class);
    assertThrows(InvalidFilterValueException.class, qa3::compile);
  }

  @Test
  void rejectsMissingRequiredField() {
    String s = """
        { "table": "t", "measures": [ { "expression": "count(*)" } ] }
        """;
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> JSON.readValue(s, QueryAssembler.class));
    assertTrue(ex.getMessage().contains("'label'"));
  }

  @Test
  void rejectsNonObjectRoot() {
    assertThrows(IllegalArgumentException.class, () -> JSON.readValue("[1, 2]", QueryAssembler.class));
  }

  @Test
  void writesCanonicalShape() throws Exception {
    QueryAssembler qa = new QueryAssembler("events")
        .setTimeGrain(new TimeGrain("ts", "day", "day"))
        .addSlice(new Slice("country"))
        .addSlice(new Slice("os", "platform"))
        .addFilter(Filter.list("status", List.of("ok", "retry")))
        .addFilter(Filter.custom("ts", "ts > now()"));

    JsonNode n = JSON.readTree(JSON.writeValueAsString(qa));
    assertEquals("events", n.get("table").asText());
    assertEquals("day", n.get("timeGrain").get("grain").asText());
    assertFalse(n.get("slices").get(0).has("label"));
    assertEquals("platform", n.get("slices").get(1).get("label").asText());
    assertFalse(n.has("measures"));
    assertFalse(n.has("ratios"));
    assertEquals("retry", n.get("filters").get(0).get("values").get(1).asText());
    assertEquals("custom", n.get("filters").get(1).get("kind").asText());
    assertEquals("ts > now()", n.get("filters").get(1).get("expression").asText());

    QueryAssembler back = JSON.readValue(JSON.writeValueAsString(qa), QueryAssembler.class);
    assertEquals(qa.compile(), back.compile());
  }
}
