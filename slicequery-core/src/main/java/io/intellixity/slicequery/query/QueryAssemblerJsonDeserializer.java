package io.intellixity.slicequery.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.slicequery.query.fragment.*;

import java.io.IOException;
import java.util.List;

/**
 * Canonical JSON query definition reader for {@link QueryAssembler}.
 *
 * <p>Filter kinds and values are taken as-is; problems with them surface from
 * {@link QueryAssembler#compile()}, not here.</p>
 */
public final class QueryAssemblerJsonDeserializer extends JsonDeserializer<QueryAssembler> {
  @Override
  public QueryAssembler deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Query definition JSON must be an object");

    QueryAssembler qa = new QueryAssembler(textOrNull(root.get("table")));

    JsonNode tg = root.get("timeGrain");
    if (tg != null && !tg.isNull()) {
      qa.setTimeGrain(new TimeGrain(
          required(tg, "column", "timeGrain"),
          required(tg, "grain", "timeGrain"),
          required(tg, "label", "timeGrain")));
    }

    for (JsonNode s : section(root, "slices")) {
      qa.addSlice(new Slice(required(s, "column", "slices"), textOrNull(s.get("label"))));
    }
    for (JsonNode m : section(root, "measures")) {
      qa.addMeasure(new Measure(required(m, "expression", "measures"), required(m, "label", "measures")));
    }
    for (JsonNode r : section(root, "ratios")) {
      qa.addRatio(new Ratio(
          required(r, "numerator", "ratios"),
          required(r, "denominator", "ratios"),
          required(r, "label", "ratios")));
    }
    for (JsonNode f : section(root, "filters")) {
      qa.addFilter(new Filter(
          required(f, "column", "filters"),
          textOrNull(f.get("kind")),
          decodeValue(f.get("values"), codec),
          textOrNull(f.get("expression"))));
    }
    return qa;
  }

  private static Iterable<JsonNode> section(JsonNode root, String name) {
    JsonNode n = root.get(name);
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) throw new IllegalArgumentException("'" + name + "' must be an array");
    for (JsonNode x : n) {
      if (!x.isObject()) throw new IllegalArgumentException("'" + name + "' entries must be objects: " + x);
    }
    return n;
  }

  private static String required(JsonNode n, String field, String section) {
    String v = textOrNull(n.get(field));
    if (v == null) throw new IllegalArgumentException(section + " entry requires '" + field + "': " + n);
    return v;
  }

  private static Object decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return null;
    return codec.treeToValue(v, Object.class);
  }

  private static String textOrNull(JsonNode n) {
    return (n == null || n.isNull()) ? null : n.asText();
  }
}
