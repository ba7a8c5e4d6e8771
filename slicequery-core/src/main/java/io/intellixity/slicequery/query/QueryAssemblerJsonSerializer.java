package io.intellixity.slicequery.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import io.intellixity.slicequery.query.fragment.*;

import java.io.IOException;
import java.util.List;

/** Canonical JSON query definition writer for {@link QueryAssembler}. */
public final class QueryAssemblerJsonSerializer extends JsonSerializer<QueryAssembler> {
  @Override
  public void serialize(QueryAssembler qa, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (qa == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    if (qa.table() != null) g.writeStringField("table", qa.table());
    if (qa.timeGrain() != null) {
      g.writeFieldName("timeGrain");
      writeFragment(qa.timeGrain(), g, serializers);
    }
    writeSection("slices", qa.slices(), g, serializers);
    writeSection("measures", qa.measures(), g, serializers);
    writeSection("ratios", qa.ratios(), g, serializers);
    writeSection("filters", qa.filters(), g, serializers);
    g.writeEndObject();
  }

  private static void writeSection(String name, List<? extends Fragment> fragments, JsonGenerator g,
                                   SerializerProvider serializers) throws IOException {
    if (fragments.isEmpty()) return;
    g.writeArrayFieldStart(name);
    for (Fragment f : fragments) writeFragment(f, g, serializers);
    g.writeEndArray();
  }

  private static void writeFragment(Fragment f, JsonGenerator g, SerializerProvider serializers) throws IOException {
    g.writeStartObject();
    if (f instanceof TimeGrain tg) {
      g.writeStringField("column", tg.column());
      g.writeStringField("grain", tg.grain());
      g.writeStringField("label", tg.label());
    } else if (f instanceof Slice s) {
      g.writeStringField("column", s.column());
      // Label is implied when it equals the column.
      if (!s.label().equals(s.column())) g.writeStringField("label", s.label());
    } else if (f instanceof Measure m) {
      g.writeStringField("expression", m.expression());
      g.writeStringField("label", m.label());
    } else if (f instanceof Ratio r) {
      g.writeStringField("numerator", r.numerator());
      g.writeStringField("denominator", r.denominator());
      g.writeStringField("label", r.label());
    } else if (f instanceof Filter fl) {
      g.writeStringField("column", fl.column());
      g.writeStringField("kind", fl.kind());
      if (fl.value() != null) {
        g.writeFieldName("values");
        serializers.defaultSerializeValue(fl.value(), g);
      }
      if (fl.customExpression() != null) g.writeStringField("expression", fl.customExpression());
    } else {
      throw new IllegalArgumentException("Unknown fragment: " + f.getClass().getName());
    }
    g.writeEndObject();
  }
}
