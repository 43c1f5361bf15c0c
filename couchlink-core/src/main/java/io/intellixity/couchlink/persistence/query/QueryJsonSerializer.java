package io.intellixity.couchlink.persistence.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Collection;
import java.util.Locale;

/** Canonical JSON serializer for {@link Query}. */
public final class QueryJsonSerializer extends JsonSerializer<Query> {
  @Override
  public void serialize(Query q, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (q == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();

    if (q.filter() != null) {
      g.writeFieldName("filter");
      writeElement(q.filter(), g, serializers);
    }

    if (q.sort() != null && !q.sort().isEmpty()) {
      g.writeArrayFieldStart("sort");
      for (SortField sf : q.sort()) {
        g.writeStartObject();
        g.writeStringField("field", sf.field());
        g.writeStringField("dir", sf.direction().name());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.projection() != null && !q.projection().isEmpty()) {
      g.writeObjectField("projection", q.projection());
    }

    if (q.limit() != null) g.writeNumberField("limit", q.limit());
    if (q.skip() != null) g.writeNumberField("skip", q.skip());

    if (q.params() != null && !q.params().isEmpty()) {
      g.writeObjectField("params", q.params());
    }

    g.writeEndObject();
  }

  private static void writeElement(QueryElement el, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (el == null) {
      g.writeNull();
      return;
    }

    if (el instanceof LogicalGroup lg) {
      String key = lg.clause() == Clause.OR ? "or" : "and";
      g.writeStartObject();
      g.writeArrayFieldStart(key);
      for (QueryElement child : lg.elements()) {
        writeElement(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (el instanceof Condition c) {
      String opKey = c.operator().name().toLowerCase(Locale.ROOT);
      g.writeStartObject();
      g.writeObjectFieldStart(opKey);
      g.writeStringField("field", c.property());
      if (c.operator() == Operator.IN && c.value() instanceof Collection<?> values) {
        g.writeArrayFieldStart("values");
        for (Object v : values) writeValue(v, g, serializers);
        g.writeEndArray();
      } else {
        g.writeFieldName(c.operator() == Operator.IN ? "values" : "value");
        writeValue(c.value(), g, serializers);
      }
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    serializers.defaultSerializeValue(el, g);
  }

  private static void writeValue(Object v, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (v instanceof QueryValues.Placeholder p) {
      g.writeStartObject();
      g.writeNumberField("placeholder", p.index());
      g.writeEndObject();
      return;
    }
    serializers.defaultSerializeValue(v, g);
  }
}
