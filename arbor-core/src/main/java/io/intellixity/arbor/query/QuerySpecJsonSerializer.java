package io.intellixity.arbor.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;

/** Canonical JSON serializer for {@link QuerySpec}; output is accepted by {@link QuerySpecJsonDeserializer}. */
public final class QuerySpecJsonSerializer extends JsonSerializer<QuerySpec> {
  @Override
  public void serialize(QuerySpec q, JsonGenerator gen, SerializerProvider serializers) throws IOException {
    if (q == null) {
      gen.writeNull();
      return;
    }
    gen.writeStartObject();
    if (q.table() != null) gen.writeStringField("table", q.table());

    if (!q.columns().isEmpty()) {
      gen.writeObjectFieldStart("columns");
      for (Map.Entry<String, Boolean> e : q.columns().entrySet()) gen.writeBooleanField(e.getKey(), e.getValue());
      gen.writeEndObject();
    }

    if (q.where() != null) {
      gen.writeFieldName("where");
      gen.writeObject(FilterWriter.toMap(q.where()));
    }

    if (!q.orderBy().isEmpty()) {
      gen.writeArrayFieldStart("orderBy");
      for (SortField sf : q.orderBy()) {
        gen.writeStartObject();
        gen.writeStringField("column", sf.column());
        gen.writeStringField("dir", sf.direction().name().toLowerCase());
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }

    writePaging(gen, "limit", q.limit());
    writePaging(gen, "offset", q.offset());

    if (!q.extras().isEmpty()) {
      gen.writeObjectFieldStart("extras");
      for (Map.Entry<String, Expr> e : q.extras().entrySet()) {
        gen.writeFieldName(e.getKey());
        gen.writeObject(FilterWriter.exprToMap(e.getValue()));
      }
      gen.writeEndObject();
    }

    if (!q.with().isEmpty()) {
      gen.writeObjectFieldStart("with");
      for (Map.Entry<String, QuerySpec> e : q.with().entrySet()) {
        gen.writeFieldName(e.getKey());
        serialize(e.getValue(), gen, serializers);
      }
      gen.writeEndObject();
    }

    if (q.first()) gen.writeBooleanField("first", true);
    gen.writeEndObject();
  }

  private static void writePaging(JsonGenerator gen, String name, Object v) throws IOException {
    if (v == null) return;
    gen.writeFieldName(name);
    gen.writeObject(FilterWriter.value(v));
  }
}
