package io.intellixity.folio.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Canonical wire serializer for {@link Query}. Field order is fixed:
 * {@code filter}, {@code sorts}, {@code start_cursor}, {@code page_size}.
 */
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
      writeFilter(q.filter(), g, serializers);
    }

    if (!q.sorts().isEmpty()) {
      g.writeArrayFieldStart("sorts");
      for (SortSpec s : q.sorts()) {
        g.writeStartObject();
        writeTarget(s.target(), g);
        g.writeStringField("direction", s.direction().wireName());
        g.writeEndObject();
      }
      g.writeEndArray();
    }

    if (q.startCursor() != null) {
      g.writeStringField("start_cursor", q.startCursor());
    }

    if (q.pageSize() != null) {
      g.writeNumberField("page_size", q.pageSize());
    }

    g.writeEndObject();
  }

  private static void writeFilter(QueryFilter f, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (f instanceof CompoundFilter cf) {
      g.writeStartObject();
      g.writeArrayFieldStart(cf.clause().wireName());
      for (QueryFilter child : cf.children()) {
        writeFilter(child, g, serializers);
      }
      g.writeEndArray();
      g.writeEndObject();
      return;
    }

    if (f instanceof Filter leaf) {
      g.writeStartObject();
      writeTarget(leaf.target(), g);
      g.writeObjectFieldStart(leaf.target().conditionTag());
      Constraint c = leaf.constraint();
      if (c.formula() != null) g.writeObjectFieldStart(c.formula().wireName());
      g.writeFieldName(c.operator().wireName());
      switch (c.operator().operandKind()) {
        case EMPTY_MARKER -> {
          g.writeStartObject();
          g.writeEndObject();
        }
        case FLAG -> g.writeBoolean(true);
        case VALUE -> serializers.defaultSerializeValue(c.operand(), g);
      }
      if (c.formula() != null) g.writeEndObject();
      g.writeEndObject();
      g.writeEndObject();
      return;
    }

    throw new IllegalArgumentException("Unsupported filter node: " + f.getClass().getName());
  }

  private static void writeTarget(FilterTarget target, JsonGenerator g) throws IOException {
    if (target instanceof FilterTarget.PropertyRef p) {
      g.writeStringField("property", p.name());
    } else if (target instanceof FilterTarget.TimestampRef t) {
      g.writeStringField("timestamp", t.timestamp().wireName());
    } else {
      throw new IllegalArgumentException("Unsupported target: " + target.getClass().getName());
    }
  }
}
