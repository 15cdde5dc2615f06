package io.intellixity.folio.schema.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.intellixity.folio.query.ConditionType;
import io.intellixity.folio.schema.PropertyDef;
import io.intellixity.folio.schema.PropertyType;
import io.intellixity.folio.schema.PropertyTypeException;

import java.util.Objects;

/**
 * Read-only type that keeps the raw payload. Used for computed types (formula, rollup, ...) and for
 * type tags the registry does not know. Not filterable unless a condition type is given.
 */
public final class OpaquePropertyType implements PropertyType<JsonNode> {
  private final String id;
  private final ConditionType conditionType;

  public OpaquePropertyType(String id) {
    this(id, null);
  }

  public OpaquePropertyType(String id, ConditionType conditionType) {
    this.id = Objects.requireNonNull(id, "id");
    this.conditionType = conditionType;
  }

  @Override public String id() { return id; }
  @Override public Class<JsonNode> javaType() { return JsonNode.class; }
  @Override public ConditionType conditionType() { return conditionType; }
  @Override public boolean writable() { return false; }

  @Override
  public JsonNode decode(JsonNode payload) {
    return payload == null ? null : payload.deepCopy();
  }

  @Override
  public JsonNode encode(JsonNode value) {
    return value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy();
  }

  @Override
  public JsonNode coerce(PropertyDef def, Object value) {
    throw new PropertyTypeException("Property '" + def.name() + "' of type '" + id + "' is read-only");
  }
}
