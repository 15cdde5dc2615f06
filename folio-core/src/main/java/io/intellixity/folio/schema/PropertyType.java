package io.intellixity.folio.schema;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.folio.query.ConditionType;

/**
 * Descriptor for one property type: its wire tag plus the functions that validate, decode and
 * encode values of that type.
 * <p>
 * The wire shape of a property value is {@code {"<tag>": <payload>}}; {@link #decode(JsonNode)} and
 * {@link #encode(Object)} work on {@code <payload>} only.
 */
public interface PropertyType<T> {
  /** Wire tag, e.g. {@code "number"} or {@code "rich_text"}. */
  String id();

  Class<T> javaType();

  /** Operator family used to validate filters on this type, or null if it cannot be filtered. */
  ConditionType conditionType();

  default boolean writable() { return true; }

  /** Returns the Java value of a payload; a null or JSON null payload yields null. */
  T decode(JsonNode payload);

  /** Returns the payload for a value; null encodes the empty value of the type. */
  JsonNode encode(T value);

  /**
   * Converts a caller-supplied value into this type, validating it against the declaring
   * property (for example option membership).
   *
   * @throws PropertyTypeException if the value does not fit
   */
  T coerce(PropertyDef def, Object value);
}
