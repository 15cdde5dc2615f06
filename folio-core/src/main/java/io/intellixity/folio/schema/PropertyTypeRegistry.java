package io.intellixity.folio.schema;

public interface PropertyTypeRegistry {
  /** Returns the type registered under {@code id}; throws IllegalArgumentException if none. */
  PropertyType<?> get(String id);

  /** Like {@link #get(String)} but falls back to an opaque read-only type for unknown ids. */
  PropertyType<?> getOrOpaque(String id);
}
