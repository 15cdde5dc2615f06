package io.intellixity.folio.schema;

import java.util.List;
import java.util.Objects;

/** One schema entry: property name, its type and (for select-like types) the declared options. */
public record PropertyDef(String name, PropertyType<?> type, List<String> options) {
  public PropertyDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("property name must not be blank");
    options = options == null ? List.of() : List.copyOf(options);
  }

  public PropertyDef(String name, PropertyType<?> type) {
    this(name, type, List.of());
  }

  public String typeId() { return type.id(); }

  /** True when the value is acceptable; an empty option list accepts anything. */
  public boolean allowsOption(String option) {
    return options.isEmpty() || options.contains(option);
  }
}
