package io.intellixity.folio.binding;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.folio.schema.DateRange;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Typed handle to one named property, for example {@code PropertyAccessor.number("Estimate")}.
 * Record types declare their fields as accessors; the binding decodes and encodes through them.
 */
public record PropertyAccessor<T>(String name, Class<T> javaType) {
  public PropertyAccessor {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(javaType, "javaType");
  }

  public static <T> PropertyAccessor<T> of(String name, Class<T> javaType) {
    return new PropertyAccessor<>(name, javaType);
  }

  /** title, rich_text, url, email, phone_number */
  public static PropertyAccessor<String> text(String name) { return of(name, String.class); }

  public static PropertyAccessor<Number> number(String name) { return of(name, Number.class); }

  public static PropertyAccessor<Boolean> checkbox(String name) { return of(name, Boolean.class); }

  /** select, status */
  public static PropertyAccessor<String> option(String name) { return of(name, String.class); }

  public static PropertyAccessor<DateRange> date(String name) { return of(name, DateRange.class); }

  public static PropertyAccessor<OffsetDateTime> timestamp(String name) { return of(name, OffsetDateTime.class); }

  /** multi_select, people, relation, files */
  @SuppressWarnings({"unchecked", "rawtypes"})
  public static PropertyAccessor<List<String>> list(String name) { return of(name, (Class) List.class); }

  /** formula, rollup and other read-only payloads */
  public static PropertyAccessor<JsonNode> opaque(String name) { return of(name, JsonNode.class); }
}
