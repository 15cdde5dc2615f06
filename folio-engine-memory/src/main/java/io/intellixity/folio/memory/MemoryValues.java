package io.intellixity.folio.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.query.FilterTarget;
import io.intellixity.folio.query.FormulaResult;
import io.intellixity.folio.query.Timestamp;
import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.DateRange;
import io.intellixity.folio.schema.PropertyDef;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

/** Reads comparable values out of stored records. */
final class MemoryValues {
  private static final Set<String> TIMESTAMP_TYPES = Set.of("created_time", "last_edited_time");

  private MemoryValues() {}

  /** Decoded value of a filter or sort target, or null when empty. */
  static Object valueOf(CollectionSchema schema, ObjectNode record, FilterTarget target) {
    if (target instanceof FilterTarget.TimestampRef t) {
      String field = t.timestamp() == Timestamp.CREATED_TIME ? "created_time" : "last_edited_time";
      return OffsetDateTime.parse(record.get(field).asText());
    }
    FilterTarget.PropertyRef p = (FilterTarget.PropertyRef) target;
    PropertyDef def = schema.find(p.name())
        .orElseThrow(() -> new IllegalArgumentException("Could not find property with name '" + p.name() + "'"));
    // timestamp-typed properties are never stored; they mirror the record's own fields
    if (TIMESTAMP_TYPES.contains(def.typeId())) return OffsetDateTime.parse(record.get(def.typeId()).asText());
    return def.type().decode(record.path("properties").path(p.name()).get(def.typeId()));
  }

  /**
   * Result of a formula value {@code {"type":"number","number":42}} read as {@code result}; null when
   * empty or of another result type.
   */
  static Object formulaValue(JsonNode formula, FormulaResult result) {
    if (formula == null || formula.isNull()) return null;
    JsonNode v = formula.get(result.valueTag());
    if (v == null || v.isNull()) return null;
    return switch (result) {
      case STRING -> v.asText();
      case NUMBER -> v.isNumber() ? v.decimalValue() : null;
      case CHECKBOX -> v.asBoolean();
      case DATE -> v.hasNonNull("start") ? DateRange.of(DateRange.parseTemporal(v.get("start").asText())) : null;
    };
  }

  static BigDecimal number(Object v) {
    if (v instanceof BigDecimal bd) return bd;
    return new BigDecimal(v.toString());
  }

  /** Instant of a date value; ranges compare by their start. */
  static OffsetDateTime dateTime(Object v) {
    if (v instanceof OffsetDateTime t) return t;
    if (v instanceof DateRange r) return DateRange.toDateTime(r.start());
    if (v instanceof String s) return DateRange.toDateTime(DateRange.parseTemporal(s));
    throw new IllegalArgumentException("Not a date value: " + v);
  }

  static boolean isEmpty(Object v) {
    if (v == null) return true;
    if (v instanceof String s) return s.isEmpty();
    if (v instanceof List<?> l) return l.isEmpty();
    return false;
  }

  /** Sort key: numbers, dates, booleans and text each compare naturally; lists by their joined text. */
  @SuppressWarnings({"unchecked", "rawtypes"})
  static Comparable sortKey(Object v) {
    if (isEmpty(v)) return null;
    if (v instanceof Number n) return number(n);
    if (v instanceof DateRange || v instanceof OffsetDateTime) return dateTime(v);
    if (v instanceof Boolean b) return b;
    if (v instanceof JsonNode node) {
      for (FormulaResult r : FormulaResult.values()) {
        if (r.valueTag().equals(node.path("type").asText())) return sortKey(formulaValue(node, r));
      }
    }
    if (v instanceof List<?> l) return String.join(",", (List<String>) l);
    return v.toString();
  }
}
