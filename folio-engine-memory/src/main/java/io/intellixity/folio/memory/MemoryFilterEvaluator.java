package io.intellixity.folio.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.query.CompoundFilter;
import io.intellixity.folio.query.ConditionType;
import io.intellixity.folio.query.Constraint;
import io.intellixity.folio.query.Filter;
import io.intellixity.folio.query.FilterTarget;
import io.intellixity.folio.query.FilterVisitor;
import io.intellixity.folio.query.FormulaResult;
import io.intellixity.folio.query.Operator;
import io.intellixity.folio.query.QueryFilter;
import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.DateRange;
import io.intellixity.folio.schema.PropertyDef;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Evaluates a filter tree against one stored record.
 * <p>
 * Text containment is case-insensitive, equality is exact. Date comparisons use the start of a
 * range; a date-only operand compares whole days. Relative dates are resolved against the clock.
 * Formula filters test the formula's result only when it has the filtered result type.
 * Malformed filters raise {@link IllegalArgumentException}, the way a remote validation error would.
 */
final class MemoryFilterEvaluator implements FilterVisitor<Boolean> {
  private final CollectionSchema schema;
  private final Clock clock;
  private ObjectNode record;

  MemoryFilterEvaluator(CollectionSchema schema, Clock clock) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  boolean matches(QueryFilter filter, ObjectNode record) {
    if (filter == null) return true;
    this.record = record;
    return filter.accept(this);
  }

  @Override
  public Boolean visit(CompoundFilter compound) {
    return switch (compound.clause()) {
      case AND -> compound.children().stream().allMatch(c -> c.accept(this));
      case OR -> compound.children().stream().anyMatch(c -> c.accept(this));
    };
  }

  @Override
  public Boolean visit(Filter filter) {
    ConditionType type = conditionType(filter.target());
    Object value = MemoryValues.valueOf(schema, record, filter.target());
    Constraint c = filter.constraint();
    if (type == ConditionType.FORMULA) {
      FormulaResult result = c.formula();
      if (result == null) throw new IllegalArgumentException("Formula filter must name a result type: " + filter);
      value = MemoryValues.formulaValue((JsonNode) value, result);
      type = result.conditionType();
    }

    return switch (c.operator()) {
      case IS_EMPTY -> MemoryValues.isEmpty(value);
      case IS_NOT_EMPTY -> !MemoryValues.isEmpty(value);
      case PAST_WEEK, PAST_MONTH, PAST_YEAR, NEXT_WEEK, NEXT_MONTH, NEXT_YEAR -> relative(c, value);
      default -> switch (type) {
        case TEXT, SELECT, STATUS -> text(c, (String) value);
        case NUMBER -> number(c, value);
        case CHECKBOX -> checkbox(c, value);
        case MULTI_SELECT, PEOPLE, RELATION -> list(c, value);
        case DATE -> date(c, value);
        case FILES -> throw new IllegalArgumentException("files only support emptiness checks");
        case FORMULA -> throw new IllegalStateException("unresolved formula filter");
      };
    };
  }

  private ConditionType conditionType(FilterTarget target) {
    if (target instanceof FilterTarget.TimestampRef) return ConditionType.DATE;
    FilterTarget.PropertyRef p = (FilterTarget.PropertyRef) target;
    PropertyDef def = schema.find(p.name())
        .orElseThrow(() -> new IllegalArgumentException("Could not find property with name '" + p.name() + "'"));
    if (!def.typeId().equals(p.typeTag())) {
      throw new IllegalArgumentException(
          "Property '" + p.name() + "' is a " + def.typeId() + " property, filter uses " + p.typeTag());
    }
    ConditionType type = def.type().conditionType();
    if (type == null) throw new IllegalArgumentException("Property '" + p.name() + "' cannot be filtered");
    return type;
  }

  private static boolean text(Constraint c, String value) {
    String v = value == null ? "" : value;
    String operand = String.valueOf(c.operand());
    String lv = v.toLowerCase(Locale.ROOT);
    String lo = operand.toLowerCase(Locale.ROOT);
    return switch (c.operator()) {
      case EQUALS -> v.equals(operand);
      case DOES_NOT_EQUAL -> !v.equals(operand);
      case CONTAINS -> lv.contains(lo);
      case DOES_NOT_CONTAIN -> !lv.contains(lo);
      case STARTS_WITH -> lv.startsWith(lo);
      case ENDS_WITH -> lv.endsWith(lo);
      default -> throw unsupported(c, "text");
    };
  }

  private static boolean number(Constraint c, Object value) {
    if (value == null) return c.operator() == Operator.DOES_NOT_EQUAL;
    int cmp = MemoryValues.number(value).compareTo(MemoryValues.number(c.operand()));
    return switch (c.operator()) {
      case EQUALS -> cmp == 0;
      case DOES_NOT_EQUAL -> cmp != 0;
      case GREATER_THAN -> cmp > 0;
      case LESS_THAN -> cmp < 0;
      case GREATER_THAN_OR_EQUAL_TO -> cmp >= 0;
      case LESS_THAN_OR_EQUAL_TO -> cmp <= 0;
      default -> throw unsupported(c, "number");
    };
  }

  private static boolean checkbox(Constraint c, Object value) {
    boolean v = Boolean.TRUE.equals(value);
    boolean operand = Boolean.TRUE.equals(c.operand());
    return switch (c.operator()) {
      case EQUALS -> v == operand;
      case DOES_NOT_EQUAL -> v != operand;
      default -> throw unsupported(c, "checkbox");
    };
  }

  private static boolean list(Constraint c, Object value) {
    List<?> v = value == null ? List.of() : (List<?>) value;
    return switch (c.operator()) {
      case CONTAINS -> v.contains(c.operand());
      case DOES_NOT_CONTAIN -> !v.contains(c.operand());
      default -> throw unsupported(c, "list");
    };
  }

  private static boolean date(Constraint c, Object value) {
    if (value == null) return false;
    String operand = String.valueOf(c.operand());
    OffsetDateTime v = MemoryValues.dateTime(value);
    int cmp;
    if (DateRange.parseTemporal(operand) instanceof LocalDate day) {
      cmp = v.withOffsetSameInstant(ZoneOffset.UTC).toLocalDate().compareTo(day);
    } else {
      cmp = v.compareTo(MemoryValues.dateTime(operand));
    }
    return switch (c.operator()) {
      case EQUALS -> cmp == 0;
      case BEFORE -> cmp < 0;
      case AFTER -> cmp > 0;
      case ON_OR_BEFORE -> cmp <= 0;
      case ON_OR_AFTER -> cmp >= 0;
      default -> throw unsupported(c, "date");
    };
  }

  private boolean relative(Constraint c, Object value) {
    if (value == null) return false;
    OffsetDateTime v = MemoryValues.dateTime(value);
    OffsetDateTime now = OffsetDateTime.now(clock);
    OffsetDateTime from;
    OffsetDateTime to;
    switch (c.operator()) {
      case PAST_WEEK -> { from = now.minusWeeks(1); to = now; }
      case PAST_MONTH -> { from = now.minusMonths(1); to = now; }
      case PAST_YEAR -> { from = now.minusYears(1); to = now; }
      case NEXT_WEEK -> { from = now; to = now.plusWeeks(1); }
      case NEXT_MONTH -> { from = now; to = now.plusMonths(1); }
      case NEXT_YEAR -> { from = now; to = now.plusYears(1); }
      default -> throw unsupported(c, "date");
    }
    return !v.isBefore(from) && !v.isAfter(to);
  }

  private static IllegalArgumentException unsupported(Constraint c, String kind) {
    return new IllegalArgumentException("Operator '" + c.operator().wireName() + "' is not supported for " + kind);
  }
}
