package io.intellixity.folio.query;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Objects;

/**
 * Atomic predicate: an {@link Operator} and its operand. Operands are normalized on construction:
 * {@link LocalDate} and {@link OffsetDateTime} values become ISO strings, relative-date operators carry {@link #EMPTY_MARKER} and
 * emptiness checks carry {@code true}.
 * <p>
 * A constraint is not checked against a value type until it is bound to a {@link Filter}. A non-null
 * {@code formula} marks a condition on a formula property's result, see {@link #formula(FormulaResult, Constraint)}.
 */
public record Constraint(Operator operator, Object operand, FormulaResult formula) {
  public static final Map<String, Object> EMPTY_MARKER = Map.of();

  public Constraint {
    Objects.requireNonNull(operator, "operator");
    switch (operator.operandKind()) {
      case EMPTY_MARKER -> operand = EMPTY_MARKER;
      case FLAG -> operand = Boolean.TRUE;
      case VALUE -> {
        if (operand == null) {
          throw new InvalidArgumentException("Operator '" + operator.wireName() + "' requires an operand");
        }
        if (operand instanceof LocalDate || operand instanceof OffsetDateTime) operand = operand.toString();
        if (operand instanceof CharSequence cs) operand = cs.toString();
      }
    }
  }

  public Constraint(Operator operator, Object operand) {
    this(operator, operand, null);
  }

  public static Constraint of(Operator operator, Object operand) { return new Constraint(operator, operand); }

  /** Applies {@code condition} to the {@code result}-typed value of a formula property. */
  public static Constraint formula(FormulaResult result, Constraint condition) {
    Objects.requireNonNull(result, "result");
    Objects.requireNonNull(condition, "condition");
    if (condition.formula() != null) throw new InvalidArgumentException("Formula conditions do not nest");
    return new Constraint(condition.operator(), condition.operand(), result);
  }

  public static Constraint equalTo(Object value) { return of(Operator.EQUALS, value); }
  public static Constraint notEqualTo(Object value) { return of(Operator.DOES_NOT_EQUAL, value); }
  public static Constraint contains(Object value) { return of(Operator.CONTAINS, value); }
  public static Constraint doesNotContain(Object value) { return of(Operator.DOES_NOT_CONTAIN, value); }
  public static Constraint startsWith(String value) { return of(Operator.STARTS_WITH, value); }
  public static Constraint endsWith(String value) { return of(Operator.ENDS_WITH, value); }

  public static Constraint greaterThan(Number value) { return of(Operator.GREATER_THAN, value); }
  public static Constraint lessThan(Number value) { return of(Operator.LESS_THAN, value); }
  public static Constraint greaterThanOrEqualTo(Number value) { return of(Operator.GREATER_THAN_OR_EQUAL_TO, value); }
  public static Constraint lessThanOrEqualTo(Number value) { return of(Operator.LESS_THAN_OR_EQUAL_TO, value); }

  public static Constraint before(Object date) { return of(Operator.BEFORE, date); }
  public static Constraint after(Object date) { return of(Operator.AFTER, date); }
  public static Constraint onOrBefore(Object date) { return of(Operator.ON_OR_BEFORE, date); }
  public static Constraint onOrAfter(Object date) { return of(Operator.ON_OR_AFTER, date); }

  public static Constraint pastWeek() { return of(Operator.PAST_WEEK, null); }
  public static Constraint pastMonth() { return of(Operator.PAST_MONTH, null); }
  public static Constraint pastYear() { return of(Operator.PAST_YEAR, null); }
  public static Constraint nextWeek() { return of(Operator.NEXT_WEEK, null); }
  public static Constraint nextMonth() { return of(Operator.NEXT_MONTH, null); }
  public static Constraint nextYear() { return of(Operator.NEXT_YEAR, null); }

  public static Constraint isEmpty() { return of(Operator.IS_EMPTY, null); }
  public static Constraint isNotEmpty() { return of(Operator.IS_NOT_EMPTY, null); }
}
