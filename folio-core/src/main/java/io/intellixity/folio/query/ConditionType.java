package io.intellixity.folio.query;

import io.intellixity.folio.schema.DateRange;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import static io.intellixity.folio.query.Operator.*;

/**
 * Operator family of a property value type. Decides which operators a filter may use and which
 * Java operand types they accept.
 */
public enum ConditionType {
  TEXT(EnumSet.of(EQUALS, DOES_NOT_EQUAL, CONTAINS, DOES_NOT_CONTAIN, STARTS_WITH, ENDS_WITH, IS_EMPTY, IS_NOT_EMPTY)),
  NUMBER(EnumSet.of(EQUALS, DOES_NOT_EQUAL, GREATER_THAN, LESS_THAN, GREATER_THAN_OR_EQUAL_TO, LESS_THAN_OR_EQUAL_TO,
      IS_EMPTY, IS_NOT_EMPTY)),
  CHECKBOX(EnumSet.of(EQUALS, DOES_NOT_EQUAL)),
  SELECT(EnumSet.of(EQUALS, DOES_NOT_EQUAL, IS_EMPTY, IS_NOT_EMPTY)),
  STATUS(EnumSet.of(EQUALS, DOES_NOT_EQUAL, IS_EMPTY, IS_NOT_EMPTY)),
  MULTI_SELECT(EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
  DATE(EnumSet.of(EQUALS, BEFORE, AFTER, ON_OR_BEFORE, ON_OR_AFTER,
      PAST_WEEK, PAST_MONTH, PAST_YEAR, NEXT_WEEK, NEXT_MONTH, NEXT_YEAR, IS_EMPTY, IS_NOT_EMPTY)),
  PEOPLE(EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
  RELATION(EnumSet.of(CONTAINS, DOES_NOT_CONTAIN, IS_EMPTY, IS_NOT_EMPTY)),
  FILES(EnumSet.of(IS_EMPTY, IS_NOT_EMPTY)),
  // narrowed to the operators of the constraint's FormulaResult
  FORMULA(EnumSet.allOf(Operator.class));

  private final Set<Operator> operators;

  ConditionType(EnumSet<Operator> operators) {
    this.operators = Collections.unmodifiableSet(operators);
  }

  public Set<Operator> operators() {
    return operators;
  }

  public boolean allows(Operator op) {
    return operators.contains(op);
  }

  /**
   * Validates a constraint for a target of this type.
   *
   * @param target label used in the error message, e.g. {@code property 'Priority' (select)}
   * @throws SchemaTypeException if the operator or its operand does not fit
   */
  public void check(String target, Constraint constraint) {
    FormulaResult result = constraint.formula();
    if (this == FORMULA) {
      if (result == null) {
        throw new SchemaTypeException("Filter on " + target + " must name the formula result type: "
            + "string, checkbox, number or date");
      }
      result.conditionType().checkOperator(target + " formula " + result.wireName(), constraint);
      return;
    }
    if (result != null) {
      throw new SchemaTypeException("Formula condition '" + result.wireName() + "' is not valid for " + target);
    }
    checkOperator(target, constraint);
  }

  private void checkOperator(String target, Constraint constraint) {
    Operator op = constraint.operator();
    if (!allows(op)) {
      throw new SchemaTypeException(
          "Operator '" + op.wireName() + "' is not valid for " + target + "; allowed: " + wireNames());
    }
    if (op.operandKind() != Operator.OperandKind.VALUE) return;
    Object operand = constraint.operand();
    if (!acceptsOperand(operand)) {
      throw new SchemaTypeException(
          "Operand " + operand + " (" + operand.getClass().getSimpleName() + ") of '" + op.wireName()
              + "' does not fit " + target);
    }
  }

  private boolean acceptsOperand(Object operand) {
    return switch (this) {
      case TEXT, SELECT, STATUS, MULTI_SELECT, PEOPLE, RELATION -> operand instanceof String;
      case NUMBER -> operand instanceof Number;
      case CHECKBOX -> operand instanceof Boolean;
      case DATE -> operand instanceof String s && isIsoDate(s);
      case FILES, FORMULA -> false;
    };
  }

  private static boolean isIsoDate(String s) {
    try {
      DateRange.parseTemporal(s);
      return true;
    } catch (IllegalArgumentException e) {
      return false;
    }
  }

  private String wireNames() {
    StringBuilder sb = new StringBuilder("[");
    for (Operator o : operators) {
      if (sb.length() > 1) sb.append(", ");
      sb.append(o.wireName());
    }
    return sb.append(']').toString();
  }
}
