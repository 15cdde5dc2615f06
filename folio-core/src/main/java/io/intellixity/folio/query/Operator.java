package io.intellixity.folio.query;

import java.util.Locale;

/** Constraint operators. The wire name is the lower-case enum name, e.g. {@code greater_than}. */
public enum Operator {
  EQUALS(OperandKind.VALUE),
  DOES_NOT_EQUAL(OperandKind.VALUE),
  CONTAINS(OperandKind.VALUE),
  DOES_NOT_CONTAIN(OperandKind.VALUE),
  STARTS_WITH(OperandKind.VALUE),
  ENDS_WITH(OperandKind.VALUE),

  GREATER_THAN(OperandKind.VALUE),
  LESS_THAN(OperandKind.VALUE),
  GREATER_THAN_OR_EQUAL_TO(OperandKind.VALUE),
  LESS_THAN_OR_EQUAL_TO(OperandKind.VALUE),

  BEFORE(OperandKind.VALUE),
  AFTER(OperandKind.VALUE),
  ON_OR_BEFORE(OperandKind.VALUE),
  ON_OR_AFTER(OperandKind.VALUE),

  // relative dates, operand is the empty marker {}
  PAST_WEEK(OperandKind.EMPTY_MARKER),
  PAST_MONTH(OperandKind.EMPTY_MARKER),
  PAST_YEAR(OperandKind.EMPTY_MARKER),
  NEXT_WEEK(OperandKind.EMPTY_MARKER),
  NEXT_MONTH(OperandKind.EMPTY_MARKER),
  NEXT_YEAR(OperandKind.EMPTY_MARKER),

  IS_EMPTY(OperandKind.FLAG),
  IS_NOT_EMPTY(OperandKind.FLAG);

  /** Shape of the operand an operator carries on the wire. */
  public enum OperandKind {
    /** a typed value */
    VALUE,
    /** the empty object {@code {}} */
    EMPTY_MARKER,
    /** the literal {@code true} */
    FLAG
  }

  private final OperandKind operandKind;

  Operator(OperandKind operandKind) {
    this.operandKind = operandKind;
  }

  public OperandKind operandKind() {
    return operandKind;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Operator fromWire(String wireName) {
    if (wireName == null) throw new InvalidArgumentException("Missing operator");
    try {
      return Operator.valueOf(wireName.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new InvalidArgumentException("Unknown operator '" + wireName + "'", e);
    }
  }
}
