package io.intellixity.folio.query;

import java.util.Locale;

/**
 * Result type of a formula property. A formula filter names the result type it tests and is checked
 * with that type's operators.
 */
public enum FormulaResult {
  STRING(ConditionType.TEXT, "string"),
  CHECKBOX(ConditionType.CHECKBOX, "boolean"),
  NUMBER(ConditionType.NUMBER, "number"),
  DATE(ConditionType.DATE, "date");

  private final ConditionType conditionType;
  private final String valueTag;

  FormulaResult(ConditionType conditionType, String valueTag) {
    this.conditionType = conditionType;
    this.valueTag = valueTag;
  }

  public ConditionType conditionType() {
    return conditionType;
  }

  /** Key of the condition inside a {@code formula} filter, e.g. {@code checkbox}. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Key of the result inside a formula value, e.g. {@code {"type":"boolean","boolean":true}}. */
  public String valueTag() {
    return valueTag;
  }

  public static FormulaResult fromWire(String wireName) {
    for (FormulaResult r : values()) {
      if (r.wireName().equals(wireName)) return r;
    }
    throw new InvalidArgumentException("Unknown formula result type '" + wireName + "'");
  }
}
