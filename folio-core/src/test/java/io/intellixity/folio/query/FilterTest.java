package io.intellixity.folio.query;

import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.UnknownPropertyException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

final class FilterTest {
  private static final CollectionSchema SCHEMA = CollectionSchema.builder()
      .property("Name", "title")
      .property("Estimate", "number")
      .property("Done", "checkbox")
      .property("Priority", "select", "High", "Low")
      .property("Tags", "multi_select")
      .property("Due Date", "date")
      .property("Attachments", "files")
      .property("Score", "formula")
      .property("Total", "rollup")
      .build();

  @Test
  void acceptsOperatorsOfTheDeclaredType() {
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Name", Constraint.startsWith("Fix")));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Estimate", Constraint.greaterThan(3)));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Done", Constraint.equalTo(true)));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Priority", Constraint.equalTo("High")));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Tags", Constraint.contains("ops")));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Due Date", Constraint.onOrAfter(LocalDate.of(2024, 5, 1))));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Due Date", Constraint.nextWeek()));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Attachments", Constraint.isNotEmpty()));
  }

  @Test
  void rejectsOperatorOutsideTheTypeOperatorSet() {
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Estimate", Constraint.contains("x")));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Done", Constraint.isEmpty()));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Tags", Constraint.equalTo("ops")));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Attachments", Constraint.contains("a.pdf")));
  }

  @Test
  void rejectsOperandOfTheWrongType() {
    SchemaTypeException e = assertThrows(SchemaTypeException.class,
        () -> Filter.property(SCHEMA, "Estimate", Constraint.equalTo("three")));
    assertTrue(e.getMessage().contains("Estimate"));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Done", Constraint.equalTo("yes")));
  }

  @Test
  void dateOperandsMustBeIsoDatesOrSupportedTemporals() {
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Due Date", Constraint.before("2024-05-01T10:00:00Z")));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Due Date",
        Constraint.after(OffsetDateTime.of(2024, 5, 1, 10, 0, 0, 0, ZoneOffset.UTC))));

    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Due Date", Constraint.onOrAfter("banana")));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Due Date", Constraint.equalTo(LocalTime.NOON)));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Due Date",
        Constraint.before(Instant.parse("2024-05-01T10:00:00Z"))));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Due Date",
        Constraint.after(LocalDateTime.of(2024, 5, 1, 10, 0))));
    assertThrows(SchemaTypeException.class, () -> Filter.timestamp(Timestamp.CREATED_TIME, Constraint.after("yesterday")));
  }

  @Test
  void formulaFiltersAreCheckedAgainstTheResultType() {
    Filter f = Filter.property(SCHEMA, "Score", Constraint.formula(FormulaResult.NUMBER, Constraint.greaterThan(5)));
    assertEquals(FormulaResult.NUMBER, f.constraint().formula());
    assertEquals(Operator.GREATER_THAN, f.constraint().operator());
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Score", Constraint.formula(FormulaResult.STRING, Constraint.contains("x"))));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Score", Constraint.formula(FormulaResult.CHECKBOX, Constraint.equalTo(true))));
    assertDoesNotThrow(() -> Filter.property(SCHEMA, "Score", Constraint.formula(FormulaResult.DATE, Constraint.pastWeek())));

    assertThrows(SchemaTypeException.class,
        () -> Filter.property(SCHEMA, "Score", Constraint.formula(FormulaResult.NUMBER, Constraint.contains("x"))));
    assertThrows(SchemaTypeException.class,
        () -> Filter.property(SCHEMA, "Score", Constraint.formula(FormulaResult.DATE, Constraint.before("banana"))));
    SchemaTypeException e = assertThrows(SchemaTypeException.class,
        () -> Filter.property(SCHEMA, "Score", Constraint.equalTo(1)));
    assertTrue(e.getMessage().contains("formula result type"));
  }

  @Test
  void formulaConditionsOnlyApplyToFormulaProperties() {
    Constraint c = Constraint.formula(FormulaResult.NUMBER, Constraint.greaterThan(5));
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Estimate", c));
    assertThrows(SchemaTypeException.class, () -> Filter.timestamp(Timestamp.CREATED_TIME,
        Constraint.formula(FormulaResult.DATE, Constraint.pastWeek())));
    assertThrows(InvalidArgumentException.class, () -> Constraint.formula(FormulaResult.STRING, c));
  }

  @Test
  void otherComputedPropertiesCannotBeFiltered() {
    assertThrows(SchemaTypeException.class, () -> Filter.property(SCHEMA, "Total", Constraint.equalTo(1)));
  }

  @Test
  void unknownPropertyIsReportedByName() {
    UnknownPropertyException e = assertThrows(UnknownPropertyException.class,
        () -> Filter.property(SCHEMA, "Owner", Constraint.isEmpty()));
    assertEquals("Owner", e.property());
  }

  @Test
  void timestampFiltersUseDateOperators() {
    Filter f = Filter.timestamp(Timestamp.CREATED_TIME, Constraint.pastMonth());
    assertEquals("created_time", f.target().conditionTag());
    assertThrows(SchemaTypeException.class, () -> Filter.timestamp(Timestamp.LAST_EDITED_TIME, Constraint.greaterThan(1)));
    NullPointerException e = assertThrows(NullPointerException.class, () -> Filter.timestamp(null, Constraint.pastMonth()));
    assertEquals("timestamp", e.getMessage());
  }

  @Test
  void constraintNormalizesOperands() {
    assertEquals(Constraint.EMPTY_MARKER, Constraint.pastWeek().operand());
    assertEquals(Boolean.TRUE, Constraint.isEmpty().operand());
    assertEquals("2024-05-01", Constraint.before(LocalDate.of(2024, 5, 1)).operand());
    assertThrows(InvalidArgumentException.class, () -> Constraint.equalTo(null));
  }

  @Test
  void boundFilterCarriesDeclaredTypeTag() {
    Filter f = Filter.property(SCHEMA, "Priority", Constraint.equalTo("High"));
    assertEquals(new FilterTarget.PropertyRef("Priority", "select"), f.target());
    assertEquals(Filter.property("Priority", "select", Constraint.equalTo("High")), f);
  }
}
