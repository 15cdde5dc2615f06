package io.intellixity.folio.query;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.config.FolioSettings;
import io.intellixity.folio.exec.CollectionRef;
import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.exec.ScriptedEndpoint;
import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.UnknownPropertyException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class QueryBuilderTest {
  private static final CollectionRef TASKS = CollectionRef.of("tasks");
  private static final CollectionSchema SCHEMA = CollectionSchema.builder()
      .property("Name", "title")
      .property("Estimate", "number")
      .property("Priority", "select", "High", "Low")
      .property("Due Date", "date")
      .build();

  private static QueryBuilder<RawRecord> builder() {
    return QueryBuilder.raw(TASKS, SCHEMA, null);
  }

  @Test
  void compilingTwiceGivesIdenticalPayloads() {
    QueryBuilder<RawRecord> b = builder()
        .filter("Priority", Constraint.equalTo("High"))
        .filter("Estimate", Constraint.lessThan(8))
        .sort("Due Date", SortSpec.Direction.ASCENDING)
        .sort(Timestamp.CREATED_TIME, SortSpec.Direction.DESCENDING)
        .limit(10);

    assertEquals(b.compile().toPayload().toString(), b.compile().toPayload().toString());
    assertEquals(b.compile(), b.copy().compile());
  }

  @Test
  void threeFiltersCompileToOneFlatAnd() {
    Query q = builder()
        .filter("Priority", Constraint.equalTo("High"))
        .filter("Estimate", Constraint.lessThan(8))
        .filter("Due Date", Constraint.isNotEmpty())
        .compile();

    CompoundFilter and = assertInstanceOf(CompoundFilter.class, q.filter());
    assertEquals(Clause.AND, and.clause());
    assertEquals(3, and.children().size());
    assertEquals(3, q.toPayload().get("filter").get("and").size());
  }

  @Test
  void singleFilterIsNotWrapped() {
    Query q = builder().filter("Priority", Constraint.equalTo("High")).compile();
    assertInstanceOf(Filter.class, q.filter());
  }

  @Test
  void filterAnyAddsOneOrGroupUnderTheAnd() {
    Filter high = Filter.property(SCHEMA, "Priority", Constraint.equalTo("High"));
    Filter small = Filter.property(SCHEMA, "Estimate", Constraint.lessThan(2));
    Filter undated = Filter.property(SCHEMA, "Due Date", Constraint.isEmpty());

    Query q = builder().filter(undated).filterAny(high, small).compile();

    assertEquals(CompoundFilter.and(undated, CompoundFilter.or(high, small)), q.filter());
  }

  @Test
  void filterAnyNeedsTwoAlternatives() {
    Filter high = Filter.property(SCHEMA, "Priority", Constraint.equalTo("High"));
    assertThrows(InvalidArgumentException.class, () -> builder().filterAny(high));
    assertThrows(InvalidArgumentException.class, () -> builder().filterAny());
  }

  @Test
  void sortsKeepInsertionOrder() {
    Query q = builder()
        .sort("Estimate", SortSpec.Direction.DESCENDING)
        .sort("Name", null)
        .compile();
    assertEquals(List.of(
        SortSpec.property("Estimate", SortSpec.Direction.DESCENDING),
        SortSpec.property("Name", SortSpec.Direction.ASCENDING)), q.sorts());
  }

  @Test
  void unknownPropertiesAreRejectedWhenAdded() {
    assertThrows(UnknownPropertyException.class, () -> builder().filter("Owner", Constraint.isEmpty()));
    assertThrows(UnknownPropertyException.class, () -> builder().sort("Owner", SortSpec.Direction.ASCENDING));
    assertThrows(UnknownPropertyException.class,
        () -> builder().filter(Filter.property("Owner", "people", Constraint.isEmpty())));
  }

  @Test
  void typeTagMustMatchTheSchema() {
    assertThrows(SchemaTypeException.class,
        () -> builder().filter(Filter.property("Priority", "number", Constraint.equalTo(1))));
    assertThrows(SchemaTypeException.class, () -> builder().filter("Priority", Constraint.greaterThan(1)));
  }

  @Test
  void limitAndPageSizeAreValidated() {
    assertThrows(InvalidArgumentException.class, () -> builder().limit(0));
    assertThrows(InvalidArgumentException.class, () -> builder().limit(-3));
    assertThrows(InvalidArgumentException.class, () -> builder().pageSize(0));
    assertThrows(InvalidArgumentException.class, () -> builder().pageSize(FolioSettings.MAX_PAGE_SIZE + 1));
  }

  @Test
  void pageSizeDefaultsAndNeverExceedsTheLimit() {
    assertEquals(100, builder().compile().pageSize());
    assertEquals(5, builder().limit(5).compile().pageSize());
    assertEquals(20, builder().pageSize(20).limit(50).compile().pageSize());
    assertEquals("cur", builder().startAt("cur").compile().startCursor());
  }

  @Test
  void schemaLessBuilderNeedsExplicitTypeTags() {
    QueryBuilder<RawRecord> b = QueryBuilder.raw(TASKS, null, null);
    assertThrows(InvalidArgumentException.class, () -> b.filter("Priority", Constraint.equalTo("High")));
    b.filter(Filter.property("Anything", "select", Constraint.equalTo("High")));
    assertNotNull(b.compile().filter());
  }

  @Test
  void executeNeedsAnEndpoint() {
    assertThrows(IllegalStateException.class, () -> builder().execute());
  }

  @Test
  void firstFetchesOneRecordAndLeavesTheBuilderAlone() {
    ScriptedEndpoint endpoint = ScriptedEndpoint.batches(1, 1);
    QueryBuilder<RawRecord> b = QueryBuilder.raw(TASKS, SCHEMA, endpoint)
        .filter("Priority", Constraint.equalTo("High"));

    Optional<RawRecord> first = b.first();

    assertEquals("r1", first.map(RawRecord::id).orElse(null));
    assertEquals(1, endpoint.calls());
    ObjectNode request = endpoint.requests().get(0);
    assertEquals(1, request.get("page_size").asInt());
    assertNull(b.currentLimit());
    assertEquals(100, b.compile().pageSize());
  }

  @Test
  void firstOnEmptyResultIsEmpty() {
    QueryBuilder<RawRecord> b = QueryBuilder.raw(TASKS, SCHEMA, ScriptedEndpoint.batches(0));
    assertTrue(b.first().isEmpty());
  }

  @Test
  void laterBuilderChangesDoNotAffectIssuedIterators() {
    ScriptedEndpoint endpoint = ScriptedEndpoint.batches(2);
    QueryBuilder<RawRecord> b = QueryBuilder.raw(TASKS, SCHEMA, endpoint);
    var it = b.execute();
    b.filter("Priority", Constraint.equalTo("Low"));

    assertTrue(it.hasNext());
    assertFalse(endpoint.requests().get(0).has("filter"));
  }
}
