package io.intellixity.folio.schema.providers;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.folio.query.ConditionType;
import io.intellixity.folio.schema.DateRange;
import io.intellixity.folio.schema.DiscoveredPropertyTypeRegistry;
import io.intellixity.folio.schema.PropertyDef;
import io.intellixity.folio.schema.PropertyType;
import io.intellixity.folio.schema.PropertyTypeException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultPropertyTypeProviderTest {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final DiscoveredPropertyTypeRegistry TYPES =
      new DiscoveredPropertyTypeRegistry(List.of(new DefaultPropertyTypeProvider()));

  @SuppressWarnings("unchecked")
  private static <T> PropertyType<T> type(String id) {
    return (PropertyType<T>) TYPES.get(id);
  }

  @Test
  void providesTheBuiltInTags() {
    Set<String> ids = new DefaultPropertyTypeProvider().propertyTypes().stream()
        .map(PropertyType::id).collect(Collectors.toSet());
    assertTrue(ids.containsAll(Set.of("title", "rich_text", "url", "email", "phone_number", "number", "checkbox",
        "select", "status", "multi_select", "date", "people", "relation", "files",
        "formula", "rollup", "created_time", "last_edited_time", "created_by", "last_edited_by")));
  }

  @Test
  void richTextRoundTripsAsTextObjects() throws Exception {
    PropertyType<String> rich = type("rich_text");
    assertEquals(JSON.readTree("[{\"type\":\"text\",\"text\":{\"content\":\"hello\"}}]"), rich.encode("hello"));
    assertEquals(0, rich.encode("").size());
    assertEquals("ab", rich.decode(JSON.readTree("[{\"plain_text\":\"a\"},{\"text\":{\"content\":\"b\"}}]")));
    assertThrows(PropertyTypeException.class, () -> rich.decode(JSON.readTree("\"flat\"")));
  }

  @Test
  void plainTextTypesAreBareStrings() throws Exception {
    PropertyType<String> url = type("url");
    assertEquals(JSON.readTree("\"https://example.com\""), url.encode("https://example.com"));
    assertTrue(url.encode(null).isNull());
  }

  @Test
  void checkboxIsNeverEmpty() {
    PropertyType<Boolean> box = type("checkbox");
    assertFalse(box.encode(null).booleanValue());
    PropertyDef def = new PropertyDef("Done", box);
    assertThrows(PropertyTypeException.class, () -> box.coerce(def, "true"));
  }

  @Test
  void multiSelectChecksEveryOption() {
    PropertyType<List<String>> multi = type("multi_select");
    PropertyDef def = new PropertyDef("Tags", multi, List.of("ops", "ui"));
    assertEquals(List.of("ops"), multi.coerce(def, "ops"));
    assertEquals(List.of("ops", "ui"), multi.coerce(def, List.of("ops", "ui")));
    assertThrows(PropertyTypeException.class, () -> multi.coerce(def, List.of("ops", "db")));
    assertThrows(PropertyTypeException.class, () -> multi.coerce(def, List.of(1, 2)));
  }

  @Test
  void dateKeepsDateOnlyAndDateTimeApart() throws Exception {
    PropertyType<DateRange> date = type("date");
    DateRange d = date.decode(JSON.readTree("{\"start\":\"2024-05-01\",\"end\":\"2024-05-03\"}"));
    assertEquals(DateRange.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 3)), d);

    DateRange t = date.decode(JSON.readTree("{\"start\":\"2024-05-01T09:30:00Z\"}"));
    assertEquals(OffsetDateTime.of(2024, 5, 1, 9, 30, 0, 0, ZoneOffset.UTC), t.start());
    assertNull(t.end());

    assertEquals(JSON.readTree("{\"start\":\"2024-05-01\"}"), date.encode(DateRange.of(LocalDate.of(2024, 5, 1))));
    assertNull(date.decode(JSON.readTree("null")));
    assertThrows(PropertyTypeException.class, () -> date.decode(JSON.readTree("{\"start\":\"May 1st\"}")));
  }

  @Test
  void peopleAreUserReferences() throws Exception {
    PropertyType<List<String>> people = type("people");
    assertEquals(JSON.readTree("[{\"object\":\"user\",\"id\":\"u1\"}]"), people.encode(List.of("u1")));
    assertEquals(List.of("u1", "u2"), people.decode(JSON.readTree("[{\"id\":\"u1\"},{\"id\":\"u2\",\"name\":\"Ann\"}]")));

    PropertyType<List<String>> relation = type("relation");
    assertEquals(JSON.readTree("[{\"id\":\"p1\"}]"), relation.encode(List.of("p1")));
  }

  @Test
  void filesAreExternalUrls() throws Exception {
    PropertyType<List<String>> files = type("files");
    JsonNode payload = files.encode(List.of("https://x/a.pdf"));
    assertEquals("https://x/a.pdf", payload.get(0).path("external").path("url").asText());
    assertEquals(List.of("https://x/a.pdf"), files.decode(payload));
  }

  @Test
  void timestampsAndComputedTypesAreReadOnly() throws Exception {
    PropertyType<OffsetDateTime> created = type("created_time");
    assertFalse(created.writable());
    assertEquals(OffsetDateTime.of(2024, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC),
        created.decode(JSON.readTree("\"2024-01-01T00:00:00Z\"")));
    assertThrows(PropertyTypeException.class, () -> created.coerce(new PropertyDef("Created", created), OffsetDateTime.now()));

    PropertyType<JsonNode> formula = type("formula");
    assertFalse(formula.writable());
    assertEquals(7, formula.decode(JSON.readTree("{\"type\":\"number\",\"number\":7}")).get("number").asInt());
    assertEquals(ConditionType.FORMULA, formula.conditionType());
    assertNull(type("rollup").conditionType());
  }

  @Test
  void numbersRejectNonFiniteValues() {
    PropertyType<Number> number = type("number");
    PropertyDef def = new PropertyDef("Estimate", number);
    assertThrows(PropertyTypeException.class, () -> number.coerce(def, Double.NaN));
    assertEquals(2.5, number.coerce(def, 2.5));
  }
}
