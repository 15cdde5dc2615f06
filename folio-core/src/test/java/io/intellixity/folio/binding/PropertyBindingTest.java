package io.intellixity.folio.binding;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.DateRange;
import io.intellixity.folio.schema.PropertyTypeException;
import io.intellixity.folio.schema.UnknownPropertyException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class PropertyBindingTest {
  private static final ObjectMapper JSON = new ObjectMapper();
  private static final CollectionSchema SCHEMA = CollectionSchema.builder()
      .property("Name", "title")
      .property("Estimate", "number")
      .property("Priority", "select", "High", "Low")
      .property("Tags", "multi_select", "ops", "ui")
      .property("Due Date", "date")
      .property("Score", "formula")
      .build();

  private PropertyBinding binding;

  @BeforeEach
  void load() throws Exception {
    ObjectNode props = (ObjectNode) JSON.readTree("""
        {
          "Name": {"id": "title", "type": "title", "title": [
            {"type": "text", "text": {"content": "Fix "}, "plain_text": "Fix "},
            {"type": "text", "text": {"content": "login"}, "plain_text": "login"}
          ]},
          "Estimate": {"type": "number", "number": 3},
          "Priority": {"type": "select", "select": {"id": "x1", "name": "High", "color": "red"}},
          "Tags": {"type": "multi_select", "multi_select": [{"name": "ops"}]},
          "Due Date": {"type": "date", "date": {"start": "2024-05-01", "end": null}},
          "Score": {"type": "formula", "formula": {"type": "number", "number": 42}},
          "Legacy": {"type": "rich_text", "rich_text": []}
        }
        """);
    binding = PropertyBinding.load(SCHEMA, props);
  }

  @Test
  void decodesLoadedValues() {
    assertEquals("Fix login", binding.get("Name"));
    assertEquals(3, binding.get("Estimate"));
    assertEquals("High", binding.get("Priority"));
    assertEquals(List.of("ops"), binding.get("Tags"));
    assertEquals(DateRange.of(LocalDate.of(2024, 5, 1)), binding.get("Due Date"));
    assertEquals(42, binding.get(PropertyAccessor.opaque("Score")).get("number").asInt());
    assertFalse(binding.isDirty());
  }

  @Test
  void undeclaredPropertiesAreIgnoredOnLoadAndRejectedOnAccess() {
    assertThrows(UnknownPropertyException.class, () -> binding.get("Legacy"));
    assertThrows(UnknownPropertyException.class, () -> binding.set("Legacy", "x"));
  }

  @Test
  void setMarksDirtyAndSnapshotsOnlyDirtyProperties() throws Exception {
    binding.set(PropertyAccessor.number("Estimate"), 5);
    binding.set("Priority", "Low");

    assertEquals(5, binding.get("Estimate"));
    assertEquals(Set.of("Estimate", "Priority"), binding.dirtyNames());
    assertEquals(JSON.readTree("{\"Estimate\":{\"number\":5},\"Priority\":{\"select\":{\"name\":\"Low\"}}}"),
        binding.snapshotDirty());

    binding.clearDirty();
    assertFalse(binding.isDirty());
    assertEquals(5, binding.get("Estimate"));
  }

  @Test
  void invalidValueLeavesPriorValueAndDirtySetUntouched() {
    assertThrows(PropertyTypeException.class, () -> binding.set("Estimate", "five"));
    assertThrows(PropertyTypeException.class, () -> binding.set("Priority", "Urgent"));
    assertThrows(PropertyTypeException.class, () -> binding.set("Tags", List.of("ops", "backend")));

    assertEquals(3, binding.get("Estimate"));
    assertEquals("High", binding.get("Priority"));
    assertEquals(List.of("ops"), binding.get("Tags"));
    assertFalse(binding.isDirty());
  }

  @Test
  void readOnlyPropertiesCannotBeWritten() {
    assertThrows(PropertyTypeException.class, () -> binding.set("Score", 1));
    assertThrows(PropertyTypeException.class, () -> binding.setRaw("Score", JSON.getNodeFactory().numberNode(1)));
    assertFalse(binding.isDirty());
  }

  @Test
  void clearWritesTheEmptyValue() throws Exception {
    binding.clear("Priority");
    assertNull(binding.get("Priority"));
    assertEquals(JSON.readTree("{\"Priority\":{\"select\":null}}"), binding.snapshotDirty());
  }

  @Test
  void dateAcceptsBareLocalDate() {
    binding.set("Due Date", LocalDate.of(2024, 6, 2));
    assertEquals(DateRange.of(LocalDate.of(2024, 6, 2)), binding.get(PropertyAccessor.date("Due Date")));
  }

  @Test
  void setRawValidatesThePayload() throws Exception {
    binding.setRaw("Priority", JSON.readTree("{\"name\":\"Low\"}"));
    assertEquals("Low", binding.get("Priority"));
    assertTrue(binding.isDirty());

    assertThrows(PropertyTypeException.class, () -> binding.setRaw("Priority", JSON.readTree("{\"name\":\"Urgent\"}")));
    assertThrows(PropertyTypeException.class, () -> binding.setRaw("Estimate", JSON.readTree("\"3\"")));
    assertEquals("Low", binding.get("Priority"));
    assertEquals(3, binding.get("Estimate"));
  }

  @Test
  void snapshotAllSkipsReadOnlyProperties() {
    ObjectNode all = binding.snapshotAll();
    assertTrue(all.has("Name"));
    assertTrue(all.has("Due Date"));
    assertFalse(all.has("Score"));
  }

  @Test
  void accessorTypeMismatchIsReported() {
    assertThrows(PropertyTypeException.class, () -> binding.get(PropertyAccessor.checkbox("Estimate")));
  }

  @Test
  void emptyBindingHasNoValues() {
    PropertyBinding empty = PropertyBinding.empty(SCHEMA);
    assertNull(empty.get("Name"));
    assertFalse(empty.isSet("Name"));
    assertEquals(0, empty.snapshotAll().size());
  }
}
