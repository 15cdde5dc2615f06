package io.intellixity.folio.memory;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.exec.CollectionRef;
import io.intellixity.folio.schema.CollectionSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One registered collection: its schema and its records in creation order. */
final class MemoryCollection {
  private final CollectionRef ref;
  private final CollectionSchema schema;
  private final Map<String, ObjectNode> records = new LinkedHashMap<>();

  MemoryCollection(CollectionRef ref, CollectionSchema schema) {
    this.ref = ref;
    this.schema = schema;
  }

  CollectionRef ref() { return ref; }
  CollectionSchema schema() { return schema; }

  void put(String id, ObjectNode record) {
    records.put(id, record);
  }

  ObjectNode get(String id) {
    return records.get(id);
  }

  List<ObjectNode> records() {
    return new ArrayList<>(records.values());
  }
}
