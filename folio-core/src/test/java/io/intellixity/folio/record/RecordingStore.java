package io.intellixity.folio.record;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.exec.CollectionRef;
import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.exec.RecordStore;

import java.util.*;

/** Record store keeping records in memory and logging every call. */
final class RecordingStore implements RecordStore {
  record Call(String op, String id, ObjectNode properties) {}

  private final Map<String, ObjectNode> records = new LinkedHashMap<>();
  private final List<Call> calls = new ArrayList<>();
  private int nextId = 1;
  private boolean failWrites;

  List<Call> calls() { return calls; }

  List<Call> writes() {
    List<Call> out = new ArrayList<>();
    for (Call c : calls) if (!c.op().equals("retrieve")) out.add(c);
    return out;
  }

  void failWrites(boolean fail) { this.failWrites = fail; }

  /** Seeds a stored record without logging a call. */
  RawRecord seed(String id, ObjectNode partialProperties) {
    ObjectNode r = JsonNodeFactory.instance.objectNode();
    r.put("id", id);
    r.put("created_time", "2024-01-01T00:00:00Z");
    r.put("last_edited_time", "2024-01-01T00:00:00Z");
    r.put("archived", false);
    r.putObject("properties");
    records.put(id, r);
    merge(r, partialProperties);
    return RawRecord.of(r);
  }

  /** Changes a stored record behind the client's back. */
  void remoteEdit(String id, ObjectNode partialProperties) {
    merge(records.get(id), partialProperties);
  }

  @Override
  public RawRecord create(CollectionRef collection, ObjectNode properties) {
    calls.add(new Call("create", null, properties.deepCopy()));
    if (failWrites) throw new IllegalStateException("store unavailable");
    return seed("rec-" + nextId++, properties);
  }

  @Override
  public RawRecord update(String recordId, ObjectNode properties) {
    calls.add(new Call("update", recordId, properties.deepCopy()));
    if (failWrites) throw new IllegalStateException("store unavailable");
    ObjectNode r = require(recordId);
    merge(r, properties);
    r.put("last_edited_time", "2024-01-02T00:00:00Z");
    return RawRecord.of(r);
  }

  @Override
  public RawRecord retrieve(String recordId) {
    calls.add(new Call("retrieve", recordId, null));
    return RawRecord.of(require(recordId));
  }

  @Override
  public RawRecord setArchived(String recordId, boolean archived) {
    calls.add(new Call(archived ? "archive" : "restore", recordId, null));
    if (failWrites) throw new IllegalStateException("store unavailable");
    ObjectNode r = require(recordId);
    r.put("archived", archived);
    return RawRecord.of(r);
  }

  private ObjectNode require(String id) {
    ObjectNode r = records.get(id);
    if (r == null) throw new NoSuchElementException("No record " + id);
    return r;
  }

  private static void merge(ObjectNode record, ObjectNode partial) {
    ObjectNode props = (ObjectNode) record.get("properties");
    Iterator<Map.Entry<String, JsonNode>> it = partial.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      String tag = e.getValue().fieldNames().next();
      ObjectNode value = props.putObject(e.getKey());
      value.put("type", tag);
      value.set(tag, e.getValue().get(tag).deepCopy());
    }
  }
}
