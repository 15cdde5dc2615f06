package io.intellixity.folio.memory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.intellixity.folio.config.FolioSettings;
import io.intellixity.folio.exec.CollectionEndpoint;
import io.intellixity.folio.exec.CollectionRef;
import io.intellixity.folio.exec.PageResult;
import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.exec.RecordStore;
import io.intellixity.folio.exec.RemoteFetchException;
import io.intellixity.folio.exec.RemoteWriteException;
import io.intellixity.folio.query.Query;
import io.intellixity.folio.schema.CollectionSchema;
import io.intellixity.folio.schema.PropertyDef;
import io.intellixity.folio.schema.PropertyType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.*;

/**
 * In-process stand-in for a remote workspace: a {@link CollectionEndpoint} and {@link RecordStore}
 * over records kept as wire JSON.
 * <p>
 * Queries are decoded from the wire payload, filtered, sorted and paged the way the remote side
 * does it: archived records are hidden, {@code page_size} is capped at {@link #maxPageSize()} and
 * {@code next_cursor} is the id of the first record of the next page. Records without a sort keep
 * creation order.
 * <p>
 * All operations are synchronized.
 */
public final class InMemoryWorkspace implements CollectionEndpoint, RecordStore {
  private static final Logger log = LoggerFactory.getLogger(InMemoryWorkspace.class);
  private static final JsonNodeFactory F = JsonNodeFactory.instance;

  private final Clock clock;
  private final int maxPageSize;
  private final Map<CollectionRef, MemoryCollection> collections = new LinkedHashMap<>();
  private final Map<String, MemoryCollection> owners = new HashMap<>();

  public InMemoryWorkspace() {
    this(Clock.systemUTC(), FolioSettings.MAX_PAGE_SIZE);
  }

  public InMemoryWorkspace(Clock clock, int maxPageSize) {
    this.clock = Objects.requireNonNull(clock, "clock");
    if (maxPageSize <= 0) throw new IllegalArgumentException("maxPageSize must be > 0");
    this.maxPageSize = maxPageSize;
  }

  public int maxPageSize() { return maxPageSize; }

  public synchronized InMemoryWorkspace register(CollectionRef collection, CollectionSchema schema) {
    Objects.requireNonNull(collection, "collection");
    Objects.requireNonNull(schema, "schema");
    if (collections.putIfAbsent(collection, new MemoryCollection(collection, schema)) != null) {
      throw new IllegalArgumentException("Collection already registered: " + collection);
    }
    return this;
  }

  @Override
  public synchronized PageResult query(CollectionRef collection, ObjectNode payload) {
    MemoryCollection c = collections.get(collection);
    if (c == null) throw new RemoteFetchException("Could not find collection " + collection, 0, null);
    Query q = Query.fromPayload(payload);

    MemoryFilterEvaluator filter = new MemoryFilterEvaluator(c.schema(), clock);
    List<ObjectNode> matches = new ArrayList<>();
    for (ObjectNode r : c.records()) {
      if (r.path("archived").asBoolean(false)) continue;
      if (filter.matches(q.filter(), r)) matches.add(r);
    }
    if (!q.sorts().isEmpty()) matches.sort(new MemorySortComparator(c.schema(), q.sorts()));

    int from = 0;
    if (q.startCursor() != null) {
      from = indexOf(matches, q.startCursor());
      if (from < 0) throw new RemoteFetchException("Invalid start_cursor '" + q.startCursor() + "'", 0, null);
    }
    int size = Math.min(q.pageSize() == null ? maxPageSize : q.pageSize(), maxPageSize);
    int to = Math.min(from + size, matches.size());

    List<RawRecord> page = new ArrayList<>(to - from);
    for (ObjectNode r : matches.subList(from, to)) page.add(render(c, r));
    boolean more = to < matches.size();
    log.debug("folio.memory op=query collection={} matched={} from={} size={} hasMore={}",
        collection, matches.size(), from, page.size(), more);
    return more ? PageResult.more(page, matches.get(to).get("id").asText()) : PageResult.last(page);
  }

  @Override
  public synchronized RawRecord create(CollectionRef collection, ObjectNode properties) {
    MemoryCollection c = collections.get(collection);
    if (c == null) throw new RemoteWriteException("Could not find collection " + collection, null, null);

    String id = UUID.randomUUID().toString();
    String now = now();
    ObjectNode r = F.objectNode();
    r.put("object", "page");
    r.put("id", id);
    r.put("created_time", now);
    r.put("last_edited_time", now);
    r.put("archived", false);
    r.putObject("parent").put("database_id", collection.id());
    r.set("properties", F.objectNode());
    merge(c, r, properties, null);

    c.put(id, r);
    owners.put(id, c);
    log.debug("folio.memory op=create collection={} id={} properties={}", collection, id, properties.size());
    return render(c, r);
  }

  @Override
  public synchronized RawRecord update(String recordId, ObjectNode properties) {
    MemoryCollection c = owner(recordId);
    if (c == null) throw new RemoteWriteException("Could not find record " + recordId, recordId, null);
    ObjectNode r = c.get(recordId);
    merge(c, r, properties, recordId);
    r.put("last_edited_time", now());
    log.debug("folio.memory op=update id={} properties={}", recordId, properties.size());
    return render(c, r);
  }

  @Override
  public synchronized RawRecord retrieve(String recordId) {
    MemoryCollection c = owner(recordId);
    if (c == null) throw new RemoteFetchException("Could not find record " + recordId, 0, null);
    return render(c, c.get(recordId));
  }

  @Override
  public synchronized RawRecord setArchived(String recordId, boolean archived) {
    MemoryCollection c = owner(recordId);
    if (c == null) throw new RemoteWriteException("Could not find record " + recordId, recordId, null);
    ObjectNode r = c.get(recordId);
    r.put("archived", archived);
    r.put("last_edited_time", now());
    log.debug("folio.memory op=archive id={} archived={}", recordId, archived);
    return render(c, r);
  }

  private MemoryCollection owner(String recordId) {
    return recordId == null ? null : owners.get(recordId);
  }

  /** Applies a partial update {@code {"<name>": {"<tag>": <payload>}}}; rejects it whole on any bad entry. */
  private static void merge(MemoryCollection c, ObjectNode record, ObjectNode partial, String recordId) {
    Map<String, ObjectNode> checked = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = partial.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> e = it.next();
      Optional<PropertyDef> def = c.schema().find(e.getKey());
      if (def.isEmpty()) {
        throw new RemoteWriteException(e.getKey() + " is not a property that exists", recordId, null);
      }
      String tag = def.get().typeId();
      if (!def.get().type().writable()) {
        throw new RemoteWriteException("Property '" + e.getKey() + "' (" + tag + ") is read-only", recordId, null);
      }
      JsonNode payload = e.getValue().get(tag);
      if (payload == null) {
        throw new RemoteWriteException("Property '" + e.getKey() + "' expects a '" + tag + "' value", recordId, null);
      }
      try {
        def.get().type().decode(payload);
      } catch (RuntimeException ex) {
        throw new RemoteWriteException("Invalid '" + tag + "' value for '" + e.getKey() + "': " + payload, recordId, ex);
      }
      ObjectNode value = F.objectNode();
      value.put("type", tag);
      value.set(tag, payload.deepCopy());
      checked.put(e.getKey(), value);
    }
    ObjectNode props = (ObjectNode) record.get("properties");
    checked.forEach(props::set);
  }

  /** Full record as returned to clients: every declared property is present, empty ones as the type's empty value. */
  private static RawRecord render(MemoryCollection c, ObjectNode stored) {
    ObjectNode out = stored.deepCopy();
    ObjectNode props = out.putObject("properties");
    ObjectNode storedProps = (ObjectNode) stored.get("properties");
    for (PropertyDef def : c.schema().properties()) {
      JsonNode value = storedProps.get(def.name());
      if (value == null) value = emptyValue(def, stored);
      props.set(def.name(), value.deepCopy());
    }
    return RawRecord.of(out);
  }

  @SuppressWarnings("unchecked")
  private static ObjectNode emptyValue(PropertyDef def, ObjectNode stored) {
    String tag = def.typeId();
    ObjectNode value = F.objectNode();
    value.put("type", tag);
    switch (tag) {
      case "created_time", "last_edited_time" -> value.set(tag, stored.get(tag).deepCopy());
      default -> value.set(tag, def.type().writable()
          ? ((PropertyType<Object>) def.type()).encode(null)
          : F.nullNode());
    }
    return value;
  }

  private String now() {
    return OffsetDateTime.ofInstant(clock.instant(), ZoneOffset.UTC).toString();
  }

  private static int indexOf(List<ObjectNode> records, String id) {
    for (int i = 0; i < records.size(); i++) {
      if (id.equals(records.get(i).get("id").asText())) return i;
    }
    return -1;
  }
}
