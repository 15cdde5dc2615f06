package io.intellixity.folio.record;

import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.folio.binding.PropertyAccessor;
import io.intellixity.folio.binding.PropertyBinding;
import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.exec.RecordStore;
import io.intellixity.folio.exec.RemoteFetchException;
import io.intellixity.folio.exec.RemoteWriteException;
import io.intellixity.folio.schema.CollectionSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.OffsetDateTime;
import java.util.Set;
import java.util.function.Supplier;

/**
 * One remote record bound to its collection schema.
 * <p>
 * Property writes stay local until {@link #commit()}, which sends only the dirty properties (or the
 * whole bag for a new record). Committing a clean record does nothing. A failed commit keeps the
 * local changes so it can be retried.
 * <p>
 * Subclass to expose typed getters:
 * <pre>
 * public final class Task extends PageRecord {
 *   public static final PropertyAccessor&lt;Number&gt; ESTIMATE = PropertyAccessor.number("Estimate");
 *   public Task(RecordContext ctx) { super(ctx); }
 *   public Number estimate() { return get(ESTIMATE); }
 * }
 * </pre>
 * Not thread-safe.
 */
public class PageRecord {
  private static final Logger log = LoggerFactory.getLogger(PageRecord.class);

  private final RecordType<?> type;
  private final RecordStore store;
  private PropertyBinding binding;
  private RecordState state;

  private String id;
  private OffsetDateTime createdTime;
  private OffsetDateTime lastEditedTime;
  private boolean archived;

  public PageRecord(RecordContext ctx) {
    this.type = ctx.type();
    this.store = ctx.store();
    RawRecord raw = ctx.raw();
    if (raw == null) {
      this.binding = PropertyBinding.empty(type.schema());
      this.state = RecordState.NEW;
    } else {
      adopt(raw);
      this.state = RecordState.BOUND;
    }
  }

  /** Null while {@link RecordState#NEW}. */
  public String id() { return id; }
  public OffsetDateTime createdTime() { return createdTime; }
  public OffsetDateTime lastEditedTime() { return lastEditedTime; }
  public boolean archived() { return archived; }
  public RecordState state() { return state; }
  public RecordType<?> recordType() { return type; }
  public CollectionSchema schema() { return type.schema(); }

  public Object get(String name) { return binding.get(name); }
  public <T> T get(PropertyAccessor<T> accessor) { return binding.get(accessor); }

  public void set(String name, Object value) { binding.set(name, value); }
  public <T> void set(PropertyAccessor<T> accessor, T value) { binding.set(accessor, value); }

  public void clear(String name) { binding.clear(name); }

  public JsonNode raw(String name) { return binding.raw(name); }
  public void setRaw(String name, JsonNode payload) { binding.setRaw(name, payload); }

  public boolean isDirty() { return binding.isDirty(); }
  public Set<String> dirtyProperties() { return binding.dirtyNames(); }

  /**
   * Persists local changes: creates the record when new, otherwise sends the dirty properties.
   *
   * @throws RemoteWriteException if the store fails; local changes are kept
   */
  public void commit() {
    if (state == RecordState.NEW) {
      log.debug("folio.commit create collection={} properties={}", type.collection(), binding.dirtyNames());
      RawRecord stored = write(() -> store.create(type.collection(), binding.snapshotAll()));
      adopt(stored);
      state = RecordState.COMMITTED;
      return;
    }
    if (!binding.isDirty()) {
      log.debug("folio.commit skip id={} (clean)", id);
      return;
    }
    log.debug("folio.commit update id={} properties={}", id, binding.dirtyNames());
    RawRecord stored = write(() -> store.update(id, binding.snapshotDirty()));
    adopt(stored);
    state = RecordState.COMMITTED;
  }

  /** Reloads from the remote side, discarding local changes. */
  public void refresh() {
    requirePersisted("refresh");
    RawRecord fresh;
    try {
      fresh = store.retrieve(id);
    } catch (RuntimeException e) {
      throw new RemoteFetchException("Refreshing record " + id + " failed: " + e.getMessage(), 0, e);
    }
    if (fresh == null) throw new RemoteFetchException("Record " + id + " was not returned by the store", 0, null);
    adopt(fresh);
    state = RecordState.BOUND;
  }

  /** Moves the record to the trash. Local property changes are kept. */
  public void archive() {
    setArchived(true);
  }

  public void restore() {
    setArchived(false);
  }

  private void setArchived(boolean value) {
    requirePersisted(value ? "archive" : "restore");
    log.debug("folio.archive id={} archived={}", id, value);
    RawRecord stored = write(() -> store.setArchived(id, value));
    adoptIdentity(stored);
  }

  private RawRecord write(Supplier<RawRecord> call) {
    RawRecord stored;
    try {
      stored = call.get();
    } catch (RemoteWriteException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new RemoteWriteException("Writing record " + (id == null ? "<new>" : id) + " failed: " + e.getMessage(), id, e);
    }
    if (stored == null) throw new RemoteWriteException("Store returned no record for " + (id == null ? "<new>" : id), id, null);
    return stored;
  }

  private void adopt(RawRecord raw) {
    adoptIdentity(raw);
    this.binding = PropertyBinding.load(type.schema(), raw.properties());
  }

  private void adoptIdentity(RawRecord raw) {
    this.id = raw.id();
    this.createdTime = raw.createdTime();
    this.lastEditedTime = raw.lastEditedTime();
    this.archived = raw.archived();
  }

  private void requirePersisted(String op) {
    if (state == RecordState.NEW) throw new IllegalStateException("Cannot " + op + " a record that was never committed");
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{id=" + id + ", state=" + state + ", dirty=" + binding.dirtyNames() + "}";
  }
}
