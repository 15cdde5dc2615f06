package io.intellixity.folio.record;

import io.intellixity.folio.config.FolioSettings;
import io.intellixity.folio.exec.CollectionEndpoint;
import io.intellixity.folio.exec.CollectionRef;
import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.exec.RecordStore;
import io.intellixity.folio.exec.RemoteFetchException;
import io.intellixity.folio.query.QueryBuilder;

import java.util.Objects;
import java.util.function.Function;

/** Entry point tying the remote collaborators to record types. */
public final class FolioSession {
  private final CollectionEndpoint endpoint;
  private final RecordStore store;
  private final FolioSettings settings;

  public FolioSession(CollectionEndpoint endpoint, RecordStore store) {
    this(endpoint, store, FolioSettings.load());
  }

  public FolioSession(CollectionEndpoint endpoint, RecordStore store, FolioSettings settings) {
    this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
    this.store = Objects.requireNonNull(store, "store");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public FolioSettings settings() { return settings; }

  public <R extends PageRecord> QueryBuilder<R> query(RecordType<R> type) {
    return type.query(endpoint, store, settings);
  }

  /** Schema-less query yielding raw records; filters must be built with explicit type tags. */
  public QueryBuilder<RawRecord> query(CollectionRef collection) {
    return new QueryBuilder<>(collection, null, endpoint, Function.identity(), settings);
  }

  public <R extends PageRecord> R create(RecordType<R> type) {
    return type.newRecord(store);
  }

  public <R extends PageRecord> R retrieve(RecordType<R> type, String id) {
    Objects.requireNonNull(id, "id");
    RawRecord raw;
    try {
      raw = store.retrieve(id);
    } catch (RuntimeException e) {
      throw new RemoteFetchException("Retrieving record " + id + " failed: " + e.getMessage(), 0, e);
    }
    if (raw == null) throw new RemoteFetchException("Record " + id + " was not returned by the store", 0, null);
    return type.bind(raw, store);
  }
}
