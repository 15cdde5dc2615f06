package io.intellixity.folio.record;

import io.intellixity.folio.exec.RawRecord;
import io.intellixity.folio.exec.RecordStore;

import java.util.Objects;

/**
 * Everything a {@link PageRecord} is constructed from. Instances are only made by
 * {@link RecordType}; record subclasses pass them straight to {@code super(ctx)}.
 */
public final class RecordContext {
  private final RecordType<?> type;
  private final RecordStore store;
  private final RawRecord raw;

  RecordContext(RecordType<?> type, RecordStore store, RawRecord raw) {
    this.type = Objects.requireNonNull(type, "type");
    this.store = Objects.requireNonNull(store, "store");
    this.raw = raw;
  }

  RecordType<?> type() { return type; }
  RecordStore store() { return store; }

  /** Null for a record that does not exist remotely yet. */
  RawRecord raw() { return raw; }
}
