package io.intellixity.folio.record;

/** Lifecycle of a {@link PageRecord}. */
public enum RecordState {
  /** created locally, never persisted; has no id */
  NEW,
  /** loaded from the remote side */
  BOUND,
  /** last write succeeded */
  COMMITTED
}
