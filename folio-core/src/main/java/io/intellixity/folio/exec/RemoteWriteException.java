package io.intellixity.folio.exec;

import io.intellixity.folio.FolioException;

/**
 * Raised when a create/update/archive call fails. Local dirty state is left untouched so the
 * caller can inspect it and commit again.
 */
public final class RemoteWriteException extends FolioException {
  private final String recordId;

  public RemoteWriteException(String message, String recordId, Throwable cause) {
    super(message, cause);
    this.recordId = recordId;
  }

  /** Remote id of the record being written, or null for a create. */
  public String recordId() { return recordId; }
}
