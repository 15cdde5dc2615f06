package io.intellixity.folio.exec;

import io.intellixity.folio.FolioException;

/**
 * Raised when the endpoint fails while fetching. Records yielded before the failure stay valid;
 * {@link #yieldedCount()} tells how many there were.
 */
public final class RemoteFetchException extends FolioException {
  private final long yieldedCount;

  public RemoteFetchException(String message, long yieldedCount, Throwable cause) {
    super(message, cause);
    this.yieldedCount = yieldedCount;
  }

  public long yieldedCount() { return yieldedCount; }
}
