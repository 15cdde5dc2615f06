package io.intellixity.folio.query;

import io.intellixity.folio.FolioException;

/** Raised for malformed builder input (non-positive limit, ambiguous OR grouping, bad payload). */
public final class InvalidArgumentException extends FolioException {
  public InvalidArgumentException(String message) {
    super(message);
  }

  public InvalidArgumentException(String message, Throwable cause) {
    super(message, cause);
  }
}
