package io.intellixity.folio.schema;

import io.intellixity.folio.FolioException;

/**
 * Raised when a value does not fit the declared type of a property (wrong Java type, an option
 * the schema does not declare, or a write to a read-only property).
 */
public final class PropertyTypeException extends FolioException {
  public PropertyTypeException(String message) {
    super(message);
  }

  public PropertyTypeException(String message, Throwable cause) {
    super(message, cause);
  }
}
