package io.intellixity.folio.schema;

import io.intellixity.folio.FolioException;

/** Raised when a property name is not declared by the collection schema. */
public final class UnknownPropertyException extends FolioException {
  private final String property;

  public UnknownPropertyException(String property, String message) {
    super(message);
    this.property = property;
  }

  public String property() { return property; }
}
