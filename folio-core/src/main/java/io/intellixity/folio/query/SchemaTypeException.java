package io.intellixity.folio.query;

import io.intellixity.folio.FolioException;

/**
 * Raised while building a filter whose operator (or operand) is not valid for the value type of
 * its target. Always raised at build time; such a filter never reaches the wire.
 */
public final class SchemaTypeException extends FolioException {
  public SchemaTypeException(String message) {
    super(message);
  }
}
