package io.intellixity.folio;

/** Root of every error raised by folio. All folio errors are unchecked. */
public class FolioException extends RuntimeException {
  public FolioException(String message) {
    super(message);
  }

  public FolioException(String message, Throwable cause) {
    super(message, cause);
  }
}
