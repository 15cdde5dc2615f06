package io.intellixity.folio.query;

import java.util.Locale;

public enum Clause {
  AND,
  OR;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
