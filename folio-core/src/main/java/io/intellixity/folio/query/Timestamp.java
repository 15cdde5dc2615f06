package io.intellixity.folio.query;

import java.util.Locale;

/** Built-in record timestamps that can be filtered and sorted on. */
public enum Timestamp {
  CREATED_TIME,
  LAST_EDITED_TIME;

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Timestamp fromWire(String wireName) {
    for (Timestamp t : values()) {
      if (t.wireName().equals(wireName)) return t;
    }
    throw new InvalidArgumentException("Unknown timestamp '" + wireName + "'");
  }
}
