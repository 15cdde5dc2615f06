package io.intellixity.folio.query;

import java.util.Objects;

/** What a filter or sort applies to: a named property or a built-in timestamp. */
public interface FilterTarget {
  /**
   * Key of the condition object on the wire: the property type tag for properties
   * ({@code "number"}), the timestamp name for timestamps ({@code "created_time"}).
   */
  String conditionTag();

  /**
   * A named property. {@code typeTag} is the declared type, used for the wire tag of filters; it
   * may be null when the reference is only used for sorting.
   */
  record PropertyRef(String name, String typeTag) implements FilterTarget {
    public PropertyRef {
      Objects.requireNonNull(name, "name");
      if (name.isBlank()) throw new InvalidArgumentException("property name must not be blank");
    }

    @Override
    public String conditionTag() { return typeTag; }
  }

  record TimestampRef(Timestamp timestamp) implements FilterTarget {
    public TimestampRef {
      Objects.requireNonNull(timestamp, "timestamp");
    }

    @Override
    public String conditionTag() { return timestamp.wireName(); }
  }
}
