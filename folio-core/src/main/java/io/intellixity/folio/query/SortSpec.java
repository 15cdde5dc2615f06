package io.intellixity.folio.query;

import java.util.Locale;
import java.util.Objects;

/** One sort key. In a list of sorts the first entry has the highest priority. */
public record SortSpec(FilterTarget target, Direction direction) {
  public SortSpec {
    Objects.requireNonNull(target, "target");
    direction = (direction == null) ? Direction.ASCENDING : direction;
  }

  public static SortSpec property(String name, Direction direction) {
    return new SortSpec(new FilterTarget.PropertyRef(name, null), direction);
  }

  public static SortSpec timestamp(Timestamp timestamp, Direction direction) {
    return new SortSpec(new FilterTarget.TimestampRef(timestamp), direction);
  }

  public enum Direction {
    ASCENDING,
    DESCENDING;

    public String wireName() {
      return name().toLowerCase(Locale.ROOT);
    }

    public static Direction fromWire(String wireName) {
      if (wireName == null) return ASCENDING;
      try {
        return valueOf(wireName.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        throw new InvalidArgumentException("Unknown sort direction '" + wireName + "'", e);
      }
    }
  }
}
