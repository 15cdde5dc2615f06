package io.intellixity.folio.schema;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.time.temporal.Temporal;
import java.util.Objects;

/**
 * Value of a date property: a start and an optional end. Each bound is either a
 * {@link LocalDate} (date only) or an {@link OffsetDateTime}.
 */
public record DateRange(Temporal start, Temporal end) {
  public DateRange {
    Objects.requireNonNull(start, "start");
    requireSupported(start);
    if (end != null) requireSupported(end);
  }

  public static DateRange of(Temporal start) {
    return new DateRange(start, null);
  }

  public static DateRange of(Temporal start, Temporal end) {
    return new DateRange(start, end);
  }

  /** Parses an ISO date ({@code 2024-05-01}) or date-time ({@code 2024-05-01T10:00:00Z}). */
  public static Temporal parseTemporal(String s) {
    Objects.requireNonNull(s, "s");
    try {
      if (s.length() <= 10) return LocalDate.parse(s);
      return OffsetDateTime.parse(s);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Not an ISO date or date-time: '" + s + "'", e);
    }
  }

  /** Instant-comparable form of a bound; dates are taken at UTC midnight. */
  public static OffsetDateTime toDateTime(Temporal t) {
    if (t instanceof LocalDate d) return d.atStartOfDay().atOffset(ZoneOffset.UTC);
    if (t instanceof OffsetDateTime odt) return odt;
    throw new IllegalArgumentException("Unsupported temporal: " + t.getClass().getName());
  }

  private static void requireSupported(Temporal t) {
    if (!(t instanceof LocalDate) && !(t instanceof OffsetDateTime)) {
      throw new IllegalArgumentException("DateRange bounds must be LocalDate or OffsetDateTime, got " + t.getClass().getName());
    }
  }
}
