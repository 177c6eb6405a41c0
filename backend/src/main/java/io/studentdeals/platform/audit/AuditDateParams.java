package io.studentdeals.platform.audit;

import io.studentdeals.platform.exception.InvalidQueryException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Parses the {@code startDate} / {@code endDate} query parameters. Accepts a full ISO instant
 * ({@code 2026-01-01T10:00:00Z}), a date-time with offset, a local date-time, or a plain date
 * ({@code 2026-01-01}). Values without an offset are read as UTC; a plain date means midnight UTC.
 */
final class AuditDateParams {

  private AuditDateParams() {}

  /**
   * Returns null for a missing or blank value.
   *
   * @throws InvalidQueryException if the value is not a recognised date
   */
  static Instant parse(String name, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String text = value.trim();
    try {
      if (text.length() == 10) {
        return LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
      }
      if (text.endsWith("Z") || text.endsWith("z")) {
        return Instant.parse(text.toUpperCase(Locale.ROOT));
      }
      if (hasOffset(text)) {
        return OffsetDateTime.parse(text).toInstant();
      }
      return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
    } catch (DateTimeParseException e) {
      throw new InvalidQueryException(
          "Invalid " + name, name + " must be an ISO-8601 date or date-time, got: " + value);
    }
  }

  /** True when the time part carries a {@code +hh:mm} / {@code -hh:mm} offset. */
  private static boolean hasOffset(String text) {
    int timeStart = text.indexOf('T');
    if (timeStart < 0) {
      return false;
    }
    String time = text.substring(timeStart);
    return time.indexOf('+') >= 0 || time.indexOf('-') >= 0;
  }
}
