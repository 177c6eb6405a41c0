package io.studentdeals.platform.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.studentdeals.platform.exception.InvalidQueryException;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class AuditDateParamsTest {

  @Test
  void parse_plainDateIsMidnightUtc() {
    assertThat(AuditDateParams.parse("startDate", "2026-01-01"))
        .isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
  }

  @Test
  void parse_fullInstant() {
    assertThat(AuditDateParams.parse("endDate", "2026-01-01T10:15:30.250Z"))
        .isEqualTo(Instant.parse("2026-01-01T10:15:30.250Z"));
  }

  @Test
  void parse_dateTimeWithOffset() {
    assertThat(AuditDateParams.parse("endDate", "2026-01-01T12:00:00+02:00"))
        .isEqualTo(Instant.parse("2026-01-01T10:00:00Z"));
  }

  @Test
  void parse_localDateTimeIsUtc() {
    assertThat(AuditDateParams.parse("startDate", "2026-01-01T08:00:00"))
        .isEqualTo(Instant.parse("2026-01-01T08:00:00Z"));
  }

  @Test
  void parse_blankIsAbsent() {
    assertThat(AuditDateParams.parse("startDate", null)).isNull();
    assertThat(AuditDateParams.parse("startDate", "  ")).isNull();
  }

  @Test
  void parse_rejectsUnrecognisedFormat() {
    assertThatThrownBy(() -> AuditDateParams.parse("startDate", "not-a-date"))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("startDate");
  }
}
