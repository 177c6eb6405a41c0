package io.studentdeals.platform.audit;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for audit capture and the administrative query surface.
 *
 * @param enabled master switch; when false, operations are registered without interception
 * @param maxUserAgentLength user agent values are truncated to this many characters
 * @param defaultPageSize page size used when a listing query omits it
 * @param maxPageSize upper bound for both page number and page size
 * @param statisticsGroupLimit number of buckets returned for byAction and byTable
 * @param recentActivityLimit number of entries returned as recent activity
 * @param maskedFields snapshot keys (case-insensitive) whose values are never persisted
 */
@ConfigurationProperties(prefix = "audit")
@Validated
public record AuditProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("500") @Positive @Max(500) int maxUserAgentLength,
    @DefaultValue("10") @Positive int defaultPageSize,
    @DefaultValue("100") @Positive int maxPageSize,
    @DefaultValue("10") @Positive int statisticsGroupLimit,
    @DefaultValue("5") @Positive int recentActivityLimit,
    @DefaultValue({
          "password",
          "currentPassword",
          "newPassword",
          "confirmPassword",
          "token",
          "refreshToken",
          "secret"
        })
        List<String> maskedFields) {

  /** Defaults matching the bound values, for code paths constructed outside Spring. */
  public static AuditProperties defaults() {
    return new AuditProperties(
        true,
        500,
        10,
        100,
        10,
        5,
        List.of(
            "password",
            "currentPassword",
            "newPassword",
            "confirmPassword",
            "token",
            "refreshToken",
            "secret"));
  }
}
