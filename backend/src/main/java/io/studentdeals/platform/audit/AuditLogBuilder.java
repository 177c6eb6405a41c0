package io.studentdeals.platform.audit;

import io.studentdeals.platform.security.RequestOrigin;
import io.studentdeals.platform.security.RequestOriginResolver;
import java.util.Map;
import java.util.UUID;

/**
 * Builder that constructs an {@link AuditLogRecord}. IP address and user agent are taken from the
 * current HTTP request when not set explicitly.
 *
 * <p>Only {@code action} is required. Usage:
 *
 * <pre>{@code
 * AuditLogRecord record = AuditLogBuilder.builder()
 *     .action(AuditActions.CREATE_OFFER)
 *     .tableName("offers")
 *     .recordId(offer.getId().toString())
 *     .newValues(Map.of("title", offer.getTitle()))
 *     .actorId(actor.id())
 *     .build();
 * }</pre>
 */
public class AuditLogBuilder {

  private String action;
  private String tableName;
  private String recordId;
  private Map<String, Object> oldValues;
  private Map<String, Object> newValues;
  private UUID actorId;
  private RequestOrigin origin;

  private AuditLogBuilder() {}

  public static AuditLogBuilder builder() {
    return new AuditLogBuilder();
  }

  public AuditLogBuilder action(String action) {
    this.action = action;
    return this;
  }

  public AuditLogBuilder tableName(String tableName) {
    this.tableName = tableName;
    return this;
  }

  public AuditLogBuilder recordId(String recordId) {
    this.recordId = recordId;
    return this;
  }

  public AuditLogBuilder oldValues(Map<String, Object> oldValues) {
    this.oldValues = oldValues;
    return this;
  }

  public AuditLogBuilder newValues(Map<String, Object> newValues) {
    this.newValues = newValues;
    return this;
  }

  public AuditLogBuilder actorId(UUID actorId) {
    this.actorId = actorId;
    return this;
  }

  /**
   * Overrides the request-derived origin, e.g. when the request was captured earlier. Passing null
   * for both keeps the default.
   */
  public AuditLogBuilder origin(String ipAddress, String userAgent) {
    this.origin =
        ipAddress == null && userAgent == null ? null : new RequestOrigin(ipAddress, userAgent);
    return this;
  }

  /** Builds the record. Throws {@link IllegalArgumentException} if the action is blank. */
  public AuditLogRecord build() {
    RequestOrigin resolvedOrigin =
        origin != null
            ? origin
            : RequestOriginResolver.current(RequestOriginResolver.DEFAULT_MAX_USER_AGENT_LENGTH);
    return new AuditLogRecord(
        action,
        tableName,
        recordId,
        oldValues,
        newValues,
        actorId,
        resolvedOrigin.ipAddress(),
        resolvedOrigin.userAgent());
  }
}
