package io.studentdeals.platform.audit;

import java.util.Map;
import java.util.UUID;

/**
 * Non-JPA DTO handed to {@link AuditLogStore#append(AuditLogRecord)}. Constructed by {@link
 * AuditLogBuilder} or by the convenience methods on {@link AuditService}.
 *
 * @param action free-form action tag (e.g. "CREATE_OFFER"); never blank
 * @param tableName logical entity affected; nullable
 * @param recordId id of the affected entity instance (not a FK); nullable
 * @param oldValues detached snapshot of the prior state; nullable
 * @param newValues detached snapshot of the submitted or resulting state; nullable
 * @param actorId user who performed the operation; null for anonymous or system actions
 * @param ipAddress client IP; null for non-HTTP sources
 * @param userAgent truncated User-Agent header; null for non-HTTP sources
 */
public record AuditLogRecord(
    String action,
    String tableName,
    String recordId,
    Map<String, Object> oldValues,
    Map<String, Object> newValues,
    UUID actorId,
    String ipAddress,
    String userAgent) {

  public AuditLogRecord {
    action = AuditAction.of(action).name();
  }

  AuditLogRecord withValues(Map<String, Object> oldValues, Map<String, Object> newValues) {
    return new AuditLogRecord(
        action, tableName, recordId, oldValues, newValues, actorId, ipAddress, userAgent);
  }
}
