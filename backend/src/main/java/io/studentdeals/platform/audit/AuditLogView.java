package io.studentdeals.platform.audit;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Audit entry as returned by the administrative query surface, joined with its actor.
 *
 * @param actor minimal actor projection; null when no actor is recorded or the user is gone
 */
public record AuditLogView(
    UUID id,
    String action,
    String tableName,
    String recordId,
    Map<String, Object> oldValues,
    Map<String, Object> newValues,
    ActorSummary actor,
    UUID actorId,
    String ipAddress,
    String userAgent,
    Instant createdAt) {

  public static AuditLogView from(AuditLog log, ActorSummary actor) {
    return new AuditLogView(
        log.getId(),
        log.getAction(),
        log.getTableName(),
        log.getRecordId(),
        log.getOldValues(),
        log.getNewValues(),
        actor,
        log.getActorId(),
        log.getIpAddress(),
        log.getUserAgent(),
        log.getCreatedAt());
  }

  /** Actor projection joined onto entries. */
  public record ActorSummary(UUID id, String email, String role) {}
}
