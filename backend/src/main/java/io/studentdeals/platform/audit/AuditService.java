package io.studentdeals.platform.audit;

import java.util.UUID;

/**
 * Best-effort write API for audit entries. None of these methods throw: a failure to record an
 * entry is reported to the application log and otherwise ignored, so the operation being audited
 * succeeds or fails on its own merits.
 *
 * <p>Values passed as {@code Object} are snapshotted into detached maps before they are stored.
 * When both {@code ipAddress} and {@code userAgent} are null, they are read from the HTTP request
 * bound to the current thread, if there is one.
 */
public interface AuditService {

  /**
   * Records a single audit entry.
   *
   * @return true if the entry was stored
   */
  boolean log(AuditLogRecord record);

  /** Records a creation. Missing table or record id are stored as {@code "unknown"}. */
  boolean logCreate(
      String action,
      String tableName,
      String recordId,
      Object newValues,
      UUID actorId,
      String ipAddress,
      String userAgent);

  /** Records an update with both snapshots. Missing table or record id become {@code "unknown"}. */
  boolean logUpdate(
      String action,
      String tableName,
      String recordId,
      Object oldValues,
      Object newValues,
      UUID actorId,
      String ipAddress,
      String userAgent);

  /** Records a deletion; only the prior state is kept. */
  boolean logDelete(
      String action,
      String tableName,
      String recordId,
      Object oldValues,
      UUID actorId,
      String ipAddress,
      String userAgent);

  /**
   * Records an action that is not a create, update or delete. Table and record id stay null when
   * absent; {@code metadata} is stored as the new values.
   */
  boolean logAction(
      String action,
      String tableName,
      String recordId,
      Object metadata,
      UUID actorId,
      String ipAddress,
      String userAgent);
}
