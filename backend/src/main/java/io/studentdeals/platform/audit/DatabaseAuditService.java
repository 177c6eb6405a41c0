package io.studentdeals.platform.audit;

import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;

/**
 * {@link AuditService} backed by the {@link AuditLogStore}. Snapshots values, appends, and contains
 * every failure of either step.
 */
@Service
@EnableConfigurationProperties(AuditProperties.class)
public class DatabaseAuditService implements AuditService {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditService.class);

  static final String UNKNOWN = "unknown";

  private final AuditLogStore auditLogStore;
  private final AuditValueSnapshots snapshots;

  public DatabaseAuditService(AuditLogStore auditLogStore, AuditValueSnapshots snapshots) {
    this.auditLogStore = auditLogStore;
    this.snapshots = snapshots;
  }

  @Override
  public boolean log(AuditLogRecord record) {
    try {
      auditLogStore.append(
          record.withValues(
              snapshots.snapshot(record.oldValues()), snapshots.snapshot(record.newValues())));
      return true;
    } catch (RuntimeException e) {
      log.error(
          "Failed to record audit log: action={}, table={}, record={}",
          record.action(),
          record.tableName(),
          record.recordId(),
          e);
      return false;
    }
  }

  @Override
  public boolean logCreate(
      String action,
      String tableName,
      String recordId,
      Object newValues,
      UUID actorId,
      String ipAddress,
      String userAgent) {
    return write(
        action,
        orUnknown(tableName),
        orUnknown(recordId),
        null,
        newValues,
        actorId,
        ipAddress,
        userAgent);
  }

  @Override
  public boolean logUpdate(
      String action,
      String tableName,
      String recordId,
      Object oldValues,
      Object newValues,
      UUID actorId,
      String ipAddress,
      String userAgent) {
    return write(
        action,
        orUnknown(tableName),
        orUnknown(recordId),
        oldValues,
        newValues,
        actorId,
        ipAddress,
        userAgent);
  }

  @Override
  public boolean logDelete(
      String action,
      String tableName,
      String recordId,
      Object oldValues,
      UUID actorId,
      String ipAddress,
      String userAgent) {
    return write(
        action,
        orUnknown(tableName),
        orUnknown(recordId),
        oldValues,
        null,
        actorId,
        ipAddress,
        userAgent);
  }

  @Override
  public boolean logAction(
      String action,
      String tableName,
      String recordId,
      Object metadata,
      UUID actorId,
      String ipAddress,
      String userAgent) {
    return write(action, tableName, recordId, null, metadata, actorId, ipAddress, userAgent);
  }

  private boolean write(
      String action,
      String tableName,
      String recordId,
      Object oldValues,
      Object newValues,
      UUID actorId,
      String ipAddress,
      String userAgent) {
    AuditLogRecord record;
    try {
      record =
          AuditLogBuilder.builder()
              .action(action)
              .tableName(tableName)
              .recordId(recordId)
              .oldValues(snapshots.snapshot(oldValues))
              .newValues(snapshots.snapshot(newValues))
              .actorId(actorId)
              .origin(ipAddress, userAgent)
              .build();
    } catch (RuntimeException e) {
      log.error("Failed to compose audit log: action={}, record={}", action, recordId, e);
      return false;
    }
    return log(record);
  }

  private static String orUnknown(String value) {
    return value == null || value.isBlank() ? UNKNOWN : value;
  }
}
