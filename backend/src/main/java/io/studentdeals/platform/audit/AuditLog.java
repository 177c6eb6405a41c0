package io.studentdeals.platform.audit;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Immutable audit log entry persisted to the {@code audit_logs} table. Entries are append-only: the
 * entity is marked {@link Immutable}, exposes no setters, and {@code createdAt} is assigned once at
 * construction.
 *
 * @see AuditLogRecord
 */
@Entity
@Immutable
@Table(name = "audit_logs")
public class AuditLog {

  @Id
  @GeneratedValue(strategy = GenerationType.UUID)
  private UUID id;

  @Column(name = "action", nullable = false, length = 100)
  private String action;

  @Column(name = "table_name", length = 100)
  private String tableName;

  @Column(name = "record_id", length = 255)
  private String recordId;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "old_values", columnDefinition = "jsonb")
  private Map<String, Object> oldValues;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "new_values", columnDefinition = "jsonb")
  private Map<String, Object> newValues;

  @Column(name = "user_id")
  private UUID actorId;

  @Column(name = "ip_address", length = 45)
  private String ipAddress;

  @Column(name = "user_agent", length = 500)
  private String userAgent;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  /** Protected no-arg constructor required by JPA. */
  protected AuditLog() {}

  /** Creates an entry from the given record. Sets {@code createdAt} to the current instant. */
  public AuditLog(AuditLogRecord record) {
    this.action = record.action();
    this.tableName = record.tableName();
    this.recordId = record.recordId();
    this.oldValues = record.oldValues();
    this.newValues = record.newValues();
    this.actorId = record.actorId();
    this.ipAddress = record.ipAddress();
    this.userAgent = record.userAgent();
    this.createdAt = Instant.now();
  }

  public UUID getId() {
    return id;
  }

  public String getAction() {
    return action;
  }

  public String getTableName() {
    return tableName;
  }

  public String getRecordId() {
    return recordId;
  }

  public Map<String, Object> getOldValues() {
    return oldValues;
  }

  public Map<String, Object> getNewValues() {
    return newValues;
  }

  public UUID getActorId() {
    return actorId;
  }

  public String getIpAddress() {
    return ipAddress;
  }

  public String getUserAgent() {
    return userAgent;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
