package io.studentdeals.platform.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Query filter for {@link AuditLogStore}. All fields are nullable -- null means "no filter on this
 * field".
 *
 * @param actorId exact match on the acting user
 * @param action case-insensitive substring of the action tag
 * @param tableName case-insensitive substring of the table name
 * @param recordId exact match on the record id
 * @param from start of the creation-time range (inclusive)
 * @param to end of the creation-time range (inclusive)
 * @param search case-insensitive substring matched against action, table name, OR actor email
 */
public record AuditLogFilter(
    UUID actorId,
    String action,
    String tableName,
    String recordId,
    Instant from,
    Instant to,
    String search) {

  public static AuditLogFilter createdBetween(Instant from, Instant to) {
    return new AuditLogFilter(null, null, null, null, from, to, null);
  }
}
