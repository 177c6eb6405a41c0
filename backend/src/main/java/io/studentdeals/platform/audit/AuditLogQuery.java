package io.studentdeals.platform.audit;

import java.time.Instant;
import java.util.UUID;

/**
 * Listing request for {@link AuditQueryService#listEntries}. Every field is optional.
 *
 * @param sort {@code newest} (default) or {@code oldest}
 * @param page 1-based page number, 1 to 100
 * @param pageSize entries per page, 1 to 100
 */
public record AuditLogQuery(
    UUID actorId,
    String action,
    String tableName,
    String recordId,
    Instant startDate,
    Instant endDate,
    String search,
    String sort,
    Integer page,
    Integer pageSize) {

  AuditLogFilter toFilter() {
    return new AuditLogFilter(actorId, action, tableName, recordId, startDate, endDate, search);
  }
}
