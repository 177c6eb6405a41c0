package io.studentdeals.platform.audit;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Page;

/**
 * Persistence contract for audit log entries. Writes are append-only; there is no update or delete
 * path for individual entries.
 */
public interface AuditLogStore {

  /**
   * Appends a single entry. Fails only when the storage layer is unavailable; callers on the write
   * path are expected to contain the failure.
   *
   * @return the persisted entry with its generated id and creation time
   */
  AuditLog append(AuditLogRecord record);

  /**
   * Lists entries matching the filter.
   *
   * @param page 1-based page number
   * @param pageSize entries per page, clamped to [1, 100]
   */
  Page<AuditLog> list(AuditLogFilter filter, AuditSortOrder sort, int page, int pageSize);

  Optional<AuditLog> findById(UUID id);

  /**
   * Counts matching entries grouped by the given column, largest groups first. Entries whose
   * grouped column is null are excluded.
   */
  List<AuditGroupCount> groupCount(AuditGroupField field, AuditLogFilter filter, int limit);
}
