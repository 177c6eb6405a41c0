package io.studentdeals.platform.audit;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * JPA-backed {@link AuditLogStore}. Translates {@link AuditLogFilter} into the nullable-parameter
 * queries of {@link AuditLogRepository}.
 *
 * <p>Transaction semantics: {@code append()} runs in its own transaction (REQUIRES_NEW). A failed
 * audit insert never marks the caller's transaction rollback-only, and a business rollback does not
 * take the audit entry with it.
 */
@Service
public class DatabaseAuditLogStore implements AuditLogStore {

  private static final Logger log = LoggerFactory.getLogger(DatabaseAuditLogStore.class);

  static final int MIN_PAGE_SIZE = 1;
  static final int MAX_PAGE_SIZE = 100;

  private final AuditLogRepository auditLogRepository;

  public DatabaseAuditLogStore(AuditLogRepository auditLogRepository) {
    this.auditLogRepository = auditLogRepository;
  }

  @Override
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public AuditLog append(AuditLogRecord record) {
    var saved = auditLogRepository.save(new AuditLog(record));
    log.debug(
        "Recorded audit log: action={}, table={}, record={}, actor={}",
        record.action(),
        record.tableName(),
        record.recordId(),
        record.actorId());
    return saved;
  }

  @Override
  @Transactional(readOnly = true)
  public Page<AuditLog> list(AuditLogFilter filter, AuditSortOrder sort, int page, int pageSize) {
    int size = Math.max(MIN_PAGE_SIZE, Math.min(pageSize, MAX_PAGE_SIZE));
    var pageable = PageRequest.of(Math.max(page, 1) - 1, size, sort.toSort());
    return auditLogRepository.findByFilter(
        filter.actorId(),
        containsPattern(filter.action()),
        containsPattern(filter.tableName()),
        blankToNull(filter.recordId()),
        filter.from(),
        filter.to(),
        containsPattern(filter.search()),
        pageable);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<AuditLog> findById(UUID id) {
    return auditLogRepository.findById(id);
  }

  @Override
  @Transactional(readOnly = true)
  public List<AuditGroupCount> groupCount(
      AuditGroupField field, AuditLogFilter filter, int limit) {
    Pageable top = PageRequest.of(0, Math.max(limit, 1));
    var rows =
        switch (field) {
          case ACTION ->
              auditLogRepository.countByAction(
                  filter.actorId(),
                  containsPattern(filter.action()),
                  containsPattern(filter.tableName()),
                  blankToNull(filter.recordId()),
                  filter.from(),
                  filter.to(),
                  containsPattern(filter.search()),
                  top);
          case TABLE_NAME ->
              auditLogRepository.countByTableName(
                  filter.actorId(),
                  containsPattern(filter.action()),
                  containsPattern(filter.tableName()),
                  blankToNull(filter.recordId()),
                  filter.from(),
                  filter.to(),
                  containsPattern(filter.search()),
                  top);
        };
    return rows.stream()
        .map(row -> new AuditGroupCount(row.getGroupKey(), row.getTotal()))
        .toList();
  }

  /** Lower-cased {@code %term%} pattern with LIKE wildcards escaped, or null for a blank term. */
  static String containsPattern(String term) {
    String value = blankToNull(term);
    if (value == null) {
      return null;
    }
    String escaped =
        value
            .toLowerCase(Locale.ROOT)
            .replace("\\", "\\\\")
            .replace("%", "\\%")
            .replace("_", "\\_");
    return "%" + escaped + "%";
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
