package io.studentdeals.platform.audit;

import java.util.List;

/** One page of audit entries with its pagination metadata. */
public record AuditLogPage(List<AuditLogView> items, Pagination pagination) {

  /**
   * @param total entries matching the filter, independent of the page
   * @param page 1-based page number
   */
  public record Pagination(long total, int page, int pageSize, int totalPages) {

    public static Pagination of(long total, int page, int pageSize) {
      int totalPages = (int) ((total + pageSize - 1) / pageSize);
      return new Pagination(total, page, pageSize, totalPages);
    }
  }
}
