package io.studentdeals.platform.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Summary of the audit stream for an optional date range.
 *
 * @param total entries in range
 * @param byAction most frequent actions, largest first
 * @param byTable most frequent tables, largest first; entries without a table are not counted
 * @param recentActivity newest entries in range
 */
public record AuditStatistics(
    long total,
    List<ActionCount> byAction,
    List<TableCount> byTable,
    List<RecentActivity> recentActivity) {

  public record ActionCount(String action, long count) {}

  public record TableCount(String tableName, long count) {}

  public record RecentActivity(
      UUID id,
      String action,
      String tableName,
      AuditLogView.ActorSummary user,
      Instant createdAt) {}
}
