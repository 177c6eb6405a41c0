package io.studentdeals.platform.audit;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

  /**
   * Shared nullable-filter clause. Each parameter uses {@code (:param IS NULL OR ...)}; the
   * substring filters receive ready-made lower-case LIKE patterns with {@code \} as escape char.
   * The search pattern matches action, table name, or the joined actor's email.
   */
  String FILTER =
      """
      WHERE (:actorId IS NULL OR e.actorId = :actorId)
        AND (CAST(:actionPattern AS string) IS NULL
             OR LOWER(e.action) LIKE CAST(:actionPattern AS string) ESCAPE '\\')
        AND (CAST(:tablePattern AS string) IS NULL
             OR LOWER(e.tableName) LIKE CAST(:tablePattern AS string) ESCAPE '\\')
        AND (CAST(:recordId AS string) IS NULL OR e.recordId = CAST(:recordId AS string))
        AND (CAST(:from AS timestamp) IS NULL OR e.createdAt >= :from)
        AND (CAST(:to AS timestamp) IS NULL OR e.createdAt <= :to)
        AND (CAST(:searchPattern AS string) IS NULL
             OR LOWER(e.action) LIKE CAST(:searchPattern AS string) ESCAPE '\\'
             OR LOWER(e.tableName) LIKE CAST(:searchPattern AS string) ESCAPE '\\'
             OR LOWER(u.email) LIKE CAST(:searchPattern AS string) ESCAPE '\\')
      """;

  String FROM_WITH_ACTOR = " FROM AuditLog e LEFT JOIN AppUser u ON u.id = e.actorId ";

  /** Typed projection for grouped counts. */
  interface GroupCountView {
    String getGroupKey();

    long getTotal();
  }

  /** Ordering comes from the {@link Pageable}'s sort. */
  @Query(
      value = "SELECT e" + FROM_WITH_ACTOR + FILTER,
      countQuery = "SELECT COUNT(e)" + FROM_WITH_ACTOR + FILTER)
  Page<AuditLog> findByFilter(
      @Param("actorId") UUID actorId,
      @Param("actionPattern") String actionPattern,
      @Param("tablePattern") String tablePattern,
      @Param("recordId") String recordId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      @Param("searchPattern") String searchPattern,
      Pageable pageable);

  /** Counts grouped by action, largest first, ties broken by action name. */
  @Query(
      "SELECT e.action AS groupKey, COUNT(e) AS total"
          + FROM_WITH_ACTOR
          + FILTER
          + " GROUP BY e.action ORDER BY COUNT(e) DESC, e.action ASC")
  List<GroupCountView> countByAction(
      @Param("actorId") UUID actorId,
      @Param("actionPattern") String actionPattern,
      @Param("tablePattern") String tablePattern,
      @Param("recordId") String recordId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      @Param("searchPattern") String searchPattern,
      Pageable limit);

  /** Counts grouped by table name, null table names excluded. */
  @Query(
      "SELECT e.tableName AS groupKey, COUNT(e) AS total"
          + FROM_WITH_ACTOR
          + FILTER
          + " AND e.tableName IS NOT NULL"
          + " GROUP BY e.tableName ORDER BY COUNT(e) DESC, e.tableName ASC")
  List<GroupCountView> countByTableName(
      @Param("actorId") UUID actorId,
      @Param("actionPattern") String actionPattern,
      @Param("tablePattern") String tablePattern,
      @Param("recordId") String recordId,
      @Param("from") Instant from,
      @Param("to") Instant to,
      @Param("searchPattern") String searchPattern,
      Pageable limit);
}
