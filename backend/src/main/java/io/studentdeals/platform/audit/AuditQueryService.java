package io.studentdeals.platform.audit;

import io.studentdeals.platform.exception.InvalidQueryException;
import io.studentdeals.platform.user.AppUser;
import io.studentdeals.platform.user.AppUserRepository;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read side of the audit trail: filtered listings, single-entry lookup and summary statistics.
 * Entries are joined with a minimal actor projection (id, email, role).
 */
@Service
public class AuditQueryService {

  private final AuditLogStore auditLogStore;
  private final AppUserRepository appUserRepository;
  private final AuditProperties properties;

  public AuditQueryService(
      AuditLogStore auditLogStore,
      AppUserRepository appUserRepository,
      AuditProperties properties) {
    this.auditLogStore = auditLogStore;
    this.appUserRepository = appUserRepository;
    this.properties = properties;
  }

  /**
   * Lists entries matching the query, newest first unless {@code oldest} is requested.
   *
   * @throws InvalidQueryException for out-of-range paging, an unknown sort token, or a start date
   *     after the end date
   */
  @Transactional(readOnly = true)
  public AuditLogPage listEntries(AuditLogQuery query) {
    int page = requireInRange("page", query.page(), 1);
    int pageSize = requireInRange("pageSize", query.pageSize(), properties.defaultPageSize());
    AuditSortOrder sort = AuditSortOrder.fromToken(query.sort());
    requireOrderedRange(query.startDate(), query.endDate());

    var result = auditLogStore.list(query.toFilter(), sort, page, pageSize);
    var actors = loadActors(result.getContent());
    var items =
        result.getContent().stream()
            .map(log -> AuditLogView.from(log, actorOf(actors, log)))
            .toList();
    return new AuditLogPage(
        items, AuditLogPage.Pagination.of(result.getTotalElements(), page, pageSize));
  }

  /** Returns the entry, or empty when no entry has this id. */
  @Transactional(readOnly = true)
  public Optional<AuditLogView> getEntry(UUID id) {
    return auditLogStore
        .findById(id)
        .map(log -> AuditLogView.from(log, actorOf(loadActors(List.of(log)), log)));
  }

  /**
   * Totals, top actions, top tables and recent activity for entries created within the optional
   * range (both bounds inclusive).
   */
  @Transactional(readOnly = true)
  public AuditStatistics statistics(Instant from, Instant to) {
    requireOrderedRange(from, to);
    var filter = AuditLogFilter.createdBetween(from, to);
    int limit = properties.statisticsGroupLimit();

    var recent =
        auditLogStore.list(filter, AuditSortOrder.NEWEST, 1, properties.recentActivityLimit());
    var byAction =
        auditLogStore.groupCount(AuditGroupField.ACTION, filter, limit).stream()
            .map(group -> new AuditStatistics.ActionCount(group.value(), group.count()))
            .toList();
    var byTable =
        auditLogStore.groupCount(AuditGroupField.TABLE_NAME, filter, limit).stream()
            .filter(group -> group.value() != null)
            .limit(limit)
            .map(group -> new AuditStatistics.TableCount(group.value(), group.count()))
            .toList();

    var actors = loadActors(recent.getContent());
    var recentActivity =
        recent.getContent().stream()
            .map(
                log ->
                    new AuditStatistics.RecentActivity(
                        log.getId(),
                        log.getAction(),
                        log.getTableName(),
                        actorOf(actors, log),
                        log.getCreatedAt()))
            .toList();

    return new AuditStatistics(recent.getTotalElements(), byAction, byTable, recentActivity);
  }

  private Map<UUID, AuditLogView.ActorSummary> loadActors(Collection<AuditLog> logs) {
    var actorIds =
        logs.stream().map(AuditLog::getActorId).filter(Objects::nonNull).distinct().toList();
    if (actorIds.isEmpty()) {
      return Map.of();
    }
    return appUserRepository.findAllById(actorIds).stream()
        .collect(Collectors.toMap(AppUser::getId, AuditQueryService::toSummary));
  }

  private static AuditLogView.ActorSummary actorOf(
      Map<UUID, AuditLogView.ActorSummary> actors, AuditLog log) {
    return log.getActorId() != null ? actors.get(log.getActorId()) : null;
  }

  private static AuditLogView.ActorSummary toSummary(AppUser user) {
    return new AuditLogView.ActorSummary(user.getId(), user.getEmail(), user.getRole());
  }

  private int requireInRange(String name, Integer value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    if (value < 1 || value > properties.maxPageSize()) {
      throw new InvalidQueryException(
          "Invalid " + name,
          name + " must be between 1 and " + properties.maxPageSize() + ", got: " + value);
    }
    return value;
  }

  private static void requireOrderedRange(Instant from, Instant to) {
    if (from != null && to != null && from.isAfter(to)) {
      throw new InvalidQueryException(
          "Invalid date range", "startDate " + from + " is after endDate " + to);
    }
  }
}
