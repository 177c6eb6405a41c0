package io.studentdeals.platform.audit;

import static org.assertj.core.api.Assertions.assertThat;

import io.studentdeals.platform.TestcontainersConfiguration;
import io.studentdeals.platform.audit.interception.AuditInterceptor;
import io.studentdeals.platform.audit.interception.AuditMetadata;
import io.studentdeals.platform.audit.interception.OperationRequest;
import io.studentdeals.platform.audit.interception.OperationVerb;
import io.studentdeals.platform.security.CurrentActor;
import io.studentdeals.platform.security.RequestOrigin;
import io.studentdeals.platform.security.Roles;
import io.studentdeals.platform.user.AppUser;
import io.studentdeals.platform.user.AppUserRepository;
import java.time.Instant;
import java.util.HashSet;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * Writes and queries audit entries against a real Postgres via Testcontainers. Each test uses its
 * own action prefix or time window so the shared table does not leak between tests.
 */
@SpringBootTest
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class AuditLogStoreIntegrationTest {

  @Autowired private AuditService auditService;
  @Autowired private AuditQueryService auditQueryService;
  @Autowired private AuditLogRepository auditLogRepository;
  @Autowired private AppUserRepository appUserRepository;
  @Autowired private AuditInterceptor auditInterceptor;

  private UUID adminId;
  private UUID branchId;

  @BeforeAll
  void createUsers() {
    adminId = UUID.randomUUID();
    branchId = UUID.randomUUID();
    appUserRepository.save(new AppUser(adminId, "ops-" + adminId + "@studentdeals.io", "admin"));
    appUserRepository.save(
        new AppUser(branchId, "branch-" + branchId + "@studentdeals.io", "merchant_branch"));
  }

  @Test
  void logCreate_persistsEntryWithJsonValues() {
    var recordId = UUID.randomUUID().toString();

    boolean stored =
        auditService.logCreate(
            "CREATE_OFFER",
            "offers",
            recordId,
            Map.of("title", "Free coffee", "terms", Map.of("minAge", 18)),
            branchId,
            "203.0.113.7",
            "StudentDeals/2.1");

    assertThat(stored).isTrue();
    var page =
        auditQueryService.listEntries(
            new AuditLogQuery(null, null, null, recordId, null, null, null, null, null, null));
    assertThat(page.pagination().total()).isEqualTo(1);
    var entry = page.items().get(0);
    assertThat(entry.action()).isEqualTo("CREATE_OFFER");
    assertThat(entry.tableName()).isEqualTo("offers");
    assertThat(entry.oldValues()).isNull();
    assertThat(entry.newValues()).containsEntry("title", "Free coffee");
    assertThat(entry.newValues().get("terms")).isEqualTo(Map.of("minAge", 18));
    assertThat(entry.actor().id()).isEqualTo(branchId);
    assertThat(entry.actor().role()).isEqualTo("merchant_branch");
    assertThat(entry.ipAddress()).isEqualTo("203.0.113.7");
    assertThat(entry.createdAt()).isNotNull();

    assertThat(auditQueryService.getEntry(entry.id())).contains(entry);
  }

  @Test
  void listEntries_pagesWithoutGapsOrDuplicates() {
    String prefix = "PAGING_" + shortId();
    for (int i = 0; i < 5; i++) {
      auditService.logAction(prefix, "offers", "o-" + i, null, adminId, null, null);
    }

    var seen = new HashSet<UUID>();
    for (int page = 1; page <= 3; page++) {
      var result = auditQueryService.listEntries(query(prefix, null, page, 2));
      assertThat(result.pagination().total()).isEqualTo(5);
      assertThat(result.pagination().totalPages()).isEqualTo(3);
      result.items().forEach(item -> assertThat(seen.add(item.id())).isTrue());
    }
    assertThat(seen).hasSize(5);
  }

  @Test
  void listEntries_sortsOldestFirstOnRequest() {
    String prefix = "SORT_" + shortId();
    auditService.logAction(prefix + "_FIRST", "offers", "o-1", null, adminId, null, null);
    auditService.logAction(prefix + "_SECOND", "offers", "o-2", null, adminId, null, null);

    var oldest = auditQueryService.listEntries(query(prefix, "oldest", null, null));
    var newest = auditQueryService.listEntries(query(prefix, null, null, null));

    assertThat(oldest.items().get(0).action()).isEqualTo(prefix + "_FIRST");
    assertThat(newest.items().get(0).action()).isEqualTo(prefix + "_SECOND");
  }

  @Test
  void listEntries_actionFilterIsCaseInsensitiveSubstring() {
    String prefix = "CASE_" + shortId();
    auditService.logAction(prefix + "_UPDATE_OFFER", "offers", "o-1", null, adminId, null, null);

    var result =
        auditQueryService.listEntries(query(prefix.toLowerCase() + "_update", null, null, null));

    assertThat(result.items())
        .extracting(AuditLogView::action)
        .containsExactly(prefix + "_UPDATE_OFFER");
  }

  @Test
  void listEntries_actionFilterTreatsWildcardsLiterally() {
    String prefix = "WILD_" + shortId();
    auditService.logAction(prefix + "_A", "offers", null, null, adminId, null, null);

    var result = auditQueryService.listEntries(query(prefix + "%", null, null, null));

    assertThat(result.items()).isEmpty();
  }

  @Test
  void listEntries_searchMatchesActorEmail() {
    var userId = UUID.randomUUID();
    String email = "searchable-" + shortId() + "@studentdeals.io";
    appUserRepository.save(new AppUser(userId, email, "student"));
    auditService.logAction("FLUTTER_NOTIFICATION_CLICK", null, null, null, userId, null, null);

    var result =
        auditQueryService.listEntries(
            new AuditLogQuery(
                null, null, null, null, null, null, email.toUpperCase(), null, null, null));

    assertThat(result.pagination().total()).isEqualTo(1);
    assertThat(result.items().get(0).actor().email()).isEqualTo(email);
    assertThat(result.items().get(0).tableName()).isNull();
  }

  @Test
  void listEntries_keepsEntriesOfUnknownActors() {
    String prefix = "GHOST_" + shortId();
    var ghost = UUID.randomUUID();
    auditService.logAction(prefix, "offers", "o-1", null, ghost, null, null);

    var result = auditQueryService.listEntries(query(prefix, null, null, null));

    assertThat(result.items()).hasSize(1);
    assertThat(result.items().get(0).actorId()).isEqualTo(ghost);
    assertThat(result.items().get(0).actor()).isNull();
  }

  @Test
  void statistics_groupsWithinRangeAndSkipsEntriesWithoutTable() {
    Instant from = Instant.now();
    String suffix = shortId();
    auditService.logAction("STATS_A_" + suffix, "offers", "1", null, adminId, null, null);
    auditService.logAction("STATS_A_" + suffix, "offers", "2", null, adminId, null, null);
    auditService.logAction("STATS_B_" + suffix, "branches", "3", null, adminId, null, null);
    auditService.logAction("STATS_C_" + suffix, null, null, null, adminId, null, null);
    Instant to = Instant.now();

    var stats = auditQueryService.statistics(from, to);

    assertThat(stats.total()).isEqualTo(4);
    assertThat(stats.byAction().get(0))
        .isEqualTo(new AuditStatistics.ActionCount("STATS_A_" + suffix, 2));
    assertThat(stats.byTable())
        .containsExactly(
            new AuditStatistics.TableCount("offers", 2),
            new AuditStatistics.TableCount("branches", 1));
    assertThat(stats.recentActivity()).hasSize(4);
    assertThat(stats.recentActivity().get(0).action()).isEqualTo("STATS_C_" + suffix);
    assertThat(stats.recentActivity().get(0).user().id()).isEqualTo(adminId);
  }

  @Test
  void interceptedOperation_writesOneEntry() {
    String operation = "update-offer-" + shortId();
    var recordId = UUID.randomUUID().toString();
    var updateOffer =
        auditInterceptor.register(
            operation,
            AuditMetadata.forAction(AuditActions.UPDATE_OFFER)
                .tableName("offers")
                .oldValues(req -> Map.of("title", "Old title"))
                .build(),
            request -> Map.of("id", request.pathParam("id"), "title", "New title"));
    var request =
        OperationRequest.builder(OperationVerb.PATCH)
            .pathParam("id", recordId)
            .body(Map.of("title", "New title", "password", "hunter2"))
            .actor(new CurrentActor(branchId, null, Roles.MERCHANT_BRANCH))
            .origin(new RequestOrigin("198.51.100.4", "JUnit"))
            .build();

    updateOffer.handle(request);

    var entries =
        auditLogRepository.findAll().stream()
            .filter(log -> recordId.equals(log.getRecordId()))
            .toList();
    assertThat(entries).hasSize(1);
    var entry = entries.get(0);
    assertThat(entry.getAction()).isEqualTo(AuditActions.UPDATE_OFFER);
    assertThat(entry.getOldValues()).containsEntry("title", "Old title");
    assertThat(entry.getNewValues())
        .containsEntry("title", "New title")
        .containsEntry("password", "***MASKED***");
    assertThat(entry.getActorId()).isEqualTo(branchId);
    assertThat(entry.getIpAddress()).isEqualTo("198.51.100.4");
  }

  private static AuditLogQuery query(String action, String sort, Integer page, Integer pageSize) {
    return new AuditLogQuery(null, action, null, null, null, null, null, sort, page, pageSize);
  }

  private static String shortId() {
    return UUID.randomUUID().toString().substring(0, 8).toUpperCase();
  }
}
