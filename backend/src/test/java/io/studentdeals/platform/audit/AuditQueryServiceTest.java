package io.studentdeals.platform.audit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.studentdeals.platform.exception.InvalidQueryException;
import io.studentdeals.platform.user.AppUser;
import io.studentdeals.platform.user.AppUserRepository;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;

@ExtendWith(MockitoExtension.class)
class AuditQueryServiceTest {

  private static final UUID ADMIN_ID = UUID.randomUUID();

  @Mock private AuditLogStore auditLogStore;
  @Mock private AppUserRepository appUserRepository;

  private AuditQueryService service;

  @BeforeEach
  void setUp() {
    service = new AuditQueryService(auditLogStore, appUserRepository, AuditProperties.defaults());
  }

  @Test
  void listEntries_defaultsToFirstPageNewestFirst() {
    when(auditLogStore.list(any(), eq(AuditSortOrder.NEWEST), eq(1), eq(10)))
        .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 10), 0));

    var page = service.listEntries(query(null, null, null));

    assertThat(page.items()).isEmpty();
    assertThat(page.pagination())
        .isEqualTo(new AuditLogPage.Pagination(0, 1, 10, 0));
  }

  @Test
  void listEntries_joinsActorProjectionAndComputesPageCount() {
    var withActor = entry("CREATE_OFFER", "offers", ADMIN_ID);
    var anonymous = entry("FLUTTER_NOTIFICATION_CLICK", null, null);
    when(auditLogStore.list(any(), eq(AuditSortOrder.OLDEST), eq(2), eq(2)))
        .thenReturn(new PageImpl<>(List.of(withActor, anonymous), PageRequest.of(1, 2), 5));
    when(appUserRepository.findAllById(List.of(ADMIN_ID)))
        .thenReturn(List.of(new AppUser(ADMIN_ID, "admin@studentdeals.io", "admin")));

    var page = service.listEntries(query("oldest", 2, 2));

    assertThat(page.pagination()).isEqualTo(new AuditLogPage.Pagination(5, 2, 2, 3));
    assertThat(page.items()).hasSize(2);
    assertThat(page.items().get(0).actor())
        .isEqualTo(new AuditLogView.ActorSummary(ADMIN_ID, "admin@studentdeals.io", "admin"));
    assertThat(page.items().get(0).actorId()).isEqualTo(ADMIN_ID);
    assertThat(page.items().get(1).actor()).isNull();
  }

  @Test
  void listEntries_passesFilterFieldsToStore() {
    var from = Instant.parse("2026-01-01T00:00:00Z");
    var to = Instant.parse("2026-02-01T00:00:00Z");
    when(auditLogStore.list(any(), any(), eq(1), eq(10)))
        .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 10), 0));

    service.listEntries(
        new AuditLogQuery(
            ADMIN_ID, "offer", "offers", "42", from, to, "admin@", null, null, null));

    var filter = ArgumentCaptor.forClass(AuditLogFilter.class);
    verify(auditLogStore).list(filter.capture(), eq(AuditSortOrder.NEWEST), eq(1), eq(10));
    assertThat(filter.getValue())
        .isEqualTo(new AuditLogFilter(ADMIN_ID, "offer", "offers", "42", from, to, "admin@"));
  }

  @Test
  void listEntries_rejectsOutOfRangePaging() {
    assertThatThrownBy(() -> service.listEntries(query(null, 0, 10)))
        .isInstanceOf(InvalidQueryException.class);
    assertThatThrownBy(() -> service.listEntries(query(null, 101, 10)))
        .isInstanceOf(InvalidQueryException.class);
    assertThatThrownBy(() -> service.listEntries(query(null, 1, 0)))
        .isInstanceOf(InvalidQueryException.class);
    assertThatThrownBy(() -> service.listEntries(query(null, 1, 101)))
        .isInstanceOf(InvalidQueryException.class);
    verifyNoInteractions(auditLogStore);
  }

  @Test
  void listEntries_rejectsUnknownSortToken() {
    assertThatThrownBy(() -> service.listEntries(query("sideways", null, null)))
        .isInstanceOf(InvalidQueryException.class)
        .hasMessageContaining("Invalid sort");
  }

  @Test
  void listEntries_rejectsInvertedDateRange() {
    var query =
        new AuditLogQuery(
            null,
            null,
            null,
            null,
            Instant.parse("2026-03-01T00:00:00Z"),
            Instant.parse("2026-02-01T00:00:00Z"),
            null,
            null,
            null,
            null);

    assertThatThrownBy(() -> service.listEntries(query))
        .isInstanceOf(InvalidQueryException.class);
  }

  @Test
  void getEntry_returnsEmptyForUnknownId() {
    var id = UUID.randomUUID();
    when(auditLogStore.findById(id)).thenReturn(Optional.empty());

    assertThat(service.getEntry(id)).isEmpty();
  }

  @Test
  void getEntry_joinsActor() {
    var id = UUID.randomUUID();
    when(auditLogStore.findById(id))
        .thenReturn(Optional.of(entry("UPDATE_OFFER", "offers", ADMIN_ID)));
    when(appUserRepository.findAllById(List.of(ADMIN_ID)))
        .thenReturn(List.of(new AppUser(ADMIN_ID, "admin@studentdeals.io", "admin")));

    var view = service.getEntry(id);

    assertThat(view).isPresent();
    assertThat(view.get().action()).isEqualTo("UPDATE_OFFER");
    assertThat(view.get().actor().email()).isEqualTo("admin@studentdeals.io");
  }

  @Test
  void statistics_summarisesGroupsAndRecentActivity() {
    var recent =
        List.of(
            entry("CREATE_OFFER", "offers", null),
            entry("UPDATE_OFFER", "offers", null),
            entry("CREATE_OFFER", "offers", null));
    when(auditLogStore.list(any(), eq(AuditSortOrder.NEWEST), eq(1), eq(5)))
        .thenReturn(new PageImpl<>(recent, PageRequest.of(0, 5), 3));
    when(auditLogStore.groupCount(eq(AuditGroupField.ACTION), any(), eq(10)))
        .thenReturn(
            List.of(
                new AuditGroupCount("CREATE_OFFER", 2), new AuditGroupCount("UPDATE_OFFER", 1)));
    when(auditLogStore.groupCount(eq(AuditGroupField.TABLE_NAME), any(), eq(10)))
        .thenReturn(Arrays.asList(new AuditGroupCount("offers", 3), new AuditGroupCount(null, 4)));

    var statistics = service.statistics(null, null);

    assertThat(statistics.total()).isEqualTo(3);
    assertThat(statistics.byAction())
        .containsExactly(
            new AuditStatistics.ActionCount("CREATE_OFFER", 2),
            new AuditStatistics.ActionCount("UPDATE_OFFER", 1));
    assertThat(statistics.byTable()).containsExactly(new AuditStatistics.TableCount("offers", 3));
    assertThat(statistics.recentActivity())
        .extracting(AuditStatistics.RecentActivity::action)
        .containsExactly("CREATE_OFFER", "UPDATE_OFFER", "CREATE_OFFER");
    verifyNoInteractions(appUserRepository);
  }

  @Test
  void statistics_restrictsToDateRange() {
    var from = Instant.parse("2026-01-01T00:00:00Z");
    var to = Instant.parse("2026-01-31T23:59:59Z");
    when(auditLogStore.list(any(), any(), eq(1), eq(5)))
        .thenReturn(new PageImpl<>(List.of(), PageRequest.of(0, 5), 0));
    when(auditLogStore.groupCount(any(), any(), eq(10))).thenReturn(List.of());

    service.statistics(from, to);

    verify(auditLogStore)
        .groupCount(AuditGroupField.ACTION, AuditLogFilter.createdBetween(from, to), 10);
  }

  private static AuditLogQuery query(String sort, Integer page, Integer pageSize) {
    return new AuditLogQuery(null, null, null, null, null, null, null, sort, page, pageSize);
  }

  private static AuditLog entry(String action, String tableName, UUID actorId) {
    return new AuditLog(
        new AuditLogRecord(action, tableName, "r-1", null, null, actorId, null, null));
  }
}
