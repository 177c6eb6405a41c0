package io.studentdeals.platform.audit;

import io.studentdeals.platform.exception.ResourceNotFoundException;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/admin/audit-logs")
@PreAuthorize("hasRole('ADMIN')")
public class AuditLogController {

  private final AuditQueryService auditQueryService;

  public AuditLogController(AuditQueryService auditQueryService) {
    this.auditQueryService = auditQueryService;
  }

  /**
   * {@code limit} is accepted as an alias of {@code pageSize}. Dates may be plain ISO dates or
   * full date-times.
   */
  @GetMapping
  public ResponseEntity<AuditLogPage> listAuditLogs(
      @RequestParam(required = false) UUID actorId,
      @RequestParam(required = false) String action,
      @RequestParam(required = false) String tableName,
      @RequestParam(required = false) String recordId,
      @RequestParam(required = false) String startDate,
      @RequestParam(required = false) String endDate,
      @RequestParam(required = false) String search,
      @RequestParam(required = false) String sort,
      @RequestParam(required = false) Integer page,
      @RequestParam(required = false) Integer pageSize,
      @RequestParam(required = false) Integer limit) {

    var query =
        new AuditLogQuery(
            actorId,
            action,
            tableName,
            recordId,
            AuditDateParams.parse("startDate", startDate),
            AuditDateParams.parse("endDate", endDate),
            search,
            sort,
            page,
            pageSize != null ? pageSize : limit);
    return ResponseEntity.ok(auditQueryService.listEntries(query));
  }

  @GetMapping("/statistics")
  public ResponseEntity<AuditStatistics> getStatistics(
      @RequestParam(required = false) String startDate,
      @RequestParam(required = false) String endDate) {
    return ResponseEntity.ok(
        auditQueryService.statistics(
            AuditDateParams.parse("startDate", startDate),
            AuditDateParams.parse("endDate", endDate)));
  }

  @GetMapping("/{id}")
  public ResponseEntity<AuditLogView> getAuditLog(@PathVariable UUID id) {
    return auditQueryService
        .getEntry(id)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("Audit log", id));
  }
}
