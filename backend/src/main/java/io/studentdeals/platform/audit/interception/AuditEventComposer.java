package io.studentdeals.platform.audit.interception;

import io.studentdeals.platform.audit.AuditActions;
import io.studentdeals.platform.audit.AuditService;
import io.studentdeals.platform.audit.AuditValueSnapshots;
import io.studentdeals.platform.security.CurrentActor;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an intercepted operation into exactly one audit entry. The kind decides which snapshots are
 * written: CREATE keeps new values, UPDATE keeps both, DELETE keeps old values, GENERIC keeps new
 * values and leaves a missing table or record id absent.
 *
 * <p>Updates of {@link AuditActions#REVIEW_ACTIONS} additionally carry the review decision, the
 * reviewer's id and email, and the review note from the request body.
 */
@Component
public class AuditEventComposer {

  private static final Logger log = LoggerFactory.getLogger(AuditEventComposer.class);

  static final String DECISION_FIELD = "action";
  static final String NOTES_FIELD = "reviewNotes";

  private final AuditService auditService;
  private final AuditValueSnapshots snapshots;

  public AuditEventComposer(AuditService auditService, AuditValueSnapshots snapshots) {
    this.auditService = auditService;
    this.snapshots = snapshots;
  }

  /**
   * Composes and stores the entry. Never throws.
   *
   * @return true if an entry was stored
   */
  public boolean compose(
      OperationKind kind,
      AuditMetadata metadata,
      OperationRequest request,
      String recordId,
      Object oldValues,
      Object newValues) {
    try {
      CurrentActor actor = request.actor();
      UUID actorId = actor != null ? actor.id() : null;
      String ip = request.origin().ipAddress();
      String userAgent = request.origin().userAgent();
      String action = metadata.action();
      String table = metadata.tableName();

      return switch (kind) {
        case CREATE ->
            auditService.logCreate(action, table, recordId, newValues, actorId, ip, userAgent);
        case UPDATE ->
            auditService.logUpdate(
                action,
                table,
                recordId,
                oldValues,
                withReviewDecision(action, request, newValues),
                actorId,
                ip,
                userAgent);
        case DELETE ->
            auditService.logDelete(action, table, recordId, oldValues, actorId, ip, userAgent);
        case GENERIC ->
            auditService.logAction(action, table, recordId, newValues, actorId, ip, userAgent);
      };
    } catch (RuntimeException e) {
      log.error(
          "Failed to compose audit log: action={}, kind={}, record={}",
          metadata.action(),
          kind,
          recordId,
          e);
      return false;
    }
  }

  private Object withReviewDecision(String action, OperationRequest request, Object newValues) {
    if (!AuditActions.REVIEW_ACTIONS.contains(action)) {
      return newValues;
    }
    Map<String, Object> base = snapshots.snapshot(newValues);
    var enriched = base != null ? new LinkedHashMap<>(base) : new LinkedHashMap<String, Object>();
    CurrentActor reviewer = request.actor();
    enriched.put(DECISION_FIELD, request.bodyValue(DECISION_FIELD));
    enriched.put("reviewerId", reviewer != null ? String.valueOf(reviewer.id()) : null);
    enriched.put("reviewerEmail", reviewer != null ? reviewer.email() : null);
    enriched.put(NOTES_FIELD, blankToNull(request.bodyValue(NOTES_FIELD)));
    return enriched;
  }

  private static Object blankToNull(Object value) {
    return value instanceof String text && text.isBlank() ? null : value;
  }
}
