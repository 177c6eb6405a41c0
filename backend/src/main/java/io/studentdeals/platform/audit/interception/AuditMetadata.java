package io.studentdeals.platform.audit.interception;

import io.studentdeals.platform.audit.AuditAction;
import java.util.function.Function;

/**
 * Declarative audit configuration for one operation. Read-only to the interceptor; never persisted.
 *
 * <p>Usage:
 *
 * <pre>{@code
 * AuditMetadata metadata = AuditMetadata.forAction(AuditActions.UPDATE_OFFER)
 *     .tableName("offers")
 *     .recordIdParam("offerId")
 *     .oldValues(request -> request.bodyValue("previous"))
 *     .build();
 * }</pre>
 *
 * @param action action tag written on every entry; never blank
 * @param tableName logical entity affected; nullable
 * @param recordIdParam path parameter carrying the record id; nullable
 * @param recordIdExtractor derives the record id from the request; used when no {@code
 *     recordIdParam} is declared; nullable
 * @param oldValuesExtractor derives the prior state from the request; nullable
 * @param newValuesExtractor derives the new state from the request; when null the request body is
 *     used; nullable
 * @param skipLogging when true the operation is never audited
 */
public record AuditMetadata(
    String action,
    String tableName,
    String recordIdParam,
    Function<OperationRequest, String> recordIdExtractor,
    Function<OperationRequest, Object> oldValuesExtractor,
    Function<OperationRequest, Object> newValuesExtractor,
    boolean skipLogging) {

  public AuditMetadata {
    action = AuditAction.of(action).name();
  }

  public static Builder forAction(String action) {
    return new Builder(action);
  }

  public static final class Builder {

    private final String action;
    private String tableName;
    private String recordIdParam;
    private Function<OperationRequest, String> recordIdExtractor;
    private Function<OperationRequest, Object> oldValuesExtractor;
    private Function<OperationRequest, Object> newValuesExtractor;
    private boolean skipLogging;

    private Builder(String action) {
      this.action = action;
    }

    public Builder tableName(String tableName) {
      this.tableName = tableName;
      return this;
    }

    public Builder recordIdParam(String recordIdParam) {
      this.recordIdParam = recordIdParam;
      return this;
    }

    public Builder recordId(Function<OperationRequest, String> extractor) {
      this.recordIdExtractor = extractor;
      return this;
    }

    public Builder oldValues(Function<OperationRequest, Object> extractor) {
      this.oldValuesExtractor = extractor;
      return this;
    }

    public Builder newValues(Function<OperationRequest, Object> extractor) {
      this.newValuesExtractor = extractor;
      return this;
    }

    public Builder skipLogging() {
      this.skipLogging = true;
      return this;
    }

    public AuditMetadata build() {
      return new AuditMetadata(
          action,
          tableName,
          recordIdParam,
          recordIdExtractor,
          oldValuesExtractor,
          newValuesExtractor,
          skipLogging);
    }
  }
}
