package io.studentdeals.platform.audit.interception;

import io.studentdeals.platform.audit.AuditProperties;
import io.studentdeals.platform.audit.AuditValueSnapshots;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Wraps operations so that a successful invocation produces one audit entry, derived from the
 * operation's {@link AuditMetadata}, its request and its result.
 *
 * <p>Decoration happens once, at registration time: operations without metadata, with {@code
 * skipLogging}, or registered while auditing is disabled are returned as-is. For decorated
 * operations:
 *
 * <ul>
 *   <li>record id and value snapshots are extracted from the request before dispatch
 *   <li>the operation runs; its exceptions propagate untouched and nothing is logged
 *   <li>after success, a missing record id or new-value snapshot is taken from the result, and the
 *       entry is handed to {@link AuditEventComposer}. A result that cannot be converted leaves
 *       both unresolved; the entry is still written
 * </ul>
 *
 * <p>Failures during extraction or composition are logged and dropped. The caller always receives
 * the operation's own result.
 */
@Component
public class AuditInterceptor {

  private static final Logger log = LoggerFactory.getLogger(AuditInterceptor.class);

  private final AuditMetadataRegistry registry;
  private final AuditEventComposer composer;
  private final AuditValueSnapshots snapshots;
  private final AuditProperties properties;

  public AuditInterceptor(
      AuditMetadataRegistry registry,
      AuditEventComposer composer,
      AuditValueSnapshots snapshots,
      AuditProperties properties) {
    this.registry = registry;
    this.composer = composer;
    this.snapshots = snapshots;
    this.properties = properties;
  }

  /** Registers the metadata under {@code operationName} and returns the decorated operation. */
  public <T> AuditedOperation<T> register(
      String operationName, AuditMetadata metadata, AuditedOperation<T> operation) {
    registry.register(operationName, metadata);
    return decorate(operationName, operation);
  }

  /** Decorates an operation using metadata already present in the registry. */
  public <T> AuditedOperation<T> decorate(String operationName, AuditedOperation<T> operation) {
    AuditMetadata metadata = registry.find(operationName).orElse(null);
    if (!properties.enabled() || metadata == null || metadata.skipLogging()) {
      log.debug(
          "audit.interception: operation={}, state={}", operationName, InterceptionState.SKIPPED);
      return operation;
    }
    return request -> intercept(operationName, metadata, operation, request);
  }

  private <T> T intercept(
      String operationName,
      AuditMetadata metadata,
      AuditedOperation<T> operation,
      OperationRequest request) {
    log.trace(
        "audit.interception: operation={}, state={}", operationName, InterceptionState.PENDING);
    Capture capture = extract(operationName, metadata, request);
    T result = operation.handle(request);
    if (capture != null) {
      complete(operationName, metadata, request, capture, result);
    }
    return result;
  }

  /** Returns null when extraction failed; the operation still runs but is not audited. */
  private Capture extract(String operationName, AuditMetadata metadata, OperationRequest request) {
    log.trace(
        "audit.interception: operation={}, state={}", operationName, InterceptionState.EXTRACTING);
    try {
      String recordId = RecordIdResolver.fromRequest(metadata, request);
      Object oldValues =
          metadata.oldValuesExtractor() != null
              ? metadata.oldValuesExtractor().apply(request)
              : null;
      Object newValues =
          metadata.newValuesExtractor() != null
              ? metadata.newValuesExtractor().apply(request)
              : nonEmptyBody(request);
      return new Capture(recordId, oldValues, newValues);
    } catch (RuntimeException e) {
      log.warn(
          "audit.interception: operation={}, state={}, stage=extract",
          operationName,
          InterceptionState.FAILED_SILENTLY,
          e);
      return null;
    }
  }

  private void complete(
      String operationName,
      AuditMetadata metadata,
      OperationRequest request,
      Capture capture,
      Object result) {
    try {
      OperationKind kind = request.verb().kind();
      String recordId = capture.recordId();
      Object newValues = capture.newValues();
      boolean needsNewValues = newValues == null && kind != OperationKind.DELETE;
      if (recordId == null || needsNewValues) {
        Map<String, Object> tree = resultTree(operationName, result);
        if (recordId == null) {
          recordId = RecordIdResolver.fromResult(tree);
        }
        if (needsNewValues) {
          newValues = resultPayload(tree);
        }
      }
      boolean stored =
          composer.compose(kind, metadata, request, recordId, capture.oldValues(), newValues);
      log.debug(
          "audit.interception: operation={}, state={}, record={}",
          operationName,
          stored ? InterceptionState.COMPOSED : InterceptionState.FAILED_SILENTLY,
          recordId);
    } catch (RuntimeException e) {
      log.warn(
          "audit.interception: operation={}, state={}, stage=complete",
          operationName,
          InterceptionState.FAILED_SILENTLY,
          e);
    }
  }

  /** Null when the result cannot be converted; the entry is then written without it. */
  private Map<String, Object> resultTree(String operationName, Object result) {
    try {
      return snapshots.toTree(result);
    } catch (RuntimeException e) {
      log.warn(
          "audit.interception: operation={}, stage=result, result_type={}, reason={}",
          operationName,
          result.getClass().getName(),
          e.getMessage());
      return null;
    }
  }

  private static Map<String, Object> nonEmptyBody(OperationRequest request) {
    return request.body() == null || request.body().isEmpty() ? null : request.body();
  }

  /** Unwraps a {@code {"data": ...}} response envelope. */
  private static Object resultPayload(Map<String, Object> tree) {
    if (tree != null && tree.get(RecordIdResolver.DATA) != null) {
      return tree.get(RecordIdResolver.DATA);
    }
    return tree;
  }

  private record Capture(String recordId, Object oldValues, Object newValues) {}
}
