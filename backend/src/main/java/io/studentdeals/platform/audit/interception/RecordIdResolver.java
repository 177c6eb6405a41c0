package io.studentdeals.platform.audit.interception;

import java.util.Map;

/**
 * Record id resolution order: declared {@code recordIdParam} (falling back to the {@code id} path
 * parameter), else the custom extractor, else the {@code id} path parameter. Anything still
 * unresolved after the operation completes is looked up on its result.
 */
final class RecordIdResolver {

  static final String ID = "id";
  static final String DATA = "data";

  private RecordIdResolver() {}

  static String fromRequest(AuditMetadata metadata, OperationRequest request) {
    if (hasText(metadata.recordIdParam())) {
      String value = request.pathParam(metadata.recordIdParam());
      return hasText(value) ? value : blankToNull(request.pathParam(ID));
    }
    if (metadata.recordIdExtractor() != null) {
      return blankToNull(metadata.recordIdExtractor().apply(request));
    }
    return blankToNull(request.pathParam(ID));
  }

  /** Reads {@code data.id}, then {@code id}, from a result tree. */
  static String fromResult(Map<String, Object> result) {
    if (result == null) {
      return null;
    }
    if (result.get(DATA) instanceof Map<?, ?> data && data.get(ID) != null) {
      return String.valueOf(data.get(ID));
    }
    Object id = result.get(ID);
    return id != null ? String.valueOf(id) : null;
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static String blankToNull(String value) {
    return hasText(value) ? value : null;
  }
}
