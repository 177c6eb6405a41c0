package io.studentdeals.platform.audit.interception;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Operation name to {@link AuditMetadata} mapping. Populated at registration time through {@link
 * AuditInterceptor#register}, so every audited operation is listed here.
 */
@Component
public class AuditMetadataRegistry {

  private static final Logger log = LoggerFactory.getLogger(AuditMetadataRegistry.class);

  private final Map<String, AuditMetadata> metadataByOperation = new ConcurrentHashMap<>();

  /**
   * Registers the metadata for an operation.
   *
   * @throws IllegalStateException if the operation name is already registered
   */
  public void register(String operationName, AuditMetadata metadata) {
    if (operationName == null || operationName.isBlank()) {
      throw new IllegalArgumentException("Operation name must not be blank");
    }
    var existing = metadataByOperation.putIfAbsent(operationName, metadata);
    if (existing != null) {
      throw new IllegalStateException(
          "Audit metadata already registered for operation: " + operationName);
    }
    log.debug(
        "Registered audited operation: operation={}, action={}, table={}, skip={}",
        operationName,
        metadata.action(),
        metadata.tableName(),
        metadata.skipLogging());
  }

  public Optional<AuditMetadata> find(String operationName) {
    return Optional.ofNullable(metadataByOperation.get(operationName));
  }

  /** Read-only view of every registered operation. */
  public Map<String, AuditMetadata> registeredOperations() {
    return Collections.unmodifiableMap(metadataByOperation);
  }
}
