package io.studentdeals.platform.audit.interception;

/**
 * A business operation that can be wrapped by {@link AuditInterceptor}. Implementations run their
 * own logic only and never log audit entries themselves.
 *
 * @param <T> result type handed back to the caller
 */
@FunctionalInterface
public interface AuditedOperation<T> {

  T handle(OperationRequest request);
}
