package io.studentdeals.platform.audit.interception;

/** Lifecycle of a single intercepted invocation, reported in debug logs. */
enum InterceptionState {
  PENDING,
  EXTRACTING,
  COMPOSED,
  SKIPPED,
  FAILED_SILENTLY
}
