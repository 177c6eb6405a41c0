package io.studentdeals.platform.audit.interception;

/**
 * Classification of an audited operation. Decides which snapshots are expected on the entry; it is
 * not stored.
 */
public enum OperationKind {
  CREATE,
  UPDATE,
  DELETE,
  GENERIC
}
