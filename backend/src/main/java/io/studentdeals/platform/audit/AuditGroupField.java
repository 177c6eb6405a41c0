package io.studentdeals.platform.audit;

/** Columns {@link AuditLogStore#groupCount} can aggregate on. */
public enum AuditGroupField {
  ACTION,
  TABLE_NAME
}
