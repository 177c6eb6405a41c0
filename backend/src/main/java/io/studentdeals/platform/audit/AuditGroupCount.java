package io.studentdeals.platform.audit;

/** One bucket of a grouped count: the grouped column value and how many entries carry it. */
public record AuditGroupCount(String value, long count) {}
