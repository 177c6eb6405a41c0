package io.studentdeals.platform.audit;

/**
 * Validated action tag. Callers define new actions freely; the only constraint is that the tag is
 * non-blank and fits the {@code action} column.
 *
 * @see AuditActions for the names currently in use
 */
public record AuditAction(String name) {

  static final int MAX_LENGTH = 100;

  public AuditAction {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("Audit action must not be blank");
    }
    name = name.trim();
    if (name.length() > MAX_LENGTH) {
      throw new IllegalArgumentException(
          "Audit action exceeds " + MAX_LENGTH + " characters: " + name);
    }
  }

  public static AuditAction of(String name) {
    return new AuditAction(name);
  }

  @Override
  public String toString() {
    return name;
  }
}
