package io.studentdeals.platform.audit;

import io.studentdeals.platform.exception.InvalidQueryException;
import java.util.Locale;
import org.springframework.data.domain.Sort;

/** Ordering of audit listings by creation time. */
public enum AuditSortOrder {
  NEWEST(Sort.Direction.DESC),
  OLDEST(Sort.Direction.ASC);

  private final Sort.Direction direction;

  AuditSortOrder(Sort.Direction direction) {
    this.direction = direction;
  }

  /** Creation time first, id second so equal timestamps page deterministically. */
  public Sort toSort() {
    return Sort.by(direction, "createdAt").and(Sort.by(direction, "id"));
  }

  /** Parses {@code newest} / {@code oldest}; null or blank means {@link #NEWEST}. */
  public static AuditSortOrder fromToken(String token) {
    if (token == null || token.isBlank()) {
      return NEWEST;
    }
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "newest" -> NEWEST;
      case "oldest" -> OLDEST;
      default ->
          throw new InvalidQueryException(
              "Invalid sort", "Sort must be either \"newest\" or \"oldest\", got: " + token);
    };
  }
}
