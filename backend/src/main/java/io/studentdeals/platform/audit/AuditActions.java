package io.studentdeals.platform.audit;

import java.util.Set;

/**
 * Catalogue of the action names used across the platform. Purely informational: {@link
 * AuditAction} accepts any non-blank name, so modules can introduce new actions without touching
 * this class.
 */
public final class AuditActions {

  // Accounts
  public static final String CREATE_CORPORATE_ACCOUNT = "CREATE_CORPORATE_ACCOUNT";
  public static final String CREATE_BRANCH_ACCOUNT = "CREATE_BRANCH_ACCOUNT";
  public static final String CHANGE_PASSWORD = "CHANGE_PASSWORD";
  public static final String UPDATE_PROFILE_PICTURE = "UPDATE_PROFILE_PICTURE";

  // Offers
  public static final String CREATE_OFFER = "CREATE_OFFER";
  public static final String UPDATE_OFFER = "UPDATE_OFFER";
  public static final String DELETE_OFFER = "DELETE_OFFER";

  // Review workflows
  public static final String APPROVE_REJECT_STUDENT = "APPROVE_REJECT_STUDENT";
  public static final String APPROVE_REJECT_BRANCH = "APPROVE_REJECT_BRANCH";
  public static final String APPROVE_REJECT_OFFER = "APPROVE_REJECT_OFFER";

  // Notifications
  public static final String FLUTTER_NOTIFICATION_CLICK = "FLUTTER_NOTIFICATION_CLICK";

  // Security
  public static final String ACCESS_DENIED = "ACCESS_DENIED";

  /** Actions whose update entries are enriched with the review decision and reviewer identity. */
  public static final Set<String> REVIEW_ACTIONS =
      Set.of(APPROVE_REJECT_STUDENT, APPROVE_REJECT_BRANCH, APPROVE_REJECT_OFFER);

  private AuditActions() {}
}
