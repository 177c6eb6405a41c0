package io.studentdeals.platform.security;

/**
 * Platform role names as carried in the JWT {@code role} claim, and the Spring authorities they map
 * to.
 */
public final class Roles {

  public static final String STUDENT = "student";
  public static final String MERCHANT_CORPORATE = "merchant_corporate";
  public static final String MERCHANT_BRANCH = "merchant_branch";
  public static final String ADMIN = "admin";

  public static final String AUTHORITY_STUDENT = "ROLE_STUDENT";
  public static final String AUTHORITY_MERCHANT_CORPORATE = "ROLE_MERCHANT_CORPORATE";
  public static final String AUTHORITY_MERCHANT_BRANCH = "ROLE_MERCHANT_BRANCH";
  public static final String AUTHORITY_ADMIN = "ROLE_ADMIN";

  private Roles() {}
}
